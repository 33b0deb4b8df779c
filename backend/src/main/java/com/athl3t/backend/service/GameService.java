package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.BettingClosedException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.GameStatus;
import com.athl3t.backend.repository.GameRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class GameService {

    private static final int MAX_UPCOMING = 100;

    private final GameRepository gameRepository;
    private final BettingProperties bettingProperties;
    private final Clock clock;

    @Transactional
    public Game scheduleGame(String homeTeam, String awayTeam, LocalDateTime scheduledAt,
                             BigDecimal homeOdds, BigDecimal awayOdds, BigDecimal spread, BigDecimal totalLine) {
        if (homeTeam == null || homeTeam.isBlank() || awayTeam == null || awayTeam.isBlank()) {
            throw new BadRequestException("Both teams are required");
        }
        if (homeTeam.trim().equalsIgnoreCase(awayTeam.trim())) {
            throw new BadRequestException("A team cannot play itself");
        }
        if (scheduledAt == null) {
            throw new BadRequestException("Scheduled time is required");
        }
        requireOdds(homeOdds, "Home odds");
        requireOdds(awayOdds, "Away odds");
        if (totalLine == null || totalLine.signum() <= 0) {
            throw new BadRequestException("Total line must be greater than zero");
        }
        Game game = Game.builder()
                .homeTeam(homeTeam.trim())
                .awayTeam(awayTeam.trim())
                .scheduledAt(scheduledAt)
                .homeOdds(MoneyUtils.price(homeOdds))
                .awayOdds(MoneyUtils.price(awayOdds))
                .spread(line(spread == null ? BigDecimal.ZERO : spread, "Spread"))
                .totalLine(line(totalLine, "Total line"))
                .status(GameStatus.SCHEDULED)
                .createdAt(LocalDateTime.now(clock))
                .build();
        Game saved = gameRepository.save(game);
        log.info("Scheduled game {}: {} vs {} at {}", saved.getId(), saved.getHomeTeam(), saved.getAwayTeam(), scheduledAt);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Game> upcomingGames(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_UPCOMING));
        return gameRepository.findByStatusAndScheduledAtAfterOrderByScheduledAtAsc(
                GameStatus.SCHEDULED, LocalDateTime.now(clock), PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public Game getGame(Long gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new NotFoundException("Game not found: " + gameId));
    }

    /**
     * Wagers are accepted on scheduled games until the configured cutoff before start.
     */
    public void assertBettingOpen(Game game) {
        if (!isBettingOpen(game)) {
            throw new BettingClosedException(game.getId());
        }
    }

    public boolean isBettingOpen(Game game) {
        LocalDateTime closesAt = game.getScheduledAt().minus(bettingProperties.getCloseCutoff());
        return game.getStatus() == GameStatus.SCHEDULED && LocalDateTime.now(clock).isBefore(closesAt);
    }

    private static void requireOdds(BigDecimal odds, String label) {
        if (odds == null || odds.compareTo(BigDecimal.ONE) <= 0) {
            throw new BadRequestException(label + " must be greater than 1.0");
        }
    }

    private static BigDecimal line(BigDecimal value, String label) {
        try {
            return value.setScale(1, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException ex) {
            throw new BadRequestException(label + " supports at most one decimal place");
        }
    }
}
