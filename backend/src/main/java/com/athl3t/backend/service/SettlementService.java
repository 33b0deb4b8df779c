package com.athl3t.backend.service;

import com.athl3t.backend.exception.AlreadySettledException;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Bet;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.GameStatus;
import com.athl3t.backend.model.Parlay;
import com.athl3t.backend.model.ParlayLeg;
import com.athl3t.backend.repository.BetRepository;
import com.athl3t.backend.repository.GameRepository;
import com.athl3t.backend.repository.ParlayLegRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Applies a final score to every open wager on a game in one transaction.
 * <p>
 * Lock order: game, pending bets, pending legs, affected parlays, then every
 * account to be credited in ascending id order, the same order offer
 * acceptance uses. Placement and cancellation take the game lock first as
 * well, so they cannot interleave with a settlement of the same game.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SettlementService {

    private final GameRepository gameRepository;
    private final BetRepository betRepository;
    private final ParlayLegRepository legRepository;
    private final BetService betService;
    private final ParlayService parlayService;
    private final AccountLedgerService ledger;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional
    public SettlementReport settleGame(Long gameId, int homeScore, int awayScore) {
        if (homeScore < 0 || awayScore < 0) {
            throw new BadRequestException("Scores cannot be negative");
        }
        Game game = gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> new NotFoundException("Game not found: " + gameId));
        if (game.getStatus() != GameStatus.SCHEDULED) {
            throw new AlreadySettledException(gameId);
        }
        GameOutcome outcome = GameOutcome.of(game, homeScore, awayScore);
        game.setStatus(GameStatus.COMPLETED);
        game.setHomeScore(homeScore);
        game.setAwayScore(awayScore);
        game.setSettledAt(LocalDateTime.now(clock));
        gameRepository.save(game);

        List<Bet> bets = betRepository.findByGameIdAndStatusForUpdate(gameId, BetStatus.PENDING);
        List<ParlayLeg> legs = legRepository.findByGameIdAndStatusForUpdate(gameId, BetStatus.PENDING);
        Set<Long> parlayIds = legs.stream().map(ParlayLeg::getParlayId).collect(Collectors.toCollection(TreeSet::new));
        List<Parlay> pendingParlays = parlayService.lockParlays(parlayIds).stream()
                .filter(parlay -> parlay.getStatus() == BetStatus.PENDING)
                .toList();
        Set<Long> openParlays = pendingParlays.stream().map(Parlay::getId).collect(Collectors.toSet());

        // every account credited below, locked up front in ascending id order
        Set<Long> userIds = new TreeSet<>();
        bets.forEach(bet -> userIds.add(bet.getUserId()));
        pendingParlays.forEach(parlay -> userIds.add(parlay.getUserId()));
        ledger.lockAccounts(userIds.toArray(Long[]::new));

        int won = 0;
        int lost = 0;
        int pushed = 0;
        BigDecimal credited = MoneyUtils.ZERO;
        for (Bet bet : bets) {
            if (!betService.resolveBet(bet, outcome)) {
                continue;
            }
            switch (bet.getStatus()) {
                case WON -> {
                    won++;
                    credited = MoneyUtils.add(credited, bet.getPotentialPayout());
                }
                case PUSH -> {
                    pushed++;
                    credited = MoneyUtils.add(credited, bet.getStake());
                }
                default -> lost++;
            }
        }

        int legsResolved = 0;
        for (ParlayLeg leg : legs) {
            if (parlayService.resolveLeg(leg, outcome)) {
                legsResolved++;
            }
        }

        int parlaysDecided = 0;
        for (Long parlayId : parlayIds) {
            Parlay parlay = parlayService.recompute(parlayId);
            if (openParlays.contains(parlayId) && parlay.getStatus().isTerminal()) {
                parlaysDecided++;
                credited = MoneyUtils.add(credited, parlay.getPayout());
            }
        }

        ledgerMetrics.recordGameSettled();
        SettlementReport report = new SettlementReport(gameId, homeScore, awayScore, won, lost, pushed,
                legsResolved, parlaysDecided, credited);
        log.info("Settled game {} {}-{}: bets won={} lost={} push={}, legs={}, parlays decided={}, credited {}",
                gameId, homeScore, awayScore, won, lost, pushed, legsResolved, parlaysDecided, credited);
        return report;
    }
}
