package com.athl3t.backend.service;

import com.athl3t.backend.exception.ConflictException;
import com.athl3t.backend.exception.ForbiddenException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Bet;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.repository.BetRepository;
import com.athl3t.backend.repository.GameRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Single wagers. A bet is PENDING from placement until settlement moves it to
 * WON, LOST or PUSH, or the owner cancels it while the game is still open.
 * Terminal bets never change again.
 * <p>
 * Lock order: game, then bet, then account.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BetService {

    private final BetRepository betRepository;
    private final GameRepository gameRepository;
    private final GameService gameService;
    private final OddsService oddsService;
    private final AccountLedgerService ledger;
    private final WagerValidator wagerValidator;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional
    public Bet placeBet(Long userId, Long gameId, BetType betType, BetPick pick, BigDecimal stake) {
        BigDecimal amount = wagerValidator.requireStake(stake);
        wagerValidator.requirePick(betType, pick);
        Game game = gameRepository.findByIdForShare(gameId)
                .orElseThrow(() -> new NotFoundException("Game not found: " + gameId));
        wagerValidator.requireEligible(ledger.lockAccount(userId));
        gameService.assertBettingOpen(game);
        ledger.debit(userId, amount);

        BigDecimal odds = oddsService.oddsFor(game, betType, pick);
        Bet bet = betRepository.save(Bet.builder()
                .userId(userId)
                .gameId(gameId)
                .betType(betType)
                .pick(pick)
                .stake(amount)
                .odds(odds)
                .potentialPayout(oddsService.payout(amount, odds))
                .status(BetStatus.PENDING)
                .placedAt(LocalDateTime.now(clock))
                .build());
        ledgerMetrics.recordBetPlaced();
        log.info("User {} placed bet {} on game {}: {} {} stake {} at {}", userId, bet.getId(), gameId, betType, pick,
                amount, odds);
        return bet;
    }

    /**
     * Moves a pending bet to its settled state and credits the winnings. Returns
     * false without touching anything when the bet is already terminal.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean resolveBet(Bet bet, GameOutcome outcome) {
        if (bet.getStatus().isTerminal()) {
            return false;
        }
        BetStatus result = outcome.resultFor(bet.getBetType(), bet.getPick());
        BigDecimal credit = switch (result) {
            case WON -> bet.getPotentialPayout();
            case PUSH -> bet.getStake();
            default -> MoneyUtils.ZERO;
        };
        bet.setStatus(result);
        bet.setSettledAt(LocalDateTime.now(clock));
        betRepository.save(bet);
        ledger.credit(bet.getUserId(), credit);
        ledgerMetrics.recordBetResolved(result);
        ledgerMetrics.recordPayout(credit);
        log.debug("Bet {} resolved {} (credit {})", bet.getId(), result, credit);
        return true;
    }

    @Transactional
    public Bet cancelBet(Long userId, Long betId) {
        Bet snapshot = betRepository.findById(betId)
                .orElseThrow(() -> new NotFoundException("Bet not found: " + betId));
        if (!snapshot.getUserId().equals(userId)) {
            throw new ForbiddenException("Bet " + betId + " belongs to another user");
        }
        Game game = gameRepository.findByIdForShare(snapshot.getGameId())
                .orElseThrow(() -> new NotFoundException("Game not found: " + snapshot.getGameId()));
        Bet bet = betRepository.findByIdForUpdate(betId)
                .orElseThrow(() -> new NotFoundException("Bet not found: " + betId));
        if (bet.getStatus() != BetStatus.PENDING) {
            throw new ConflictException("Only pending bets can be cancelled");
        }
        gameService.assertBettingOpen(game);
        bet.setStatus(BetStatus.CANCELLED);
        bet.setSettledAt(LocalDateTime.now(clock));
        betRepository.save(bet);
        ledger.credit(userId, bet.getStake());
        ledgerMetrics.recordBetCancelled();
        log.info("User {} cancelled bet {}; refunded {}", userId, betId, bet.getStake());
        return bet;
    }

    @Transactional(readOnly = true)
    public List<Bet> betsForUser(Long userId) {
        return betRepository.findByUserIdOrderByPlacedAtDescIdDesc(userId);
    }
}
