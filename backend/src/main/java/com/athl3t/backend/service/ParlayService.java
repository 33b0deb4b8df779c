package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.Parlay;
import com.athl3t.backend.model.ParlayLeg;
import com.athl3t.backend.repository.GameRepository;
import com.athl3t.backend.repository.ParlayLegRepository;
import com.athl3t.backend.repository.ParlayRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Multi-leg wagers. Leg odds and the combined price are fixed when the parlay
 * is placed. A pushed leg drops out of the price: the payout is the stake times
 * the product of the odds of the legs that won.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ParlayService {

    private final ParlayRepository parlayRepository;
    private final ParlayLegRepository legRepository;
    private final GameRepository gameRepository;
    private final GameService gameService;
    private final OddsService oddsService;
    private final WagerValidator wagerValidator;
    private final AccountLedgerService ledger;
    private final BettingProperties bettingProperties;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional
    public ParlayTicket createParlay(Long userId, List<LegSelection> selections, BigDecimal stake) {
        BigDecimal amount = wagerValidator.requireStake(stake);
        validateSelections(selections);

        // games in ascending id order, then the account
        Map<Long, Game> games = new HashMap<>();
        for (Long gameId : new TreeSet<>(selections.stream().map(LegSelection::gameId).toList())) {
            Game game = gameRepository.findByIdForShare(gameId)
                    .orElseThrow(() -> new NotFoundException("Game not found: " + gameId));
            games.put(gameId, game);
        }
        wagerValidator.requireEligible(ledger.lockAccount(userId));
        games.values().forEach(gameService::assertBettingOpen);
        ledger.debit(userId, amount);

        List<BigDecimal> legOdds = new ArrayList<>(selections.size());
        for (LegSelection selection : selections) {
            legOdds.add(oddsService.oddsFor(games.get(selection.gameId()), selection.betType(), selection.pick()));
        }
        BigDecimal combined = oddsService.combine(legOdds);
        Parlay parlay = parlayRepository.save(Parlay.builder()
                .userId(userId)
                .stake(amount)
                .combinedOdds(MoneyUtils.price(combined))
                .potentialPayout(oddsService.payout(amount, combined))
                .status(BetStatus.PENDING)
                .placedAt(LocalDateTime.now(clock))
                .build());
        List<ParlayLeg> legs = new ArrayList<>(selections.size());
        for (int i = 0; i < selections.size(); i++) {
            LegSelection selection = selections.get(i);
            legs.add(legRepository.save(ParlayLeg.builder()
                    .parlayId(parlay.getId())
                    .gameId(selection.gameId())
                    .betType(selection.betType())
                    .pick(selection.pick())
                    .odds(legOdds.get(i))
                    .status(BetStatus.PENDING)
                    .build()));
        }
        ledgerMetrics.recordParlayCreated();
        log.info("User {} placed parlay {} with {} legs, stake {} at {} (potential {})", userId, parlay.getId(),
                legs.size(), amount, parlay.getCombinedOdds(), parlay.getPotentialPayout());
        return new ParlayTicket(parlay, legs);
    }

    /**
     * Settles one leg the way a standalone bet would be. Returns false when the
     * leg is already terminal.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean resolveLeg(ParlayLeg leg, GameOutcome outcome) {
        if (leg.getStatus().isTerminal()) {
            return false;
        }
        leg.setStatus(outcome.resultFor(leg.getBetType(), leg.getPick()));
        legRepository.save(leg);
        return true;
    }

    /**
     * Locks the given parlays in ascending id order and returns them in that order.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Parlay> lockParlays(Collection<Long> parlayIds) {
        List<Parlay> locked = new ArrayList<>();
        for (Long parlayId : new TreeSet<>(parlayIds)) {
            locked.add(parlayRepository.findByIdForUpdate(parlayId)
                    .orElseThrow(() -> new NotFoundException("Parlay not found: " + parlayId)));
        }
        return locked;
    }

    /**
     * Re-derives the parlay status from its legs and credits the payout when it
     * becomes decided. A parlay that is already terminal is returned unchanged.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Parlay recompute(Long parlayId) {
        Parlay parlay = parlayRepository.findByIdForUpdate(parlayId)
                .orElseThrow(() -> new NotFoundException("Parlay not found: " + parlayId));
        if (parlay.getStatus().isTerminal()) {
            return parlay;
        }
        List<ParlayLeg> legs = legRepository.findByParlayIdOrderByIdAsc(parlayId);
        BetStatus status = evaluate(legs);
        if (status == BetStatus.PENDING) {
            return parlay;
        }
        BigDecimal payout = switch (status) {
            case WON -> oddsService.payout(parlay.getStake(), oddsService.combine(legs.stream()
                    .filter(leg -> leg.getStatus() == BetStatus.WON)
                    .map(ParlayLeg::getOdds)
                    .toList()));
            case PUSH -> parlay.getStake();
            default -> MoneyUtils.ZERO;
        };
        parlay.setStatus(status);
        parlay.setPayout(payout);
        parlay.setSettledAt(LocalDateTime.now(clock));
        parlayRepository.save(parlay);
        ledger.credit(parlay.getUserId(), payout);
        ledgerMetrics.recordParlayDecided();
        ledgerMetrics.recordPayout(payout);
        log.info("Parlay {} decided {} (payout {})", parlayId, status, payout);
        return parlay;
    }

    @Transactional(readOnly = true)
    public List<ParlayTicket> parlaysForUser(Long userId) {
        List<Parlay> parlays = parlayRepository.findByUserIdOrderByPlacedAtDescIdDesc(userId);
        if (parlays.isEmpty()) {
            return List.of();
        }
        Map<Long, List<ParlayLeg>> legsByParlay = legRepository
                .findByParlayIdInOrderByIdAsc(parlays.stream().map(Parlay::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(ParlayLeg::getParlayId));
        return parlays.stream()
                .map(parlay -> new ParlayTicket(parlay, legsByParlay.getOrDefault(parlay.getId(), List.of())))
                .toList();
    }

    static BetStatus evaluate(List<ParlayLeg> legs) {
        boolean pending = false;
        boolean anyWon = false;
        for (ParlayLeg leg : legs) {
            switch (leg.getStatus()) {
                case LOST:
                    return BetStatus.LOST;
                case WON:
                    anyWon = true;
                    break;
                case PENDING:
                    pending = true;
                    break;
                default:
                    break;
            }
        }
        if (pending) {
            return BetStatus.PENDING;
        }
        return anyWon ? BetStatus.WON : BetStatus.PUSH;
    }

    private void validateSelections(List<LegSelection> selections) {
        int minLegs = bettingProperties.getParlay().getMinLegs();
        int maxLegs = bettingProperties.getParlay().getMaxLegs();
        if (selections == null || selections.size() < minLegs) {
            throw new BadRequestException("A parlay needs at least " + minLegs + " legs");
        }
        if (selections.size() > maxLegs) {
            throw new BadRequestException("A parlay allows at most " + maxLegs + " legs");
        }
        Set<String> seen = new HashSet<>();
        for (LegSelection selection : selections) {
            if (selection == null || selection.gameId() == null) {
                throw new BadRequestException("Every leg needs a game");
            }
            wagerValidator.requirePick(selection.betType(), selection.pick());
            if (!seen.add(selection.gameId() + ":" + selection.betType())) {
                throw new BadRequestException("Duplicate leg for game " + selection.gameId() + " " + selection.betType());
            }
        }
    }

    public record LegSelection(Long gameId, BetType betType, BetPick pick) {
    }
}
