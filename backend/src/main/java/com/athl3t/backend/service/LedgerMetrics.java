package com.athl3t.backend.service;

import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.TransactionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class LedgerMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<TransactionKind, Counter> tradesByKind = new EnumMap<>(TransactionKind.class);
    private final Map<BetStatus, Counter> betsResolvedByOutcome = new EnumMap<>(BetStatus.class);
    private Counter betsPlacedCounter;
    private Counter betsCancelledCounter;
    private Counter parlaysCreatedCounter;
    private Counter parlaysDecidedCounter;
    private Counter gamesSettledCounter;
    private Counter payoutsCreditedCounter;
    private Counter offersAcceptedCounter;
    private Counter idempotentReplaysCounter;

    @PostConstruct
    void init() {
        for (TransactionKind kind : TransactionKind.values()) {
            tradesByKind.put(kind, Counter.builder("ledger_transactions_total")
                    .tag("kind", kind.name())
                    .register(meterRegistry));
        }
        for (BetStatus status : BetStatus.values()) {
            if (status.isTerminal()) {
                betsResolvedByOutcome.put(status, Counter.builder("bets_resolved_total")
                        .tag("outcome", status.name())
                        .register(meterRegistry));
            }
        }
        betsPlacedCounter = Counter.builder("bets_placed_total").register(meterRegistry);
        betsCancelledCounter = Counter.builder("bets_cancelled_total").register(meterRegistry);
        parlaysCreatedCounter = Counter.builder("parlays_created_total").register(meterRegistry);
        parlaysDecidedCounter = Counter.builder("parlays_decided_total").register(meterRegistry);
        gamesSettledCounter = Counter.builder("games_settled_total").register(meterRegistry);
        payoutsCreditedCounter = Counter.builder("payouts_credited_amount_total").baseUnit("dollars").register(meterRegistry);
        offersAcceptedCounter = Counter.builder("trade_offers_accepted_total").register(meterRegistry);
        idempotentReplaysCounter = Counter.builder("idempotent_replays_total").register(meterRegistry);
    }

    public void recordTransaction(TransactionKind kind) {
        Counter counter = tradesByKind.get(kind);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordBetPlaced() {
        if (betsPlacedCounter != null) {
            betsPlacedCounter.increment();
        }
    }

    public void recordBetCancelled() {
        if (betsCancelledCounter != null) {
            betsCancelledCounter.increment();
        }
    }

    public void recordBetResolved(BetStatus outcome) {
        Counter counter = betsResolvedByOutcome.get(outcome);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordParlayCreated() {
        if (parlaysCreatedCounter != null) {
            parlaysCreatedCounter.increment();
        }
    }

    public void recordParlayDecided() {
        if (parlaysDecidedCounter != null) {
            parlaysDecidedCounter.increment();
        }
    }

    public void recordGameSettled() {
        if (gamesSettledCounter != null) {
            gamesSettledCounter.increment();
        }
    }

    public void recordPayout(BigDecimal amount) {
        if (payoutsCreditedCounter != null && amount != null && amount.signum() > 0) {
            payoutsCreditedCounter.increment(amount.doubleValue());
        }
    }

    public void recordOfferAccepted() {
        if (offersAcceptedCounter != null) {
            offersAcceptedCounter.increment();
        }
    }

    public void recordIdempotentReplay() {
        if (idempotentReplaysCounter != null) {
            idempotentReplaysCounter.increment();
        }
    }
}
