package com.athl3t.backend.service;

import com.athl3t.backend.dto.PerformanceSummary;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.repository.AccountRepository;
import com.athl3t.backend.repository.LedgerTransactionRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Realized trading performance from the transaction log. Valuing open holdings
 * needs live prices and is left to the caller.
 */
@Service
@RequiredArgsConstructor
public class PerformanceService {

    private final LedgerTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PerformanceSummary summary(Long userId) {
        if (!accountRepository.existsById(userId)) {
            throw new NotFoundException("Account not found: " + userId);
        }
        List<LedgerTransaction> rows = transactionRepository.findByUserIdOrderByOccurredAtDescIdDesc(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime weekAgo = now.minusDays(7);
        LocalDateTime monthAgo = now.minusDays(30);

        BigDecimal invested = MoneyUtils.ZERO;
        BigDecimal sold = MoneyUtils.ZERO;
        BigDecimal realized = MoneyUtils.ZERO;
        BigDecimal lastWeek = MoneyUtils.ZERO;
        BigDecimal lastMonth = MoneyUtils.ZERO;
        int buys = 0;
        int sells = 0;
        int tradeIns = 0;
        int tradeOuts = 0;
        int profitable = 0;
        int losing = 0;
        Map<AssetType, PerformanceSummary.AssetTypeBreakdown> byType = new EnumMap<>(AssetType.class);

        for (LedgerTransaction row : rows) {
            PerformanceSummary.AssetTypeBreakdown breakdown = byType.computeIfAbsent(row.getAssetType(),
                    type -> PerformanceSummary.AssetTypeBreakdown.builder()
                            .invested(MoneyUtils.ZERO)
                            .sold(MoneyUtils.ZERO)
                            .realizedProfitLoss(MoneyUtils.ZERO)
                            .build());
            breakdown.setTransactions(breakdown.getTransactions() + 1);
            switch (row.getKind()) {
                case BUY -> {
                    buys++;
                    BigDecimal cost = MoneyUtils.multiply(row.getUnitPrice(), row.getQuantity());
                    invested = MoneyUtils.add(invested, cost);
                    breakdown.setInvested(MoneyUtils.add(breakdown.getInvested(), cost));
                }
                case SELL -> {
                    sells++;
                    BigDecimal proceeds = MoneyUtils.multiply(row.getUnitPrice(), row.getQuantity());
                    BigDecimal pnl = row.getProfitLoss();
                    sold = MoneyUtils.add(sold, proceeds);
                    realized = MoneyUtils.add(realized, pnl);
                    breakdown.setSold(MoneyUtils.add(breakdown.getSold(), proceeds));
                    breakdown.setRealizedProfitLoss(MoneyUtils.add(breakdown.getRealizedProfitLoss(), pnl));
                    if (pnl.signum() > 0) {
                        profitable++;
                    } else if (pnl.signum() < 0) {
                        losing++;
                    }
                    if (row.getOccurredAt().isAfter(weekAgo)) {
                        lastWeek = MoneyUtils.add(lastWeek, pnl);
                    }
                    if (row.getOccurredAt().isAfter(monthAgo)) {
                        lastMonth = MoneyUtils.add(lastMonth, pnl);
                    }
                }
                case TRADE_IN -> tradeIns++;
                case TRADE_OUT -> tradeOuts++;
            }
        }

        return PerformanceSummary.builder()
                .userId(userId)
                .totalInvested(invested)
                .totalSold(sold)
                .realizedProfitLoss(realized)
                .buyCount(buys)
                .sellCount(sells)
                .tradeInCount(tradeIns)
                .tradeOutCount(tradeOuts)
                .profitableSells(profitable)
                .losingSells(losing)
                .profitLossLast7Days(lastWeek)
                .profitLossLast30Days(lastMonth)
                .byAssetType(byType)
                .lastTransactionAt(rows.isEmpty() ? null : rows.get(0).getOccurredAt())
                .build();
    }
}
