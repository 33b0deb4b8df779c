package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSummary {

    private Long userId;
    private BigDecimal totalInvested;
    private BigDecimal totalSold;
    private BigDecimal realizedProfitLoss;
    private int buyCount;
    private int sellCount;
    private int tradeInCount;
    private int tradeOutCount;
    private int profitableSells;
    private int losingSells;
    private BigDecimal profitLossLast7Days;
    private BigDecimal profitLossLast30Days;
    private Map<AssetType, AssetTypeBreakdown> byAssetType;
    private LocalDateTime lastTransactionAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssetTypeBreakdown {
        private BigDecimal invested;
        private BigDecimal sold;
        private BigDecimal realizedProfitLoss;
        private int transactions;
    }
}
