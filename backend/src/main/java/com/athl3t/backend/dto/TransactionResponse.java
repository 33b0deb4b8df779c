package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TransactionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private Long id;
    private LocalDateTime occurredAt;
    private Long userId;
    private TransactionKind kind;
    private AssetType assetType;
    private String assetName;
    private BigDecimal unitPrice;
    private int quantity;
    private BigDecimal costBasisPrice;
    private BigDecimal profitLoss;

    public static TransactionResponse from(LedgerTransaction tx) {
        return TransactionResponse.builder()
                .id(tx.getId())
                .occurredAt(tx.getOccurredAt())
                .userId(tx.getUserId())
                .kind(tx.getKind())
                .assetType(tx.getAssetType())
                .assetName(tx.getAssetName())
                .unitPrice(tx.getUnitPrice())
                .quantity(tx.getQuantity())
                .costBasisPrice(tx.getCostBasisPrice())
                .profitLoss(tx.getProfitLoss())
                .build();
    }
}
