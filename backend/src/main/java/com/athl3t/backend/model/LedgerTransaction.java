package com.athl3t.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only record of an ownership change. No setters: rows are written once.
 */
@Entity
@Table(name = "transactions")
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private TransactionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, updatable = false, length = 20)
    private AssetType assetType;

    @Column(name = "asset_name", nullable = false, updatable = false, length = 100)
    private String assetName;

    @Column(name = "unit_price", updatable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "qty", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "cost_basis_price", updatable = false, precision = 19, scale = 4)
    private BigDecimal costBasisPrice;

    @Column(name = "profit_loss", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal profitLoss;
}
