package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TransactionKind;
import com.athl3t.backend.repository.LedgerTransactionRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.List;

/**
 * Append-only ownership history and the average-cost basis derived from it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionLogService {

    private static final EnumSet<TransactionKind> ACQUISITIONS = EnumSet.of(TransactionKind.BUY, TransactionKind.TRADE_IN);

    private final LedgerTransactionRepository transactionRepository;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public LedgerTransaction record(LedgerTransaction entry) {
        if (entry.getId() != null) {
            throw new BadRequestException("Ledger transactions are append-only");
        }
        LedgerTransaction saved = transactionRepository.save(entry);
        ledgerMetrics.recordTransaction(saved.getKind());
        log.debug("Recorded {} {} x{} {} for user {}", saved.getKind(), saved.getAssetType(), saved.getQuantity(),
                saved.getAssetName(), saved.getUserId());
        return saved;
    }

    /**
     * Quantity-weighted mean unit price of the user's priced acquisitions of an
     * asset, or {@code fallbackPrice} when there are none.
     */
    @Transactional(readOnly = true)
    public BigDecimal averageCost(Long userId, AssetType assetType, String assetName, BigDecimal fallbackPrice) {
        List<LedgerTransaction> acquisitions = transactionRepository
                .findByUserIdAndAssetTypeAndAssetNameAndKindIn(userId, assetType, assetName, ACQUISITIONS);
        BigDecimal totalCost = BigDecimal.ZERO;
        long totalQuantity = 0;
        for (LedgerTransaction row : acquisitions) {
            if (row.getUnitPrice() == null) {
                continue;
            }
            totalCost = totalCost.add(row.getUnitPrice().multiply(BigDecimal.valueOf(row.getQuantity())));
            totalQuantity += row.getQuantity();
        }
        if (totalQuantity == 0) {
            return fallbackPrice == null ? null : MoneyUtils.price(fallbackPrice);
        }
        return totalCost.divide(BigDecimal.valueOf(totalQuantity), MoneyUtils.PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Realized profit of selling {@code quantity} shares at {@code salePrice}
     * against the current average cost. Must be called before the sale itself
     * is recorded.
     */
    @Transactional(readOnly = true)
    public RealizedSale realizeSell(Long userId, AssetType assetType, String assetName, BigDecimal salePrice, int quantity) {
        BigDecimal costBasis = averageCost(userId, assetType, assetName, salePrice);
        BigDecimal profitLoss = MoneyUtils.scale(salePrice.subtract(costBasis).multiply(BigDecimal.valueOf(quantity)));
        return new RealizedSale(costBasis, profitLoss);
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> history(Long userId) {
        return transactionRepository.findByUserIdOrderByOccurredAtDescIdDesc(userId);
    }

    public record RealizedSale(BigDecimal costBasisPrice, BigDecimal profitLoss) {
    }
}
