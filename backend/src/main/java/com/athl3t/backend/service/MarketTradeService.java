package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.InsufficientHoldingsException;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TradeSide;
import com.athl3t.backend.model.TransactionKind;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Buys and sells against the market price supplied by the caller. Each call is
 * one transaction spanning ledger, holdings and log, so a failure at any step
 * leaves all three untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketTradeService {

    private final AccountLedgerService ledger;
    private final HoldingsRegistry holdingsRegistry;
    private final TransactionLogService transactionLog;
    private final Clock clock;

    @Transactional
    public LedgerTransaction executeTrade(Long userId, AssetType assetType, String assetName, TradeSide side,
                                          BigDecimal unitPrice, int quantity) {
        if (side == null) {
            throw new BadRequestException("Trade side is required");
        }
        if (assetType == null) {
            throw new BadRequestException("Asset type is required");
        }
        if (!MoneyUtils.isPositive(unitPrice)) {
            throw new BadRequestException("Unit price must be greater than zero");
        }
        if (quantity <= 0) {
            throw new BadRequestException("Quantity must be greater than zero");
        }
        String name = HoldingsRegistry.normalizeName(assetName);
        BigDecimal price = MoneyUtils.price(unitPrice);
        if (!MoneyUtils.isPositive(MoneyUtils.multiply(price, quantity))) {
            throw new BadRequestException("Trade total rounds to zero; raise the unit price or quantity");
        }
        return side == TradeSide.BUY
                ? buy(userId, assetType, name, price, quantity)
                : sell(userId, assetType, name, price, quantity);
    }

    private LedgerTransaction buy(Long userId, AssetType assetType, String assetName, BigDecimal price, int quantity) {
        BigDecimal cost = MoneyUtils.multiply(price, quantity);
        ledger.debit(userId, cost);
        holdingsRegistry.increase(userId, assetType, assetName, quantity);
        LedgerTransaction recorded = transactionLog.record(LedgerTransaction.builder()
                .occurredAt(LocalDateTime.now(clock))
                .userId(userId)
                .kind(TransactionKind.BUY)
                .assetType(assetType)
                .assetName(assetName)
                .unitPrice(price)
                .quantity(quantity)
                .costBasisPrice(price)
                .profitLoss(MoneyUtils.ZERO)
                .build());
        log.info("User {} bought {} x {} {} at {} (total {})", userId, quantity, assetType, assetName, price, cost);
        return recorded;
    }

    private LedgerTransaction sell(Long userId, AssetType assetType, String assetName, BigDecimal price, int quantity) {
        ledger.lockAccount(userId);
        int held = holdingsRegistry.quantity(userId, assetType, assetName);
        if (held < quantity) {
            throw new InsufficientHoldingsException(userId, assetType, assetName, quantity, held);
        }
        TransactionLogService.RealizedSale realized = transactionLog.realizeSell(userId, assetType, assetName, price, quantity);
        holdingsRegistry.decrease(userId, assetType, assetName, quantity);
        BigDecimal proceeds = MoneyUtils.multiply(price, quantity);
        ledger.credit(userId, proceeds);
        LedgerTransaction recorded = transactionLog.record(LedgerTransaction.builder()
                .occurredAt(LocalDateTime.now(clock))
                .userId(userId)
                .kind(TransactionKind.SELL)
                .assetType(assetType)
                .assetName(assetName)
                .unitPrice(price)
                .quantity(quantity)
                .costBasisPrice(realized.costBasisPrice())
                .profitLoss(realized.profitLoss())
                .build());
        log.info("User {} sold {} x {} {} at {} (P/L {})", userId, quantity, assetType, assetName, price,
                realized.profitLoss());
        return recorded;
    }
}
