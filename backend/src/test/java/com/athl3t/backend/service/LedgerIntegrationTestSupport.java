package com.athl3t.backend.service;

import com.athl3t.backend.model.Account;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.TradeSide;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Shared Spring context and fixtures for service tests running against the
 * H2 schema built by Flyway. Every test works on freshly opened accounts, so
 * no table cleanup is needed between tests.
 */
@SpringBootTest
abstract class LedgerIntegrationTestSupport {

    static final LocalDate ADULT_BIRTHDATE = LocalDate.of(1990, 5, 17);

    @Autowired
    protected AccountService accountService;

    @Autowired
    protected AccountLedgerService ledger;

    @Autowired
    protected HoldingsRegistry holdingsRegistry;

    @Autowired
    protected MarketTradeService marketTradeService;

    @Autowired
    protected TransactionLogService transactionLogService;

    @Autowired
    protected GameService gameService;

    protected Account newAdult() {
        return accountService.openAccount("adult-" + UUID.randomUUID(), ADULT_BIRTHDATE);
    }

    protected Account newMinor() {
        return accountService.openAccount("minor-" + UUID.randomUUID(), LocalDate.now().minusYears(19));
    }

    protected Game newGame() {
        return newGame(new BigDecimal("-3.5"), new BigDecimal("44.5"));
    }

    protected Game newGame(BigDecimal spread, BigDecimal totalLine) {
        return gameService.scheduleGame("Home " + UUID.randomUUID(), "Away " + UUID.randomUUID(),
                LocalDateTime.now().plusDays(1), new BigDecimal("1.91"), new BigDecimal("2.05"), spread, totalLine);
    }

    protected Game startedGame() {
        return gameService.scheduleGame("Home " + UUID.randomUUID(), "Away " + UUID.randomUUID(),
                LocalDateTime.now().minusMinutes(5), new BigDecimal("1.91"), new BigDecimal("2.05"),
                new BigDecimal("-3.5"), new BigDecimal("44.5"));
    }

    protected void buy(Long userId, String assetName, String price, int quantity) {
        marketTradeService.executeTrade(userId, AssetType.PLAYER, assetName, TradeSide.BUY, new BigDecimal(price), quantity);
    }

    protected BigDecimal balance(Long userId) {
        return ledger.balance(userId);
    }

    protected static BigDecimal money(String value) {
        return new BigDecimal(value);
    }
}
