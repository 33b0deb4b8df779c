package com.athl3t.backend.service;

import com.athl3t.backend.dto.PerformanceSummary;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Account;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.TradeSide;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerformanceServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private PerformanceService performanceService;

    @Autowired
    private TradeOfferService tradeOfferService;

    @Test
    void summarizesRealizedProfitAndActivity() {
        Account account = newAdult();
        Account friend = newAdult();
        buy(account.getId(), "Justin Jefferson", "10.00", 4);
        buy(account.getId(), "Lamar Jackson", "20.00", 2);
        marketTradeService.executeTrade(account.getId(), AssetType.PLAYER, "Justin Jefferson", TradeSide.SELL,
                money("12.50"), 2);
        marketTradeService.executeTrade(account.getId(), AssetType.PLAYER, "Lamar Jackson", TradeSide.SELL,
                money("18.00"), 1);
        TradeOfferDetails offer = tradeOfferService.createOffer(account.getId(),
                List.of(new TradeOfferService.OfferAsset(AssetType.PLAYER, "Justin Jefferson", 1)), List.of(),
                friend.getId(), null);
        tradeOfferService.acceptOffer(offer.offer().getId(), friend.getId());

        PerformanceSummary summary = performanceService.summary(account.getId());

        assertThat(summary.getTotalInvested()).isEqualByComparingTo("80.00");
        assertThat(summary.getTotalSold()).isEqualByComparingTo("43.00");
        assertThat(summary.getRealizedProfitLoss()).isEqualByComparingTo("3.00");
        assertThat(summary.getBuyCount()).isEqualTo(2);
        assertThat(summary.getSellCount()).isEqualTo(2);
        assertThat(summary.getTradeOutCount()).isEqualTo(1);
        assertThat(summary.getTradeInCount()).isZero();
        assertThat(summary.getProfitableSells()).isEqualTo(1);
        assertThat(summary.getLosingSells()).isEqualTo(1);
        assertThat(summary.getProfitLossLast7Days()).isEqualByComparingTo("3.00");
        assertThat(summary.getByAssetType()).containsOnlyKeys(AssetType.PLAYER);
        assertThat(summary.getByAssetType().get(AssetType.PLAYER).getTransactions()).isEqualTo(5);
        assertThat(summary.getLastTransactionAt()).isNotNull();
    }

    @Test
    void emptyAccountHasZeroTotals() {
        Account account = newAdult();

        PerformanceSummary summary = performanceService.summary(account.getId());

        assertThat(summary.getRealizedProfitLoss()).isEqualByComparingTo("0.00");
        assertThat(summary.getByAssetType()).isEmpty();
        assertThat(summary.getLastTransactionAt()).isNull();
    }

    @Test
    void unknownAccountIsNotFound() {
        assertThatThrownBy(() -> performanceService.summary(-42L)).isInstanceOf(NotFoundException.class);
    }
}
