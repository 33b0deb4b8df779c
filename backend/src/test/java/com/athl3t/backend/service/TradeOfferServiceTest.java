package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.ForbiddenException;
import com.athl3t.backend.exception.InsufficientHoldingsException;
import com.athl3t.backend.exception.StaleOfferException;
import com.athl3t.backend.model.Account;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TradeOfferStatus;
import com.athl3t.backend.model.TradeSide;
import com.athl3t.backend.model.TransactionKind;
import com.athl3t.backend.repository.TradeOfferRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeOfferServiceTest extends LedgerIntegrationTestSupport {

    private static final String MAHOMES = "Patrick Mahomes";
    private static final String KELCE = "Travis Kelce";

    @Autowired
    private TradeOfferService tradeOfferService;

    @Autowired
    private TradeOfferRepository offerRepository;

    @Test
    void acceptedSwapMovesHoldingsBothWaysAndCarriesCostBasis() {
        Account alice = newAdult();
        Account bob = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 3);
        buy(bob.getId(), KELCE, "20.00", 2);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 2)), List.of(player(KELCE, 1)), bob.getId(), "two for one");

        TradeOfferDetails accepted = tradeOfferService.acceptOffer(offer.offer().getId(), bob.getId());

        assertThat(accepted.offer().getStatus()).isEqualTo(TradeOfferStatus.ACCEPTED);
        assertThat(accepted.offer().getAcceptedBy()).isEqualTo(bob.getId());
        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(1);
        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, KELCE)).isEqualTo(1);
        assertThat(holdingsRegistry.quantity(bob.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(2);
        assertThat(holdingsRegistry.quantity(bob.getId(), AssetType.PLAYER, KELCE)).isEqualTo(1);
        assertThat(balance(alice.getId())).isEqualByComparingTo("120.00");
        assertThat(balance(bob.getId())).isEqualByComparingTo("110.00");

        LedgerTransaction tradeIn = transactionLogService.history(bob.getId()).stream()
                .filter(row -> row.getKind() == TransactionKind.TRADE_IN)
                .findFirst()
                .orElseThrow();
        assertThat(tradeIn.getAssetName()).isEqualTo(MAHOMES);
        assertThat(tradeIn.getQuantity()).isEqualTo(2);
        assertThat(tradeIn.getUnitPrice()).isEqualByComparingTo("10.00");
        assertThat(transactionLogService.history(alice.getId()))
                .extracting(LedgerTransaction::getKind)
                .contains(TransactionKind.TRADE_OUT, TransactionKind.TRADE_IN);

        LedgerTransaction sale = marketTradeService.executeTrade(bob.getId(), AssetType.PLAYER, MAHOMES,
                TradeSide.SELL, money("12.00"), 2);
        assertThat(sale.getCostBasisPrice()).isEqualByComparingTo("10.00");
        assertThat(sale.getProfitLoss()).isEqualByComparingTo("4.00");
    }

    @Test
    void acceptorWhoNoLongerHoldsTheRequestedAssetsChangesNothing() {
        Account alice = newAdult();
        Account bob = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 1);
        buy(bob.getId(), KELCE, "20.00", 2);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(player(KELCE, 2)), bob.getId(), null);
        marketTradeService.executeTrade(bob.getId(), AssetType.PLAYER, KELCE, TradeSide.SELL, money("20.00"), 1);

        assertThatThrownBy(() -> tradeOfferService.acceptOffer(offer.offer().getId(), bob.getId()))
                .isInstanceOf(InsufficientHoldingsException.class);

        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(1);
        assertThat(holdingsRegistry.quantity(bob.getId(), AssetType.PLAYER, KELCE)).isEqualTo(1);
        assertThat(holdingsRegistry.quantity(bob.getId(), AssetType.PLAYER, MAHOMES)).isZero();
        assertThat(statusOf(offer)).isEqualTo(TradeOfferStatus.PENDING);
    }

    @Test
    void offerIsStaleOnceTheInitiatorSoldWhatTheyOffered() {
        Account alice = newAdult();
        Account bob = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 3);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 3)), List.of(), null, "free to a good home");
        marketTradeService.executeTrade(alice.getId(), AssetType.PLAYER, MAHOMES, TradeSide.SELL, money("11.00"), 1);

        assertThatThrownBy(() -> tradeOfferService.acceptOffer(offer.offer().getId(), bob.getId()))
                .isInstanceOf(StaleOfferException.class);
        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(2);
        assertThat(statusOf(offer)).isEqualTo(TradeOfferStatus.PENDING);
    }

    @Test
    void onlyTheAddresseeMayAcceptADirectedOffer() {
        Account alice = newAdult();
        Account bob = newAdult();
        Account carol = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 1);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), bob.getId(), null);

        assertThatThrownBy(() -> tradeOfferService.acceptOffer(offer.offer().getId(), carol.getId()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> tradeOfferService.acceptOffer(offer.offer().getId(), alice.getId()))
                .isInstanceOf(ForbiddenException.class);
        assertThat(statusOf(offer)).isEqualTo(TradeOfferStatus.PENDING);
    }

    @Test
    void openOfferCanBeAcceptedByAnyoneElse() {
        Account alice = newAdult();
        Account carol = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 1);
        buy(carol.getId(), KELCE, "15.00", 1);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(player(KELCE, 1)), null, null);

        tradeOfferService.acceptOffer(offer.offer().getId(), carol.getId());

        assertThat(holdingsRegistry.holdings(alice.getId()))
                .singleElement()
                .satisfies(holding -> assertThat(holding.getAssetName()).isEqualTo(KELCE));
        assertThat(holdingsRegistry.holdings(carol.getId()))
                .singleElement()
                .satisfies(holding -> assertThat(holding.getAssetName()).isEqualTo(MAHOMES));
        assertThatThrownBy(() -> tradeOfferService.acceptOffer(offer.offer().getId(), carol.getId()))
                .isInstanceOf(StaleOfferException.class);
    }

    @Test
    void recipientRejectsAndCreatorCancels() {
        Account alice = newAdult();
        Account bob = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 2);
        TradeOfferDetails directed = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), bob.getId(), null);
        TradeOfferDetails open = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), null, null);

        assertThatThrownBy(() -> tradeOfferService.rejectOffer(directed.offer().getId(), alice.getId()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> tradeOfferService.rejectOffer(open.offer().getId(), bob.getId()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> tradeOfferService.cancelOffer(open.offer().getId(), bob.getId()))
                .isInstanceOf(ForbiddenException.class);

        assertThat(tradeOfferService.rejectOffer(directed.offer().getId(), bob.getId()).offer().getStatus())
                .isEqualTo(TradeOfferStatus.REJECTED);
        assertThat(tradeOfferService.cancelOffer(open.offer().getId(), alice.getId()).offer().getStatus())
                .isEqualTo(TradeOfferStatus.CANCELLED);
        assertThatThrownBy(() -> tradeOfferService.cancelOffer(directed.offer().getId(), alice.getId()))
                .isInstanceOf(StaleOfferException.class);
        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(2);
    }

    @Test
    void createRejectsInvalidOffers() {
        Account alice = newAdult();
        Account bob = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 1);

        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(), List.of(), List.of(), bob.getId(), null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(player(" " + MAHOMES + " ", 1)), bob.getId(), null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 2)), List.of(), bob.getId(), null))
                .isInstanceOf(InsufficientHoldingsException.class);
        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), alice.getId(), null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 0)), List.of(), bob.getId(), null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), bob.getId(), "x".repeat(501)))
                .isInstanceOf(BadRequestException.class);
        assertThat(tradeOfferService.offersBy(alice.getId())).isEmpty();
    }

    @Test
    void listsActionableOffersAndOffersMade() {
        Account alice = newAdult();
        Account bob = newAdult();
        Account carol = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 3);
        Long toBob = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), bob.getId(), null).offer().getId();
        Long toCarol = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), carol.getId(), null).offer().getId();
        Long open = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), null, null).offer().getId();

        assertThat(tradeOfferService.pendingOffersFor(bob.getId()))
                .extracting(details -> details.offer().getId())
                .contains(toBob, open)
                .doesNotContain(toCarol);
        assertThat(tradeOfferService.pendingOffersFor(alice.getId()))
                .extracting(details -> details.offer().getId())
                .doesNotContain(toBob, toCarol, open);
        assertThat(tradeOfferService.offersBy(alice.getId()))
                .extracting(details -> details.offer().getId())
                .containsExactly(open, toCarol, toBob);
        assertThat(tradeOfferService.offersBy(alice.getId()).get(0).offered())
                .singleElement()
                .satisfies(asset -> assertThat(asset.getQuantity()).isEqualTo(1));
    }

    @Test
    void racingAcceptorsLeaveExactlyOneWinner() throws Exception {
        Account alice = newAdult();
        Account bob = newAdult();
        Account carol = newAdult();
        buy(alice.getId(), MAHOMES, "10.00", 1);
        TradeOfferDetails offer = tradeOfferService.createOffer(alice.getId(),
                List.of(player(MAHOMES, 1)), List.of(), null, "first come");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (Account acceptor : List.of(bob, carol)) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    tradeOfferService.acceptOffer(offer.offer().getId(), acceptor.getId());
                    return true;
                } catch (StaleOfferException ex) {
                    return false;
                }
            }));
        }
        start.countDown();
        int accepted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(60, TimeUnit.SECONDS)) {
                accepted++;
            }
        }
        pool.shutdown();

        assertThat(accepted).isEqualTo(1);
        assertThat(statusOf(offer)).isEqualTo(TradeOfferStatus.ACCEPTED);
        assertThat(holdingsRegistry.quantity(alice.getId(), AssetType.PLAYER, MAHOMES)).isZero();
        assertThat(holdingsRegistry.quantity(bob.getId(), AssetType.PLAYER, MAHOMES)
                + holdingsRegistry.quantity(carol.getId(), AssetType.PLAYER, MAHOMES)).isEqualTo(1);
    }

    private TradeOfferStatus statusOf(TradeOfferDetails details) {
        return offerRepository.findById(details.offer().getId()).orElseThrow().getStatus();
    }

    private static TradeOfferService.OfferAsset player(String name, int quantity) {
        return new TradeOfferService.OfferAsset(AssetType.PLAYER, name, quantity);
    }
}
