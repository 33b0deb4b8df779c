package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Game;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OddsServiceTest {

    private final BettingProperties properties = new BettingProperties();
    private final OddsService oddsService = new OddsService(properties);
    private final Game game = Game.builder()
            .homeOdds(new BigDecimal("1.65"))
            .awayOdds(new BigDecimal("2.30"))
            .spread(new BigDecimal("-3.5"))
            .totalLine(new BigDecimal("44.5"))
            .build();

    @Test
    void moneylineUsesPostedPricesAndOtherMarketsUseStandardPrice() {
        assertThat(oddsService.oddsFor(game, BetType.MONEYLINE, BetPick.HOME)).isEqualByComparingTo("1.65");
        assertThat(oddsService.oddsFor(game, BetType.MONEYLINE, BetPick.AWAY)).isEqualByComparingTo("2.30");
        assertThat(oddsService.oddsFor(game, BetType.SPREAD, BetPick.AWAY)).isEqualByComparingTo("1.91");
        assertThat(oddsService.oddsFor(game, BetType.OVER_UNDER, BetPick.OVER)).isEqualByComparingTo("1.91");
    }

    @Test
    void standardPriceFollowsConfiguration() {
        properties.setStandardOdds(new BigDecimal("1.87"));

        assertThat(oddsService.oddsFor(game, BetType.SPREAD, BetPick.HOME)).isEqualByComparingTo("1.87");
    }

    @Test
    void rejectsPickFromAnotherMarket() {
        assertThatThrownBy(() -> oddsService.oddsFor(game, BetType.MONEYLINE, BetPick.OVER))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void payoutRoundsToCentsOnlyAtTheEnd() {
        BigDecimal combined = oddsService.combine(List.of(new BigDecimal("1.91"), new BigDecimal("1.91"),
                new BigDecimal("1.91")));

        assertThat(combined).isEqualByComparingTo("6.967871");
        assertThat(oddsService.payout(new BigDecimal("10.00"), combined)).isEqualByComparingTo("69.68");
        assertThat(oddsService.payout(new BigDecimal("10.00"), new BigDecimal("1.91"))).isEqualByComparingTo("19.10");
    }
}
