package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Game;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Decimal odds quoting. Moneyline uses the game's posted prices, spread and
 * totals use the house standard price.
 */
@Service
@RequiredArgsConstructor
public class OddsService {

    private final BettingProperties bettingProperties;

    public BigDecimal oddsFor(Game game, BetType betType, BetPick pick) {
        if (betType == null || !betType.accepts(pick)) {
            throw new BadRequestException("Pick " + pick + " is not valid for bet type " + betType);
        }
        BigDecimal odds = switch (betType) {
            case MONEYLINE -> pick == BetPick.HOME ? game.getHomeOdds() : game.getAwayOdds();
            case SPREAD, OVER_UNDER -> bettingProperties.getStandardOdds();
        };
        return MoneyUtils.price(odds);
    }

    public BigDecimal payout(BigDecimal stake, BigDecimal odds) {
        return MoneyUtils.multiply(stake, odds);
    }

    /** Unrounded product; round only the final payout. */
    public BigDecimal combine(Collection<BigDecimal> odds) {
        BigDecimal product = BigDecimal.ONE;
        for (BigDecimal value : odds) {
            product = product.multiply(value);
        }
        return product;
    }
}
