package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.exception.AgeVerificationRequiredException;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.InvalidStakeException;
import com.athl3t.backend.model.Account;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Checks shared by single bets and parlays.
 */
@Component
@RequiredArgsConstructor
public class WagerValidator {

    private final BettingProperties bettingProperties;

    public BigDecimal requireStake(BigDecimal stake) {
        BigDecimal minimum = MoneyUtils.scale(bettingProperties.getMinimumStake());
        if (stake == null || stake.compareTo(minimum) < 0) {
            throw new InvalidStakeException(stake, minimum);
        }
        if (stake.stripTrailingZeros().scale() > MoneyUtils.SCALE) {
            throw new InvalidStakeException("Stake must be a whole number of cents");
        }
        return MoneyUtils.scale(stake);
    }

    public void requirePick(BetType betType, BetPick pick) {
        if (betType == null || pick == null) {
            throw new BadRequestException("Bet type and pick are required");
        }
        if (!betType.accepts(pick)) {
            throw new BadRequestException("Pick " + pick + " is not valid for bet type " + betType);
        }
    }

    public void requireEligible(Account account) {
        if (bettingProperties.isRequireAgeVerification() && !account.isVerifiedAdult()) {
            throw new AgeVerificationRequiredException(account.getId(), bettingProperties.getMinimumAge());
        }
    }
}
