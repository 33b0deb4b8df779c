package com.athl3t.backend.exception;

import java.math.BigDecimal;

public class InvalidStakeException extends BadRequestException {

    public InvalidStakeException(BigDecimal stake, BigDecimal minimum) {
        this("Stake " + stake + " is below the minimum of " + minimum);
    }

    public InvalidStakeException(String message) {
        super("INVALID_STAKE", message);
    }
}
