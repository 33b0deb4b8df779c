package com.athl3t.backend.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends TradingException {

    public InsufficientFundsException(Long userId, BigDecimal required, BigDecimal available) {
        super("INSUFFICIENT_FUNDS",
                "Insufficient cash balance for user " + userId + ": required " + required + ", available " + available);
    }
}
