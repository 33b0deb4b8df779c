package com.athl3t.backend.model;

public enum TransactionKind {
    BUY,
    SELL,
    TRADE_IN,
    TRADE_OUT
}
