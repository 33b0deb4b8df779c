package com.athl3t.backend.model;

public enum TradeSide {
    BUY,
    SELL
}
