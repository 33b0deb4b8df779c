package com.athl3t.backend.model;

public enum TradeOfferStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    CANCELLED
}
