package com.athl3t.backend.exception;

import com.athl3t.backend.model.AssetType;

public class InsufficientHoldingsException extends TradingException {

    public InsufficientHoldingsException(Long userId, AssetType assetType, String assetName, int required, int held) {
        super("INSUFFICIENT_HOLDINGS",
                "User " + userId + " holds " + held + " of " + assetType + " " + assetName + ", needs " + required);
    }
}
