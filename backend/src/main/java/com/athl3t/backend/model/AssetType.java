package com.athl3t.backend.model;

public enum AssetType {
    PLAYER,
    TEAM_FUND
}
