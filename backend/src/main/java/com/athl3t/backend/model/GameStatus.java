package com.athl3t.backend.model;

public enum GameStatus {
    SCHEDULED,
    COMPLETED
}
