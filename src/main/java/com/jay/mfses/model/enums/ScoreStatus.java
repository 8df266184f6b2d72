package com.jay.mfses.model.enums;

public enum ScoreStatus {
    SCORED,
    INVALID_SNAPSHOT
}
