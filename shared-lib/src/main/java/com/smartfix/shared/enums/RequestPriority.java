package com.smartfix.shared.enums;

/**
 * Customer-supplied urgency hint. Not the computed priority score.
 */
public enum RequestPriority {
    LOW(25),
    MEDIUM(50),
    HIGH(75),
    URGENT(100);

    private final int baseScore;

    RequestPriority(int baseScore) {
        this.baseScore = baseScore;
    }

    public int getBaseScore() {
        return baseScore;
    }
}
