package com.talentledger.domain;

/**
 * Milestone status; strictly monotonic. Codes are the contract's enum ordinals and double as rank.
 */
public enum MilestoneStatus {
    PENDING(0),
    IN_PROGRESS(1),
    SUBMITTED(2),
    APPROVED(3),
    PAID(4);

    private final int code;

    MilestoneStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isBefore(MilestoneStatus other) {
        return other != null && code < other.code;
    }

    public boolean isAtLeast(MilestoneStatus other) {
        return other == null || code >= other.code;
    }

    public static MilestoneStatus fromCode(int code) {
        for (MilestoneStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown milestone status code: " + code);
    }
}
