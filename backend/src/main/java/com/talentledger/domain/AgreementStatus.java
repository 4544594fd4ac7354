package com.talentledger.domain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

/**
 * Agreement lifecycle as enforced by the employment contract. Codes are the contract's enum ordinals.
 * PENDING -> {ACTIVE, CANCELLED}; ACTIVE -> {COMPLETED, DISPUTED}; COMPLETED -> {FINALIZED, DISPUTED}.
 */
public enum AgreementStatus {
    PENDING(0),
    ACTIVE(1),
    COMPLETED(2),
    DISPUTED(3),
    CANCELLED(4),
    FINALIZED(5);

    private final int code;

    AgreementStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public Set<AgreementStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE, CANCELLED);
            case ACTIVE -> EnumSet.of(COMPLETED, DISPUTED);
            case COMPLETED -> EnumSet.of(FINALIZED, DISPUTED);
            case DISPUTED, CANCELLED, FINALIZED -> EnumSet.noneOf(AgreementStatus.class);
        };
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Reflexive-transitive reachability along the transition graph.
     */
    public boolean canReach(AgreementStatus target) {
        if (target == null) {
            return false;
        }
        if (target == this) {
            return true;
        }
        Set<AgreementStatus> seen = EnumSet.of(this);
        Deque<AgreementStatus> queue = new ArrayDeque<>(successors());
        while (!queue.isEmpty()) {
            AgreementStatus next = queue.poll();
            if (next == target) {
                return true;
            }
            if (seen.add(next)) {
                queue.addAll(next.successors());
            }
        }
        return false;
    }

    public static AgreementStatus fromCode(int code) {
        for (AgreementStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown agreement status code: " + code);
    }
}
