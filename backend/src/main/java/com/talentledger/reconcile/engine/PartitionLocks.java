package com.talentledger.reconcile.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A fixed stripe of reentrant locks shared by all partition keys. Serializes the live path with operator releases of
 * the same partition; partitions hashing to one stripe also exclude each other.
 */
@Component
public class PartitionLocks {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public PartitionLocks() {
        this(DEFAULT_STRIPES);
    }

    PartitionLocks(int stripes) {
        if (stripes < 1) {
            throw new IllegalArgumentException("stripes must be positive: " + stripes);
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String partitionKey) {
        return stripes[Math.floorMod(spread(partitionKey.hashCode()), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }

    private static int spread(int h) {
        return h ^ (h >>> 16);
    }
}
