package com.skilltrace.service;

import java.util.concurrent.locks.ReentrantLock;

public class LearnerLocks {
    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public LearnerLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String learnerId) {
        return stripes[Math.floorMod(learnerId.hashCode(), stripes.length)];
    }

    public int stripeCount() {
        return stripes.length;
    }
}
