package com.yerin.bgjob.infra;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {}

    public static Duration expJitter(int retryCount, Duration base, Duration cap, double jitterRatio) {
        long baseMillis = base.toMillis();
        if (baseMillis <= 0) return Duration.ZERO;
        double exp = baseMillis * Math.pow(2, Math.max(0, retryCount));
        long capped = (long) Math.min(exp, cap.toMillis());
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        return Duration.ofMillis(Math.max(0, (long) (capped * jitter)));
    }
}
