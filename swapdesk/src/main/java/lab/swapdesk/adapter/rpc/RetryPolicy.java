package lab.swapdesk.adapter.rpc;

import java.util.concurrent.ThreadLocalRandom;

/**
 * How many endpoint attempts a call gets and how long to pause between them.
 * The pause doubles per failed attempt and is spread by {@code jitterFactor} in both directions.
 */
public record RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {

    private static final int MAX_DOUBLINGS = 20;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0 || jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException(
                    "invalid backoff: baseDelayMs=%d jitterFactor=%s".formatted(baseDelayMs, jitterFactor));
        }
    }

    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(250L, 0.2, 3);
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(0L, 0.0, maxAttempts);
    }

    /** Pause before the attempt that follows {@code failedAttempt} (zero-based). */
    public long backoffMs(int failedAttempt) {
        long nominal = baseDelayMs << Math.min(Math.max(failedAttempt, 0), MAX_DOUBLINGS);
        if (nominal == 0 || jitterFactor == 0) {
            return nominal;
        }
        double spread = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Math.max(0L, Math.round(nominal * (1.0 + spread)));
    }
}
