package taskline.coordinator.signal;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter, used when the shared store is
 * unavailable while a lifecycle event is being applied.
 */
public class ExponentialBackoff {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final boolean addJitter;

    public ExponentialBackoff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, true);
    }

    /**
     * @param initialDelay delay before the first retry
     * @param multiplier   factor applied per subsequent retry
     * @param maxDelay     cap on a single delay; null or zero disables the cap
     * @param addJitter    if true, varies each delay by up to +/-10%
     */
    public ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay, boolean addJitter) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero())
            throw new IllegalArgumentException("initialDelay must be positive");
        if (multiplier <= 1.0)
            throw new IllegalArgumentException("multiplier must be greater than 1.0");

        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay : null;
        this.addJitter = addJitter;
    }

    /**
     * Delay to wait before retry number {@code attempt} (0-based).
     */
    public Duration delayFor(int attempt) {
        double raw = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        long delayMillis = raw >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) raw;

        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }

        if (addJitter && delayMillis > 0) {
            long jitter = (long) (delayMillis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1));
            delayMillis = Math.max(1, delayMillis + jitter);
        } else if (delayMillis <= 0) {
            delayMillis = 1;
        }

        return Duration.ofMillis(delayMillis);
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
