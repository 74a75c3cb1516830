package io.tierkeeper.tier;

import java.time.Duration;

/**
 * Throttle between consecutive filesystem operations. Bounds I/O load only; correctness never
 * depends on it.
 */
@FunctionalInterface
public interface Pacer {
    void pause() throws InterruptedException;

    static Pacer none() {
        return () -> {
        };
    }

    static Pacer fixed(Duration delay) {
        return fixed(delay, Sleeper.system());
    }

    static Pacer fixed(Duration delay, Sleeper sleeper) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return none();
        }
        return () -> sleeper.sleep(delay);
    }
}
