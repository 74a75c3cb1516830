package io.tierkeeper.tier;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long ms = duration.toMillis();
            if (ms > 0L) {
                Thread.sleep(ms);
            }
        };
    }
}
