package net.eventmail.core.spi;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    static Sleeper system() {
        return d -> {
            if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
        };
    }
}
