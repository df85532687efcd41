package com.rms.relay.core.retry;

import java.time.Duration;

/**
 * Blocking wait used by {@link RetryExecutor#execute}. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
