package com.llmrelay.relay_backend.dispatch;

import java.time.Duration;

/** Waits between dispatch attempts. Swapped out in tests so backoff can be observed without waiting. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
