package com.simforge.orchestrator.service;

import java.time.Duration;

/** Blocking pause between retries. Replaced by a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());
}
