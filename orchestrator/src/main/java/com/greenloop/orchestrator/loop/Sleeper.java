package com.greenloop.orchestrator.loop;

import java.time.Duration;

/** Blocking pause between publication retries; replaced by a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
