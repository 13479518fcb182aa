package com.sandkev.tradevol.shared.http;

import java.time.Duration;

/** Blocking pause between attempts; swapped for a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> HttpRetrySupport.sleepQuietly(d.toMillis());

    void sleep(Duration duration);
}
