package com.sandkev.tradevol.testsupport;

import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

public class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override public long read() { return nanos.get(); }

    public void advance(Duration d) { nanos.addAndGet(d.toNanos()); }
}
