package com.narraflow.narraflow_backend.collab;

import java.util.concurrent.atomic.AtomicLong;

public class FakeLeaseClock implements LeaseClock {

    private final AtomicLong now = new AtomicLong(1_000_000L);

    @Override
    public long nowMillis() {
        return now.get();
    }

    public void advance(long millis) {
        now.addAndGet(millis);
    }
}
