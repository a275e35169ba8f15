package com.ryuqq.chronicle.testkit.fixture;

import com.ryuqq.chronicle.core.model.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic {@link IdGenerator} producing {@code <prefix>-1}, {@code <prefix>-2}, ...
 */
public class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String next() {
        return prefix + "-" + counter.incrementAndGet();
    }

    public long issued() {
        return counter.get();
    }
}
