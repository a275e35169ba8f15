package com.ryuqq.chronicle.testkit.fixture;

import com.ryuqq.chronicle.core.event.Event;
import com.ryuqq.chronicle.core.event.Evolver;

/**
 * Counting projection over order events.
 *
 * <p>Optionally fails on a given sequence, to exercise partial evolve failures.</p>
 */
public class OrderStats implements Evolver {

    private int placed;
    private int shipped;
    private long failOnSequence = -1;

    @Override
    public void apply(Event event) {
        if (event.sequence() == failOnSequence) {
            throw new IllegalStateException("projection rejected sequence " + event.sequence());
        }
        if (event.data() instanceof OrderPlaced) {
            placed++;
        } else if (event.data() instanceof OrderShipped) {
            shipped++;
        }
    }

    public OrderStats failOn(long sequence) {
        this.failOnSequence = sequence;
        return this;
    }

    public int placed() {
        return placed;
    }

    public int shipped() {
        return shipped;
    }
}
