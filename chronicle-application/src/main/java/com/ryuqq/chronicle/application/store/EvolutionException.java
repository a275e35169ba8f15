package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when a projection rejects an event during {@link EventStore#evolve}.
 *
 * <p>{@link #lastAppliedSequence()} tells the caller exactly how far the projection
 * advanced, so replay can resume or be diagnosed from that point.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class EvolutionException extends ChronicleException {

    private final long lastAppliedSequence;
    private final long failedSequence;

    public EvolutionException(long lastAppliedSequence, long failedSequence, Throwable cause) {
        super("evolve failed at sequence " + failedSequence + " (last applied " + lastAppliedSequence + "): "
                + cause.getMessage(), cause);
        this.lastAppliedSequence = lastAppliedSequence;
        this.failedSequence = failedSequence;
    }

    /**
     * @return sequence of the last event applied before the failure
     *         (the starting position if the first event failed)
     */
    public long lastAppliedSequence() {
        return lastAppliedSequence;
    }

    /**
     * @return sequence of the event the projection rejected
     */
    public long failedSequence() {
        return failedSequence;
    }
}
