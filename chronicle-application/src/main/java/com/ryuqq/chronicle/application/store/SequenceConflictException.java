package com.ryuqq.chronicle.application.store;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when an append asserted an expected sequence that no longer matches the log.
 *
 * <p>This is an expected, recoverable condition: reload the state and retry the command,
 * or reject it. The event store never retries on its own.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class SequenceConflictException extends ChronicleException {

    private final String stream;
    private final String subject;
    private final long expectedSequence;
    private final long actualSequence;

    public SequenceConflictException(String stream, String subject, long expectedSequence,
                                     long actualSequence, Throwable cause) {
        super("sequence conflict on " + stream + "/" + subject + ": expected " + expectedSequence
                + (actualSequence >= 0 ? ", actual " + actualSequence : ""), cause);
        this.stream = stream;
        this.subject = subject;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public String stream() {
        return stream;
    }

    public String subject() {
        return subject;
    }

    public long expectedSequence() {
        return expectedSequence;
    }

    /**
     * @return last sequence the broker reported for the subject, or -1 if unknown
     */
    public long actualSequence() {
        return actualSequence;
    }
}
