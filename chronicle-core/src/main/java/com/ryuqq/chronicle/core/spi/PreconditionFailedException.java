package com.ryuqq.chronicle.core.spi;

/**
 * Raised by {@link LogBroker#publish} when the expected last sequence for the subject
 * does not match the stream.
 *
 * <p>This is the structured conflict signal adapters must produce; the event store
 * translates it into a sequence conflict.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class PreconditionFailedException extends BrokerException {

    private final String subject;
    private final long expectedSequence;
    private final long actualSequence;

    /**
     * @param subject subject of the rejected publish
     * @param expectedSequence sequence the publisher expected
     * @param actualSequence current last sequence for the subject, or -1 if the broker does not report it
     */
    public PreconditionFailedException(String subject, long expectedSequence, long actualSequence) {
        super("wrong last sequence for " + subject + ": expected " + expectedSequence
                + (actualSequence >= 0 ? ", actual " + actualSequence : ""));
        this.subject = subject;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public String subject() {
        return subject;
    }

    public long expectedSequence() {
        return expectedSequence;
    }

    public long actualSequence() {
        return actualSequence;
    }
}
