package com.ryuqq.chronicle.adapter.nats;

import com.ryuqq.chronicle.core.model.Deadline;
import com.ryuqq.chronicle.core.spi.BrokerException;
import com.ryuqq.chronicle.core.spi.BrokerTimeoutException;
import com.ryuqq.chronicle.core.spi.LogReader;
import com.ryuqq.chronicle.core.spi.StoredMessage;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LogReader} over an ordered JetStream push subscription.
 *
 * <p>Ordered consumers are ephemeral, unacknowledged and recreated by the client on gaps,
 * so messages arrive exactly once and in stream order. Closing unsubscribes.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
class JetStreamLogReader implements LogReader {

    private static final Logger log = LoggerFactory.getLogger(JetStreamLogReader.class);

    private final String stream;
    private final JetStreamSubscription subscription;

    JetStreamLogReader(String stream, JetStreamSubscription subscription) {
        this.stream = stream;
        this.subscription = subscription;
    }

    @Override
    public StoredMessage next(Deadline deadline) {
        Duration remaining = deadline.remaining();
        if (remaining.isZero()) {
            throw new BrokerTimeoutException("next", deadline.timeout());
        }

        Message message;
        try {
            message = subscription.nextMessage(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("interrupted while reading from " + stream, e);
        } catch (IllegalStateException e) {
            throw new BrokerException("subscription on " + stream + " is no longer active", e);
        }
        if (message == null) {
            throw new BrokerTimeoutException("next", deadline.timeout());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        Headers natsHeaders = message.getHeaders();
        if (natsHeaders != null) {
            for (String key : natsHeaders.keySet()) {
                String value = natsHeaders.getFirst(key);
                if (value != null) {
                    headers.put(key, value);
                }
            }
        }

        return new StoredMessage(
            stream,
            message.getSubject(),
            message.metaData().streamSequence(),
            headers,
            message.getData()
        );
    }

    @Override
    public void close() {
        try {
            subscription.unsubscribe();
        } catch (IllegalStateException e) {
            log.debug("Subscription on {} already closed", stream);
        }
    }
}
