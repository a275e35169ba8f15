package com.ryuqq.chronicle.adapter.nats;

import com.ryuqq.chronicle.core.event.EnvelopeHeaders;
import com.ryuqq.chronicle.core.model.Deadline;
import com.ryuqq.chronicle.core.spi.BrokerException;
import com.ryuqq.chronicle.core.spi.BrokerMessage;
import com.ryuqq.chronicle.core.spi.BrokerTimeoutException;
import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.core.spi.LogReader;
import com.ryuqq.chronicle.core.spi.PreconditionFailedException;
import com.ryuqq.chronicle.core.spi.PublishAck;
import com.ryuqq.chronicle.core.spi.StorageType;
import com.ryuqq.chronicle.core.spi.StreamConfig;
import com.ryuqq.chronicle.core.spi.StreamNotFoundException;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.MessageInfo;
import io.nats.client.api.Placement;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NATS JetStream implementation of {@link LogBroker}.
 *
 * <p>JetStream provides every primitive the event store needs natively: per-stream
 * sequences, {@code Nats-Msg-Id} deduplication, the expected-last-subject-sequence
 * publish precondition and last-message-by-subject lookups. This adapter only maps
 * them onto the SPI types and errors.</p>
 *
 * <p><strong>Mapping:</strong></p>
 * <ul>
 *   <li><strong>publish:</strong> {@link JetStream#publish(Message, PublishOptions)} with
 *       expected stream, expected last subject sequence and a stream timeout from the deadline</li>
 *   <li><strong>lastSequence:</strong> {@link JetStreamManagement#getLastMessage(String, String)},
 *       "no message found" meaning {@code 0}</li>
 *   <li><strong>openReader:</strong> ordered push consumer starting at a sequence</li>
 *   <li><strong>admin:</strong> add / update / delete / info stream</li>
 * </ul>
 *
 * <p>The connection is owned by the caller and is never closed here.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class JetStreamLogBroker implements LogBroker {

    private static final Logger log = LoggerFactory.getLogger(JetStreamLogBroker.class);

    static final int WRONG_LAST_SEQUENCE = 10071;
    static final int STREAM_NOT_FOUND = 10059;
    static final int NO_MESSAGE_FOUND = 10037;

    private static final Pattern ACTUAL_SEQUENCE = Pattern.compile("wrong last sequence: (\\d+)");

    private final JetStream jetStream;
    private final JetStreamManagement management;

    /**
     * @param connection open NATS connection with JetStream enabled on the server
     * @throws BrokerException if the JetStream contexts cannot be created
     */
    public JetStreamLogBroker(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        try {
            this.jetStream = connection.jetStream();
            this.management = connection.jetStreamManagement();
        } catch (IOException e) {
            throw new BrokerException("failed to create JetStream context", e);
        }
    }

    JetStreamLogBroker(JetStream jetStream, JetStreamManagement management) {
        this.jetStream = jetStream;
        this.management = management;
    }

    @Override
    public PublishAck publish(String stream, BrokerMessage message, Long expectedLastSubjectSequence, Deadline deadline) {
        checkDeadline("publish", deadline);

        Headers headers = new Headers();
        for (Map.Entry<String, String> header : message.headers().entrySet()) {
            headers.put(header.getKey(), header.getValue());
        }
        Message natsMessage = NatsMessage.builder()
            .subject(message.subject())
            .headers(headers)
            .data(message.data())
            .build();

        PublishOptions.Builder options = PublishOptions.builder()
            .expectedStream(stream)
            .streamTimeout(deadline.remaining());
        String msgId = message.header(EnvelopeHeaders.MSG_ID);
        if (msgId != null) {
            options.messageId(msgId);
        }
        if (expectedLastSubjectSequence != null) {
            options.expectedLastSubjectSequence(expectedLastSubjectSequence);
        }

        try {
            io.nats.client.api.PublishAck ack = jetStream.publish(natsMessage, options.build());
            return new PublishAck(ack.getStream(), ack.getSeqno(), ack.isDuplicate());
        } catch (JetStreamApiException e) {
            if (isWrongLastSequence(e)) {
                throw new PreconditionFailedException(message.subject(),
                    expectedLastSubjectSequence == null ? -1 : expectedLastSubjectSequence,
                    actualSequence(e));
            }
            throw translate("publish to " + stream, stream, e);
        } catch (IOException e) {
            throw ioFailure("publish", deadline, e);
        }
    }

    @Override
    public long lastSequence(String stream, String subject, Deadline deadline) {
        checkDeadline("lastSequence", deadline);
        try {
            MessageInfo info = management.getLastMessage(stream, subject);
            return info.getSeq();
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == NO_MESSAGE_FOUND) {
                return 0;
            }
            throw translate("last message for " + subject, stream, e);
        } catch (IOException e) {
            throw ioFailure("lastSequence", deadline, e);
        }
    }

    @Override
    public LogReader openReader(String stream, String subject, long startSequence, Deadline deadline) {
        if (startSequence <= 0) {
            throw new IllegalArgumentException("startSequence must be positive, but was: " + startSequence);
        }
        checkDeadline("openReader", deadline);

        PushSubscribeOptions options = PushSubscribeOptions.builder()
            .stream(stream)
            .ordered(true)
            .configuration(ConsumerConfiguration.builder()
                .deliverPolicy(DeliverPolicy.ByStartSequence)
                .startSequence(startSequence)
                .build())
            .build();
        try {
            JetStreamSubscription subscription = jetStream.subscribe(subject, options);
            return new JetStreamLogReader(stream, subscription);
        } catch (JetStreamApiException e) {
            throw translate("subscribe to " + subject, stream, e);
        } catch (IOException e) {
            throw ioFailure("openReader", deadline, e);
        }
    }

    @Override
    public void createStream(StreamConfig config) {
        try {
            management.addStream(toNats(config));
            log.info("JetStream stream created: name={}, subjects={}", config.name(), config.subjects());
        } catch (JetStreamApiException e) {
            throw translate("create stream", config.name(), e);
        } catch (IOException e) {
            throw new BrokerException("failed to create stream " + config.name(), e);
        }
    }

    @Override
    public void updateStream(StreamConfig config) {
        try {
            management.updateStream(toNats(config));
            log.info("JetStream stream updated: name={}, subjects={}", config.name(), config.subjects());
        } catch (JetStreamApiException e) {
            throw translate("update stream", config.name(), e);
        } catch (IOException e) {
            throw new BrokerException("failed to update stream " + config.name(), e);
        }
    }

    @Override
    public void deleteStream(String name) {
        try {
            management.deleteStream(name);
            log.info("JetStream stream deleted: name={}", name);
        } catch (JetStreamApiException e) {
            throw translate("delete stream", name, e);
        } catch (IOException e) {
            throw new BrokerException("failed to delete stream " + name, e);
        }
    }

    @Override
    public StreamConfig describeStream(String name) {
        try {
            return fromNats(management.getStreamInfo(name).getConfiguration());
        } catch (JetStreamApiException e) {
            throw translate("describe stream", name, e);
        } catch (IOException e) {
            throw new BrokerException("failed to describe stream " + name, e);
        }
    }

    static StreamConfiguration toNats(StreamConfig config) {
        StreamConfiguration.Builder builder = StreamConfiguration.builder()
            .name(config.name())
            .subjects(config.subjects())
            .storageType(config.storage() == StorageType.MEMORY
                ? io.nats.client.api.StorageType.Memory
                : io.nats.client.api.StorageType.File)
            .replicas(config.replicas())
            .denyDelete(config.denyDelete())
            .denyPurge(config.denyPurge());
        if (config.description() != null) {
            builder.description(config.description());
        }
        if (config.placementCluster() != null) {
            builder.placement(Placement.builder().cluster(config.placementCluster()).build());
        }
        return builder.build();
    }

    static StreamConfig fromNats(StreamConfiguration configuration) {
        return new StreamConfig(
            configuration.getName(),
            configuration.getDescription(),
            configuration.getSubjects(),
            configuration.getStorageType() == io.nats.client.api.StorageType.Memory ? StorageType.MEMORY : StorageType.FILE,
            configuration.getReplicas(),
            configuration.getPlacement() == null ? null : configuration.getPlacement().getCluster(),
            configuration.getDenyDelete(),
            configuration.getDenyPurge()
        );
    }

    static boolean isWrongLastSequence(JetStreamApiException e) {
        if (e.getApiErrorCode() == WRONG_LAST_SEQUENCE) {
            return true;
        }
        String description = e.getErrorDescription();
        return description != null && description.contains("wrong last sequence");
    }

    static long actualSequence(JetStreamApiException e) {
        String description = e.getErrorDescription();
        if (description == null) {
            return -1;
        }
        Matcher matcher = ACTUAL_SEQUENCE.matcher(description);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : -1;
    }

    private static BrokerException translate(String operation, String stream, JetStreamApiException e) {
        if (e.getApiErrorCode() == STREAM_NOT_FOUND) {
            return new StreamNotFoundException(stream);
        }
        return new BrokerException(operation + " failed: " + e.getMessage(), e);
    }

    private static BrokerException ioFailure(String operation, Deadline deadline, IOException e) {
        if (deadline.isExpired()) {
            return new BrokerTimeoutException(operation, deadline.timeout(), e);
        }
        return new BrokerException(operation + " failed: " + e.getMessage(), e);
    }

    private static void checkDeadline(String operation, Deadline deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (deadline.isExpired()) {
            throw new BrokerTimeoutException(operation, deadline.timeout());
        }
    }
}
