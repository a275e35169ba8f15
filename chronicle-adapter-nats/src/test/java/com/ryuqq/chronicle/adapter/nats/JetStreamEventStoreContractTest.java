package com.ryuqq.chronicle.adapter.nats;

import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.testkit.contract.AbstractEventStoreContractTest;
import io.nats.client.Connection;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the event store contract end to end over JetStream.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
@Testcontainers(disabledWithoutDocker = true)
class JetStreamEventStoreContractTest extends AbstractEventStoreContractTest {

    @Container
    private static final GenericContainer<?> NATS = NatsTestServer.container();

    private static Connection connection;

    @BeforeAll
    static void connect() throws Exception {
        connection = NatsTestServer.connect(NATS);
    }

    @AfterAll
    static void disconnect() throws InterruptedException {
        if (connection != null) {
            connection.close();
        }
    }

    @Override
    protected LogBroker createBroker() {
        return new JetStreamLogBroker(connection);
    }
}
