package com.ryuqq.chronicle.adapter.inmemory;

import com.ryuqq.chronicle.core.spi.LogBroker;
import com.ryuqq.chronicle.testkit.contract.AbstractEventStoreContractTest;

/**
 * Runs the event store contract end to end over {@link InMemoryLogBroker}.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
class InMemoryEventStoreContractTest extends AbstractEventStoreContractTest {

    @Override
    protected LogBroker createBroker() {
        return new InMemoryLogBroker();
    }
}
