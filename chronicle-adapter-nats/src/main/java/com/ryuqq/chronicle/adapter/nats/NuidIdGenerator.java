package com.ryuqq.chronicle.adapter.nats;

import com.ryuqq.chronicle.core.model.IdGenerator;
import io.nats.client.NUID;

/**
 * {@link IdGenerator} backed by the NATS unique id generator.
 *
 * <p>NUIDs are shorter and cheaper to produce than random UUIDs and are the id format
 * NATS tooling uses for {@code Nats-Msg-Id}.</p>
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public final class NuidIdGenerator implements IdGenerator {

    @Override
    public String next() {
        return NUID.nextGlobal();
    }
}
