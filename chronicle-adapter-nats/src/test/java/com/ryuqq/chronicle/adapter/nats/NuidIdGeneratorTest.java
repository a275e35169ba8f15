package com.ryuqq.chronicle.adapter.nats;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NuidIdGeneratorTest {

    @Test
    void next_ReturnsDistinctNonBlankIds() {
        NuidIdGenerator generator = new NuidIdGenerator();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            ids.add(generator.next());
        }

        assertThat(ids).hasSize(1000).allSatisfy(id -> assertThat(id).isNotBlank());
    }
}
