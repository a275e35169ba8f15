package com.ryuqq.chronicle.adapter.inmemory;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectPatternTest {

    @ParameterizedTest
    @CsvSource({
        "orders.1,      orders.1,     true",
        "orders.1,      orders.2,     false",
        "orders.*,      orders.1,     true",
        "orders.*,      orders.1.a,   false",
        "orders.>,      orders.1,     true",
        "orders.>,      orders.1.a,   true",
        "orders.>,      orders,       false",
        "*.1,           orders.1,     true",
        "orders.*.a,    orders.1.a,   true",
        "orders.*.a,    orders.1.b,   false",
        "orders,        orders.1,     false"
    })
    void matches(String pattern, String subject, boolean expected) {
        assertThat(SubjectPattern.matches(pattern, subject)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "orders.>,      orders.a,     true",
        "orders.a,      orders.>,     true",
        "orders.*,      orders.a,     true",
        "orders.*.c,    orders.b.*,   true",
        "orders.>,      orders,       false",
        "orders.*,      orders.a.b,   false",
        "orders.a,      orders.b,     false",
        "orders.>,      returns.>,    false",
        ">,             orders.a,     true"
    })
    void overlaps(String left, String right, boolean expected) {
        assertThat(SubjectPattern.overlaps(left, right)).isEqualTo(expected);
        assertThat(SubjectPattern.overlaps(right, left)).isEqualTo(expected);
    }
}
