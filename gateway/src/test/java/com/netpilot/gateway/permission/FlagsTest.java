package com.netpilot.gateway.permission;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FlagsTest {

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "1", "yes", "On", " on "})
    void truthyValues(String value) {
        assertThat(Flags.isTruthy(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "0", "no", "off", "", "enabled"})
    void everythingElseIsFalse(String value) {
        assertThat(Flags.isTruthy(value)).isFalse();
    }

    @Test
    void objectForm_acceptsBooleansAndFallsBackOnNull() {
        assertThat(Flags.isTruthy(Boolean.TRUE, false)).isTrue();
        assertThat(Flags.isTruthy("yes", false)).isTrue();
        assertThat(Flags.isTruthy(null, true)).isTrue();
        assertThat(Flags.isTruthy(null, false)).isFalse();
    }
}
