package com.myorg.scf.settings;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercerTest {

    enum Mode { FAST, SAFE }

    @ParameterizedTest
    @ValueSource(strings = {"y", "YES", "t", "True", "on", "1", " true "})
    void boolean_truthyTokens(String raw) {
        assertThat(ValueCoercer.BOOLEAN.coerce(raw)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"n", "no", "F", "false", "OFF", "0"})
    void boolean_falsyTokens(String raw) {
        assertThat(ValueCoercer.BOOLEAN.coerce(raw)).isFalse();
    }

    @Test
    void boolean_rejectsUnknownToken() {
        assertThatThrownBy(() -> ValueCoercer.BOOLEAN.coerce("sometimes"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enum_isUpperCasedBeforeLookup() {
        assertThat(ValueCoercer.enumOf(Mode.class).coerce("safe")).isEqualTo(Mode.SAFE);
    }

    @Test
    void duration_acceptsIsoAndSeconds() {
        assertThat(ValueCoercer.DURATION.coerce("PT2M")).isEqualTo(Duration.ofMinutes(2));
        assertThat(ValueCoercer.DURATION.coerce("pt5s")).isEqualTo(Duration.ofSeconds(5));
        assertThat(ValueCoercer.DURATION.coerce("3600")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void null_staysNull() {
        assertThat(ValueCoercer.INTEGER.coerce(null)).isNull();
        assertThat(ValueCoercer.BOOLEAN.coerce(null)).isNull();
        assertThat(ValueCoercer.enumOf(Mode.class).coerce(null)).isNull();
    }
}
