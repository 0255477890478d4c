package com.myorg.scf.settings;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the string form a remote store hands back into a field's declared type.
 * Implementations throw {@link IllegalArgumentException} for values they cannot read.
 * A {@code null} input always yields {@code null}.
 */
@FunctionalInterface
public interface ValueCoercer<T> {

    T coerce(String raw);

    Set<String> TRUTHY = Set.of("y", "yes", "t", "true", "on", "1");
    Set<String> FALSY = Set.of("n", "no", "f", "false", "off", "0");

    ValueCoercer<String> STRING = raw -> raw;

    ValueCoercer<Integer> INTEGER = raw -> raw == null ? null : Integer.valueOf(raw.trim());

    ValueCoercer<Long> LONG = raw -> raw == null ? null : Long.valueOf(raw.trim());

    ValueCoercer<Boolean> BOOLEAN = raw -> {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(v)) return Boolean.TRUE;
        if (FALSY.contains(v)) return Boolean.FALSE;
        throw new IllegalArgumentException("invalid truth value " + raw);
    };

    // ISO-8601 ("PT30S") or a plain number of seconds
    ValueCoercer<Duration> DURATION = raw -> {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty()) throw new IllegalArgumentException("empty duration");
        String upper = v.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P") || upper.startsWith("-P")) {
            return Duration.parse(upper);
        }
        return Duration.ofSeconds(Long.parseLong(v));
    };

    static <E extends Enum<E>> ValueCoercer<E> enumOf(Class<E> type) {
        return raw -> raw == null ? null : Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    }
}
