package com.factryl.backend.util;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a lenient timestamp parse: the instant, or {@link Instant#MIN} with {@code valid = false}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParsedTimestamp {

    private static final ParsedTimestamp INVALID = new ParsedTimestamp(Instant.MIN, false);

    Instant instant;
    boolean valid;

    public static ParsedTimestamp of(Instant instant) {
        return new ParsedTimestamp(instant, true);
    }

    public static ParsedTimestamp invalid() {
        return INVALID;
    }
}
