package com.ledgerly.core.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

public final class UtcTimestamps {

    private UtcTimestamps() {
    }

    /**
     * Current instant of {@code clock} expressed with a UTC offset, whatever zone the clock carries.
     */
    public static OffsetDateTime now(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
