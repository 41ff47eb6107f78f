package com.bomassembler.core.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * UTC timestamp formatting in the {@code yyyy-MM-ddTHH:mm:ssZ} form documents use.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
        // Utility class
    }

    /**
     * Formats the current instant of the clock, truncated to seconds.
     *
     * @param clock clock to read
     * @return UTC timestamp string
     */
    public static String utcNow(Clock clock) {
        return FORMAT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }
}
