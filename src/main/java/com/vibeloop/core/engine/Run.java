package com.vibeloop.core.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One execution of the iteration loop.
 *
 * @param id        opaque identifier, sortable by creation time ({@code 2026-01-01T10-00-00Z_ab12})
 * @param createdAt creation time
 */
public record Run(String id, Instant createdAt) {

    private static final DateTimeFormatter ID_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss'Z'").withZone(ZoneOffset.UTC);
    private static final String SUFFIX_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    public static Run create(Clock clock) {
        Instant now = clock.instant();
        StringBuilder id = new StringBuilder(ID_TIMESTAMP.format(now)).append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 4; i++) {
            id.append(SUFFIX_CHARS.charAt(random.nextInt(SUFFIX_CHARS.length())));
        }
        return new Run(id.toString(), now);
    }
}
