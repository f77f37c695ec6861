package com.strata.query;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Keyset pagination position: a row timestamp and its unique id, encoded as
 * Base64 of {@code <RFC 3339 timestamp>,<uuid>}.
 */
public class Cursor {
    private final Instant timestamp;
    private final String uuid;

    public Cursor(Instant timestamp, String uuid) {
        this.timestamp = timestamp;
        this.uuid = uuid;
    }

    public static String encode(Instant timestamp, String uuid) {
        String raw = DateTimeFormatter.ISO_INSTANT.format(timestamp) + "," + uuid;
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws InvalidQueryException if the cursor is not valid Base64 or does not
     *         hold a timestamp and an id
     */
    public static Cursor decode(String cursor) {
        String raw;
        try {
            raw = new String(Base64.getDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("error decoding cursor " + cursor, e);
        }

        int comma = raw.indexOf(',');
        if (comma <= 0 || comma == raw.length() - 1) {
            throw new InvalidQueryException("error parsing cursor " + cursor);
        }
        try {
            Instant timestamp = OffsetDateTime.parse(raw.substring(0, comma)).toInstant();
            return new Cursor(timestamp, raw.substring(comma + 1));
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("error parsing cursor timestamp " + cursor, e);
        }
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getUuid() {
        return uuid;
    }

    public String encode() {
        return encode(timestamp, uuid);
    }
}
