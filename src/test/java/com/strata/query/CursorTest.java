package com.strata.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Cursor
 */
@DisplayName("Cursor Tests")
class CursorTest {

    @Test
    @DisplayName("Should encode timestamp and id as Base64 text")
    void shouldEncodeAsBase64() {
        Instant timestamp = Instant.parse("2024-03-01T10:15:30.123456789Z");

        String cursor = Cursor.encode(timestamp, "a1b2");

        String raw = new String(Base64.getDecoder().decode(cursor), StandardCharsets.UTF_8);
        assertThat(raw).isEqualTo("2024-03-01T10:15:30.123456789Z,a1b2");
        Cursor decoded = Cursor.decode(cursor);
        assertThat(decoded.getTimestamp()).isEqualTo(timestamp);
        assertThat(decoded.getUuid()).isEqualTo("a1b2");
    }

    @Test
    @DisplayName("Should accept timestamps with a zone offset")
    void shouldDecodeOffsetTimestamp() {
        String cursor = Base64.getEncoder().encodeToString(
            "2024-03-01T12:00:00+02:00,id-1".getBytes(StandardCharsets.UTF_8));

        Cursor decoded = Cursor.decode(cursor);

        assertThat(decoded.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should reject cursors that are not Base64")
    void shouldRejectInvalidBase64() {
        assertThatThrownBy(() -> Cursor.decode("***"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("error decoding cursor");
    }

    @Test
    @DisplayName("Should reject cursors without an id or with a bad timestamp")
    void shouldRejectMalformedContent() {
        String noId = Base64.getEncoder().encodeToString("2024-03-01T10:00:00Z".getBytes(StandardCharsets.UTF_8));
        String badTime = Base64.getEncoder().encodeToString("yesterday,abc".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> Cursor.decode(noId)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> Cursor.decode(badTime))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("timestamp");
    }
}
