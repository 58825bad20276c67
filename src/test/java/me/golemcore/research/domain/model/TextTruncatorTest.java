package me.golemcore.research.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextTruncatorTest {

    @Test
    void shouldKeepShortText() {
        assertEquals("short", TextTruncator.truncate("short", 10));
        assertFalse(TextTruncator.needsTruncation("short", 10));
    }

    @Test
    void shouldTruncateLongTextWithMarker() {
        String truncated = TextTruncator.truncate("abcdefghijklmnop", 5);

        assertEquals("abcde" + TextTruncator.MARKER, truncated);
    }

    @Test
    void shouldBeIdempotent() {
        String once = TextTruncator.truncate("x".repeat(100), 20);
        String twice = TextTruncator.truncate(once, 20);

        assertEquals(once, twice);
        assertFalse(TextTruncator.needsTruncation(once, 20));
    }

    @Test
    void shouldHandleNull() {
        assertNull(TextTruncator.truncate(null, 5));
        assertFalse(TextTruncator.needsTruncation(null, 5));
    }

    @Test
    void shouldTruncateExactlyAtLimitPlusOne() {
        assertTrue(TextTruncator.needsTruncation("123456", 5));
        assertFalse(TextTruncator.needsTruncation("12345", 5));
    }
}
