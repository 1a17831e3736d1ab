package com.taskforge.core.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("a fresh token is not cancelled")
    void fresh() {
        CancellationToken token = CancellationToken.create();

        assertFalse(token.isCancelled());
        assertNull(token.reason());
        assertDoesNotThrow(token::throwIfCancelled);
    }

    @Test
    @DisplayName("only the first cancel wins and keeps its reason")
    void firstCancelWins() {
        CancellationToken token = CancellationToken.create();

        assertTrue(token.cancel("user stop"));
        assertFalse(token.cancel("timeout"));

        assertTrue(token.isCancelled());
        assertEquals("user stop", token.reason());
        var ex = assertThrows(CancellationException.class, token::throwIfCancelled);
        assertEquals("user stop", ex.getMessage());
    }

    @Test
    @DisplayName("a null reason becomes 'cancelled'")
    void nullReason() {
        CancellationToken token = CancellationToken.create();
        token.cancel(null);

        assertEquals("cancelled", token.reason());
    }

    @Test
    @DisplayName("run ids carry prefix, clock millis and a random suffix")
    void runIds() {
        MutableClock clock = new MutableClock(Instant.ofEpochMilli(1_700_000_000_000L));

        String a = RunIds.next("task", clock);
        String b = RunIds.next("task", clock);

        assertTrue(a.matches("task_1700000000000_[a-z0-9]{9}"), a);
        assertNotEquals(a, b);
    }
}
