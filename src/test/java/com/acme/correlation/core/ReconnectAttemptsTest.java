package com.acme.correlation.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ReconnectAttemptsTest {

    private final ReconnectAttempts attempts = new ReconnectAttempts();

    @Test
    void testFirstMarkWins() {
        assertTrue(attempts.markAttempted("instance-1"));
        assertFalse(attempts.markAttempted("instance-1"));
        assertTrue(attempts.hasAttempted("instance-1"));
        assertFalse(attempts.hasAttempted("instance-2"));
    }

    @Test
    void testClearAllowsAnotherAttempt() {
        attempts.markAttempted("instance-1");
        attempts.markAttempted("instance-2");

        attempts.clear("instance-1");

        assertFalse(attempts.hasAttempted("instance-1"));
        assertTrue(attempts.hasAttempted("instance-2"));
        assertTrue(attempts.markAttempted("instance-1"));
    }

    @Test
    void testClearAll() {
        attempts.markAttempted("a");
        attempts.markAttempted("b");

        attempts.clearAll();

        assertFalse(attempts.hasAttempted("a"));
        assertFalse(attempts.hasAttempted("b"));
    }
}
