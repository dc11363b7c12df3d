package me.golemcore.comfyagent.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void shouldDoubleDelayPerAttemptWithoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(1000, 60000, 0.0, () -> 0.5);

        assertEquals(1000, policy.delayFor(1, null));
        assertEquals(2000, policy.delayFor(2, null));
        assertEquals(4000, policy.delayFor(3, null));
        assertEquals(8000, policy.delayFor(4, null));
    }

    @Test
    void shouldCapDelayAtMaximum() {
        BackoffPolicy policy = new BackoffPolicy(1000, 5000, 0.0, () -> 0.5);

        assertEquals(5000, policy.delayFor(10, null));
    }

    @Test
    void shouldApplyJitterWithinBounds() {
        BackoffPolicy low = new BackoffPolicy(1000, 60000, 0.2, () -> 0.0);
        BackoffPolicy high = new BackoffPolicy(1000, 60000, 0.2, () -> 0.999999);

        assertEquals(800, low.delayFor(1, null));
        long upper = high.delayFor(1, null);
        assertTrue(upper >= 1199 && upper <= 1200, "upper=" + upper);
    }

    @Test
    void shouldPreferRetryAfterHint() {
        BackoffPolicy policy = new BackoffPolicy(1000, 60000, 0.2, () -> 0.5);

        assertEquals(7000, policy.delayFor(1, 7000L));
    }

    @Test
    void shouldCapRetryAfterHintAtMaximum() {
        BackoffPolicy policy = new BackoffPolicy(1000, 10000, 0.2, () -> 0.5);

        assertEquals(10000, policy.delayFor(1, 120000L));
    }

    @Test
    void shouldRejectInvalidJitter() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(1000, 10000, 1.0, () -> 0.5));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(1000, 10000, -0.1, () -> 0.5));
    }

    @Test
    void shouldRejectNegativeDelays() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(-1, 10000, 0.1, () -> 0.5));
    }
}
