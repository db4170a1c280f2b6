package net.gantry.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void fixed_returnsSameBackoffForEveryAttempt() {
        RetryPolicy p = RetryPolicy.fixed(Duration.ofSeconds(7));
        assertEquals(Duration.ofSeconds(7), p.nextBackoff(1));
        assertEquals(Duration.ofSeconds(7), p.nextBackoff(9));
    }

    @Test
    void exponential_doublesUntilCap_withoutJitter() {
        RetryPolicy p = new ExponentialRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 0.0, () -> 0.5);
        assertEquals(Duration.ofSeconds(1), p.nextBackoff(1));
        assertEquals(Duration.ofSeconds(2), p.nextBackoff(2));
        assertEquals(Duration.ofSeconds(4), p.nextBackoff(3));
        assertEquals(Duration.ofSeconds(8), p.nextBackoff(4));
        assertEquals(Duration.ofSeconds(10), p.nextBackoff(5));
        assertEquals(Duration.ofSeconds(10), p.nextBackoff(60));
    }

    @Test
    void exponential_jitterOnlyShortensWithinFraction() {
        RetryPolicy full = new ExponentialRetryPolicy(Duration.ofSeconds(4), Duration.ofSeconds(60), 0.5, () -> 0.999);
        Duration d = full.nextBackoff(1);
        assertTrue(d.compareTo(Duration.ofSeconds(2)) >= 0, "at most half is removed: " + d);
        assertTrue(d.compareTo(Duration.ofSeconds(4)) <= 0);

        RetryPolicy none = new ExponentialRetryPolicy(Duration.ofSeconds(4), Duration.ofSeconds(60), 0.5, () -> 0.0);
        assertEquals(Duration.ofSeconds(4), none.nextBackoff(1));
    }

    @Test
    void exponential_rejectsBadBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(Duration.ofSeconds(5), Duration.ofSeconds(1), 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(5), 1.5));
    }
}
