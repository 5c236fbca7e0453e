package com.retryguard.core.backoff;

import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.model.enums.BackoffShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BackoffRegistry")
class BackoffRegistryTest {

    @Nested
    @DisplayName("Built-in policies")
    class BuiltIns {

        private final BackoffRegistry registry = new BackoffRegistry();

        @Test
        @DisplayName("none is always zero")
        void none() {
            assertEquals(0L, registry.delayMillis(BackoffShape.NONE, 3, 1_000L, 5_000L));
        }

        @Test
        @DisplayName("fixed returns the base delay")
        void fixed() {
            assertEquals(500L, registry.delayMillis(BackoffShape.FIXED, 9, 500L, 500L));
        }

        @Test
        @DisplayName("exponential doubles per attempt with at most 10% jitter")
        void exponential() {
            for (int i = 0; i < 50; i++) {
                long first = registry.delayMillis(BackoffShape.EXPONENTIAL, 1, 1_000L, 60_000L);
                long third = registry.delayMillis(BackoffShape.EXPONENTIAL, 3, 1_000L, 60_000L);
                assertTrue(first >= 1_000L && first <= 1_100L, "first " + first);
                assertTrue(third >= 4_000L && third <= 4_400L, "third " + third);
            }
        }

        @Test
        @DisplayName("attempt zero yields half the base delay")
        void attemptZero() {
            long d = registry.delayMillis(BackoffShape.EXPONENTIAL, 0, 1_000L, 60_000L);
            assertTrue(d >= 500L && d <= 550L, "delay " + d);
        }

        @Test
        @DisplayName("null shape resolves to exponential")
        void nullShape() {
            assertInstanceOf(ExponentialJitterBackoffPolicy.class, registry.resolve(null));
        }
    }

    @Test
    @DisplayName("application policy replaces the built-in one for its shape")
    void override() {
        BackoffPolicy flat = new BackoffPolicy() {
            @Override
            public BackoffShape shape() {
                return BackoffShape.EXPONENTIAL;
            }

            @Override
            public long delayMillis(int attempt, long baseMs, long maxMs) {
                return 42L;
            }
        };
        BackoffRegistry registry = new BackoffRegistry(List.of(flat));

        assertEquals(42L, registry.delayMillis(BackoffShape.EXPONENTIAL, 5, 1_000L, 60_000L));
        assertInstanceOf(FixedBackoffPolicy.class, registry.resolve(BackoffShape.FIXED));
        assertEquals(3, registry.policies().size());
    }
}
