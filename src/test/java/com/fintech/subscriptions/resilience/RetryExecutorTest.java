package com.fintech.subscriptions.resilience;

import com.fintech.subscriptions.exception.CircuitOpenException;
import com.fintech.subscriptions.exception.RetryExhaustedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
    }

    private RetryExecutor executor(int maxAttempts, long initialDelayMs, double factor) {
        return new RetryExecutor("test", maxAttempts, Duration.ofMillis(initialDelayMs), factor, sleeps::add);
    }

    @Nested
    @DisplayName("Successful operations")
    class SuccessTests {

        @Test
        @DisplayName("Should return immediately without waiting when the first attempt succeeds")
        void shouldNotWaitOnFirstSuccess() {
            // Given
            RetryExecutor retry = executor(3, 1000, 2.0);

            // When
            String result = retry.execute(() -> "ok");

            // Then
            assertThat(result).isEqualTo("ok");
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Should return the first successful result after transient failures")
        void shouldRecoverAfterTransientFailures() {
            // Given
            RetryExecutor retry = executor(5, 5000, 1.5);
            AtomicInteger calls = new AtomicInteger();

            // When
            Integer result = retry.execute(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("transient");
                }
                return 42;
            });

            // Then
            assertThat(result).isEqualTo(42);
            assertThat(calls.get()).isEqualTo(3);
            assertThat(sleeps).containsExactly(5000L, 7500L);
        }
    }

    @Nested
    @DisplayName("Exhaustion")
    class ExhaustionTests {

        @Test
        @DisplayName("Should wait initialDelay * factor^(k-1) between attempts and never after the last")
        void shouldBackOffExponentially() {
            // Given
            RetryExecutor retry = executor(5, 5000, 1.5);
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retry.execute(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("node down");
            })).isInstanceOf(RetryExhaustedException.class);

            assertThat(calls.get()).isEqualTo(5);
            assertThat(sleeps).containsExactly(5000L, 7500L, 11250L, 16875L);
        }

        @Test
        @DisplayName("Should carry the last error and the attempt count")
        void shouldCarryLastError() {
            // Given
            RetryExecutor retry = executor(3, 1000, 2.0);
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retry.execute(() -> {
                throw new IllegalStateException("failure " + calls.incrementAndGet());
            }))
                    .isInstanceOfSatisfying(RetryExhaustedException.class,
                            e -> assertThat(e.getAttempts()).isEqualTo(3))
                    .hasRootCauseMessage("failure 3");

            assertThat(sleeps).containsExactly(1000L, 2000L);
        }

        @Test
        @DisplayName("Should make a single attempt when maxAttempts is 1")
        void shouldMakeSingleAttempt() {
            // Given
            RetryExecutor retry = executor(1, 1000, 2.0);
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retry.execute(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("boom");
            })).isInstanceOf(RetryExhaustedException.class);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fail-fast errors")
    class FailFastTests {

        @Test
        @DisplayName("Should rethrow an open breaker rejection without retrying or waiting")
        void shouldNotRetryOpenCircuit() {
            // Given
            RetryExecutor retry = executor(3, 1000, 2.0);
            AtomicInteger calls = new AtomicInteger();
            CircuitOpenException rejection = new CircuitOpenException("database", null);

            // When / Then
            assertThatThrownBy(() -> retry.execute(() -> {
                calls.incrementAndGet();
                throw rejection;
            })).isSameAs(rejection);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Should rethrow an invalid argument without retrying")
        void shouldNotRetryInvalidArgument() {
            // Given
            RetryExecutor retry = executor(3, 1000, 2.0);
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retry.execute(() -> {
                calls.incrementAndGet();
                throw new IllegalArgumentException("Username must be between 1 and 16 characters");
            })).isInstanceOf(IllegalArgumentException.class);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> executor(0, 1000, 2.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor(3, 1000, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
