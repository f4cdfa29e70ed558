package com.fintech.subscriptions.resilience;

import com.fintech.subscriptions.exception.CircuitOpenException;
import com.fintech.subscriptions.exception.RetryExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs an operation with a bounded number of attempts and deterministic exponential backoff.
 * <p>
 * Between attempt k and k+1 the caller waits {@code initialDelay * backoffFactor^(k-1)}.
 * There is no jitter and no wait after the final attempt. When all attempts fail a
 * {@link RetryExhaustedException} carrying the last error is thrown.
 * <p>
 * An open circuit breaker and invalid arguments fail fast: they are rethrown after the first
 * attempt without waiting.
 */
@Slf4j
public class RetryExecutor {

    private static final Map<Class<? extends Throwable>, Boolean> NON_RETRYABLE = Map.of(
            CircuitOpenException.class, false,
            IllegalArgumentException.class, false);

    private final String name;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final double backoffFactor;
    private final BinaryExceptionClassifier retryable;
    private final RetryTemplate retryTemplate;

    public RetryExecutor(String name, int maxAttempts, Duration initialDelay, double backoffFactor) {
        this(name, maxAttempts, initialDelay, backoffFactor, new ThreadWaitSleeper());
    }

    public RetryExecutor(String name, int maxAttempts, Duration initialDelay, double backoffFactor,
                         Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffFactor <= 1.0) {
            throw new IllegalArgumentException("backoffFactor must be greater than 1, got " + backoffFactor);
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.backoffFactor = backoffFactor;
        this.retryable = new BinaryExceptionClassifier(NON_RETRYABLE, true);
        this.retryable.setTraverseCauses(true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(initialDelay.toMillis());
        backOffPolicy.setMultiplier(backoffFactor);
        // Uncapped: the delay sequence is purely initialDelay * factor^(k-1)
        backOffPolicy.setMaxInterval(Long.MAX_VALUE);
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, NON_RETRYABLE, true, true));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(new AttemptLogger());
        this.retryTemplate = template;
    }

    /**
     * Executes the operation, retrying on any exception except the fail-fast ones.
     *
     * @return the result of the first successful attempt
     * @throws RetryExhaustedException if every attempt failed
     * @throws CircuitOpenException if an attempt was rejected by an open breaker
     */
    public <T> T execute(Callable<T> operation) {
        RetryCallback<T, Exception> callback = context -> operation.call();
        try {
            return retryTemplate.execute(callback, context -> {
                Throwable lastError = context.getLastThrowable();
                if (lastError instanceof RuntimeException failFast && !retryable.classify(lastError)) {
                    log.warn("{} operation not retried: {}", name, lastError.getMessage());
                    throw failFast;
                }
                log.error("{} operation failed after {} attempts: {}",
                        name, context.getRetryCount(), lastError == null ? null : lastError.getMessage());
                throw new RetryExhaustedException(name, context.getRetryCount(), lastError);
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RetryExhaustedException(name, maxAttempts, e);
        }
    }

    long delayAfterAttempt(int attempt) {
        return (long) (initialDelay.toMillis() * Math.pow(backoffFactor, attempt - 1));
    }

    private class AttemptLogger implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            int attempt = context.getRetryCount();
            if (attempt < maxAttempts && retryable.classify(throwable)) {
                log.warn("{} operation failed (attempt {}/{}), retrying in {}ms: {}",
                        name, attempt, maxAttempts, delayAfterAttempt(attempt), throwable.getMessage());
            }
        }
    }
}
