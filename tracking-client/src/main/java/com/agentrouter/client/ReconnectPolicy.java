package com.agentrouter.client;

import com.agentrouter.common.exception.TransportException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.LongConsumer;

/**
 * Exponential reconnect backoff.
 *
 * <pre>
 *   delay(n) = min(maxDelay, initialDelay × factor^(n−1))      n = 1 … maxAttempts
 * </pre>
 * Defaults: 1s, ×2, capped at 30s, 5 attempts. The attempt counter restarts once a connection
 * delivers traffic again. Only {@link TransportException}s are retried.
 */
public record ReconnectPolicy(Duration initialDelay, double factor, Duration maxDelay, int maxAttempts) {

    public static final ReconnectPolicy DEFAULT =
        new ReconnectPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 5);

    public ReconnectPolicy {
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Invalid backoff window " + initialDelay + ".." + maxDelay);
        }
        if (factor < 1.0 || maxAttempts < 0) {
            throw new IllegalArgumentException("Invalid backoff factor or attempts: " + factor + ", " + maxAttempts);
        }
    }

    /** @param attempt 1-based reconnect attempt */
    public Duration delayForAttempt(long attempt) {
        double millis = initialDelay.toMillis() * Math.pow(factor, attempt - 1);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(Math.round(millis));
    }

    /**
     * @param beforeAttempt called with the 1-based attempt number before each backoff delay
     */
    public Retry toRetry(LongConsumer beforeAttempt) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!(failure instanceof TransportException)) {
                return Mono.error(failure);
            }
            long attempt = signal.totalRetriesInARow() + 1;
            if (attempt > maxAttempts) {
                return Mono.error(new TransportException(
                    "Gave up after " + maxAttempts + " reconnect attempts", failure));
            }
            beforeAttempt.accept(attempt);
            return Mono.delay(delayForAttempt(attempt));
        }));
    }
}
