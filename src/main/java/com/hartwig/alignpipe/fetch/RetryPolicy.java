package com.hartwig.alignpipe.fetch;

import java.time.Duration;

import org.immutables.value.Value;

/**
 * Bounded retry of a fetch. The timeout handed to the transfer tool grows with every attempt, so slow transfers get more
 * time and not just more tries.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface RetryPolicy {
    @Value.Default
    default int maxAttempts() {
        return 3;
    }

    /**
     * Pause between a failed attempt and the next one.
     */
    @Value.Default
    default Duration coolDown() {
        return Duration.ZERO;
    }

    @Value.Default
    default Duration initialTimeout() {
        return Duration.ofMinutes(10);
    }

    @Value.Default
    default Duration timeoutIncrement() {
        return Duration.ofMinutes(10);
    }

    @Value.Check
    default void check() {
        if (maxAttempts() < 1) {
            throw new IllegalArgumentException("A retry policy needs at least one attempt, but was " + maxAttempts());
        }
    }

    /**
     * @param attempt zero based attempt number
     */
    default Duration timeoutForAttempt(int attempt) {
        return initialTimeout().plus(timeoutIncrement().multipliedBy(attempt));
    }

    /**
     * Whether another attempt follows after the given number of attempts failed with the given classification.
     */
    default boolean shouldRetry(FetchFailure failure, int attemptsMade) {
        return failure.isTransient() && attemptsMade < maxAttempts();
    }

    static RetryPolicy objectStoreDefault() {
        return builder().initialTimeout(Duration.ofHours(24)).timeoutIncrement(Duration.ZERO).build();
    }

    static RetryPolicy archiveServiceDefault() {
        return builder().coolDown(Duration.ofMinutes(10)).build();
    }

    static ImmutableRetryPolicy.Builder builder() {
        return ImmutableRetryPolicy.builder();
    }
}
