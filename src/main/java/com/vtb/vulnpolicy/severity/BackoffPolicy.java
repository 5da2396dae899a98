package com.vtb.vulnpolicy.severity;

import java.time.Duration;
import java.util.Random;

/**
 * Экспоненциальная задержка между попытками: base * 2^(attempt-1)
 * плюс случайный jitter до base/2. С ключом/токеном база меньше.
 */
class BackoffPolicy {

    private final Duration baseWithCredentials;
    private final Duration baseAnonymous;
    private final Random random;

    BackoffPolicy(Duration baseWithCredentials, Duration baseAnonymous) {
        this(baseWithCredentials, baseAnonymous, new Random());
    }

    BackoffPolicy(Duration baseWithCredentials, Duration baseAnonymous, Random random) {
        this.baseWithCredentials = baseWithCredentials;
        this.baseAnonymous = baseAnonymous;
        this.random = random;
    }

    /**
     * @param attempt номер неудачной попытки, начиная с 1
     */
    Duration delay(int attempt, boolean credentialsConfigured) {
        long baseMs = (credentialsConfigured ? baseWithCredentials : baseAnonymous).toMillis();
        long backoffMs = baseMs << Math.max(0, attempt - 1);
        long jitterBound = baseMs / 2;
        long jitterMs = jitterBound > 0 ? (long) (random.nextDouble() * jitterBound) : 0;
        return Duration.ofMillis(backoffMs + jitterMs);
    }
}
