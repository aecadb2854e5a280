package com.aec.FileVault.service;

import com.aec.FileVault.config.RetryProperties;
import com.aec.FileVault.exception.FileVaultException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry for calls that fail with a retryable {@link FileVaultException}
 * (store, provider or storage unavailability). Anything else propagates on the first attempt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryExecutor {

    private final RetryProperties props;

    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (FileVaultException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts; surfacing {}", operation, attempt, e.getKind());
                    throw e;
                }
                long sleepMs = backoffMillis(attempt);
                log.warn("{} failed with {} (attempt {}/{}). Backing off for {} ms. Error: {}",
                        operation, e.getKind(), attempt, maxAttempts, sleepMs, e.getMessage());
                if (!pause(sleepMs)) {
                    throw e;
                }
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    long backoffMillis(int attempt) {
        long base = props.getInitialBackoff().toMillis();
        if (base <= 0) {
            return 0;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1, base / 2));
        double exp = base * Math.pow(2, attempt - 1) + jitter;
        return (long) Math.min(props.getMaxBackoff().toMillis(), exp);
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
