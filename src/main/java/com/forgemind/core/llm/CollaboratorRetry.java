package com.forgemind.core.llm;

import com.forgemind.core.error.CollaboratorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for calls to external collaborators.
 * Delay before attempt {@code n+1} is {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
 * Parse and empty-response failures are not retried: the model answered, just badly.
 */
public class CollaboratorRetry {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorRetry.class);
    private static final double BACKOFF_FACTOR = 2.0;

    private final String collaborator;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public CollaboratorRetry(String collaborator, int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.collaborator = collaborator;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public <T> T call(String operation, Supplier<T> call) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (LlmParseException | LlmEmptyResponseException | CollaboratorUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayMs(attempt);
                log.warn("{} {} failed (attempt {}/{}), retrying in {}ms: {}",
                        collaborator, operation, attempt, maxAttempts, delay, e.getMessage());
                if (!sleep(delay)) {
                    throw new CollaboratorUnavailableException(collaborator, "interrupted during " + operation, e);
                }
            }
        }
        log.error("{} {} failed after {} attempts", collaborator, operation, maxAttempts);
        throw new CollaboratorUnavailableException(collaborator,
                operation + " failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    long delayMs(int attempt) {
        double delay = initialBackoff.toMillis() * Math.pow(BACKOFF_FACTOR, attempt - 1);
        return (long) Math.min(delay, maxBackoff.toMillis());
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
