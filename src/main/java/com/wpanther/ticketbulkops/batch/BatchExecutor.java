package com.wpanther.ticketbulkops.batch;

import com.wpanther.ticketbulkops.exception.RemoteApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Applies one mutation per ticket, in order, paced by a fixed delay.
 * A throttled call is retried once after a cooldown; any other failure is recorded and the batch moves on.
 * There is no cancellation check between items: a revoked job stops when its thread is interrupted.
 */
@Component
@Slf4j
public class BatchExecutor {

    private final Sleeper sleeper;

    @Value("${app.batch.rate-limit-cooldown-seconds:60}")
    private long rateLimitCooldownSeconds = 60;

    public BatchExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public BatchResult execute(List<Long> ticketIds, TicketMutation mutation, Duration delay)
            throws InterruptedException {
        return execute(ticketIds, mutation, delay, ProgressCallback.NONE);
    }

    /**
     * Run the mutation over all tickets
     *
     * @param ticketIds        tickets in processing order
     * @param mutation         change applied to each ticket
     * @param delay            pause between consecutive items, none after the last
     * @param progressCallback told the 1-based count after each success
     * @return aggregated outcome; per-ticket failures never escape
     * @throws InterruptedException when the worker thread is interrupted while pausing
     */
    public BatchResult execute(List<Long> ticketIds, TicketMutation mutation, Duration delay,
                               ProgressCallback progressCallback) throws InterruptedException {
        BatchResult result = new BatchResult();
        ProgressCallback callback = progressCallback != null ? progressCallback : ProgressCallback.NONE;
        int total = ticketIds.size();

        for (int i = 0; i < total; i++) {
            long ticketId = ticketIds.get(i);
            try {
                mutation.apply(ticketId);
            } catch (RuntimeException e) {
                if (!isRateLimitSignal(e)) {
                    log.warn("Ticket {} failed: {}", ticketId, e.getMessage());
                    result.recordFailure(ticketId, messageOf(e));
                    continue;
                }

                log.warn("Rate limited on ticket {}, cooling down for {}s before retry",
                        ticketId, rateLimitCooldownSeconds);
                sleeper.sleep(Duration.ofSeconds(rateLimitCooldownSeconds));
                try {
                    mutation.apply(ticketId);
                } catch (RuntimeException retryError) {
                    log.warn("Retry failed for ticket {}: {}", ticketId, retryError.getMessage());
                    result.recordFailure(ticketId, messageOf(retryError));
                    continue;
                }
                result.recordSuccess(ticketId);
                callback.onProgress(i + 1, total);
                continue;
            }

            result.recordSuccess(ticketId);
            callback.onProgress(i + 1, total);

            if (i < total - 1) {
                sleeper.sleep(delay);
            }
        }

        log.info("Batch finished: {} successful, {} failed of {}",
                result.successCount(), result.failureCount(), total);
        return result;
    }

    /**
     * Structured signal from the ticket store, falling back to the message for foreign errors
     */
    static boolean isRateLimitSignal(Throwable error) {
        if (error instanceof RemoteApiException) {
            return ((RemoteApiException) error).isRateLimited();
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429") || message.toLowerCase(Locale.ROOT).contains("rate limit");
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
