package com.wpanther.ticketbulkops.batch;

import com.wpanther.ticketbulkops.exception.RemoteApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BatchExecutor
 */
class BatchExecutorTest {

    private static final Duration DELAY = Duration.ofSeconds(1);
    private static final Duration COOLDOWN = Duration.ofSeconds(60);

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Integer> progress = new ArrayList<>();

    private BatchExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new BatchExecutor(sleeps::add);
        ReflectionTestUtils.setField(executor, "rateLimitCooldownSeconds", 60L);
    }

    @Test
    void testExecute_AllSucceed() throws Exception {
        // Arrange
        List<Long> applied = new ArrayList<>();

        // Act
        BatchResult result = executor.execute(List.of(1L, 2L, 3L), applied::add, DELAY,
                (processed, total) -> progress.add(processed));

        // Assert
        assertThat(applied).containsExactly(1L, 2L, 3L);
        assertThat(result.getSuccessful()).containsExactly(1L, 2L, 3L);
        assertThat(result.getFailed()).isEmpty();
        assertThat(progress).containsExactly(1, 2, 3);
        // No pause after the last item
        assertThat(sleeps).containsExactly(DELAY, DELAY);
    }

    @Test
    void testExecute_EmptyBatch() throws Exception {
        // Act
        BatchResult result = executor.execute(List.of(), ticketId -> { }, DELAY);

        // Assert
        assertThat(result.successCount()).isZero();
        assertThat(result.failureCount()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void testExecute_RateLimitedItemRetriedOnceAfterCooldown() throws Exception {
        // Arrange
        Set<Long> throttledOnce = new HashSet<>();
        TicketMutation mutation = ticketId -> {
            if (ticketId == 2L && throttledOnce.add(ticketId)) {
                throw new RemoteApiException(429, "Too Many Requests");
            }
        };

        // Act
        BatchResult result = executor.execute(List.of(1L, 2L, 3L), mutation, DELAY,
                (processed, total) -> progress.add(processed));

        // Assert
        assertThat(result.getSuccessful()).containsExactly(1L, 2L, 3L);
        assertThat(result.getFailed()).isEmpty();
        assertThat(progress).containsExactly(1, 2, 3);
        // Cooldown replaces the regular pause after a retried item
        assertThat(sleeps).containsExactly(DELAY, COOLDOWN);
    }

    @Test
    void testExecute_RetryFailureIsRecorded() throws Exception {
        // Arrange
        TicketMutation mutation = ticketId -> {
            if (ticketId == 1L) {
                throw new RemoteApiException(429, "Too Many Requests");
            }
        };

        // Act
        BatchResult result = executor.execute(List.of(1L, 2L), mutation, DELAY,
                (processed, total) -> progress.add(processed));

        // Assert
        assertThat(result.getSuccessful()).containsExactly(2L);
        assertThat(result.getFailed()).containsExactly(1L);
        assertThat(result.getErrors()).containsExactly("Ticket 1: Too Many Requests");
        assertThat(progress).containsExactly(2);
        assertThat(sleeps).containsExactly(COOLDOWN);
    }

    @Test
    void testExecute_OtherFailureRecordedWithoutCooldown() throws Exception {
        // Arrange
        TicketMutation mutation = ticketId -> {
            if (ticketId == 2L) {
                throw new RemoteApiException(404, "Zendesk API returned HTTP 404: not found");
            }
        };

        // Act
        BatchResult result = executor.execute(List.of(1L, 2L, 3L), mutation, DELAY,
                (processed, total) -> progress.add(processed));

        // Assert
        assertThat(result.getSuccessful()).containsExactly(1L, 3L);
        assertThat(result.getFailed()).containsExactly(2L);
        assertThat(result.errorFor(2L)).isEqualTo("Ticket 2: Zendesk API returned HTTP 404: not found");
        assertThat(progress).containsExactly(1, 3);
        assertThat(sleeps).containsExactly(DELAY);
        assertThat(sleeps).doesNotContain(COOLDOWN);
    }

    @Test
    void testExecute_RateLimitDetectedFromMessage() throws Exception {
        // Arrange
        Set<Long> throttledOnce = new HashSet<>();
        TicketMutation mutation = ticketId -> {
            if (throttledOnce.add(ticketId)) {
                throw new IllegalStateException("HTTP 429 returned by upstream");
            }
        };

        // Act
        BatchResult result = executor.execute(List.of(7L), mutation, DELAY);

        // Assert
        assertThat(result.getSuccessful()).containsExactly(7L);
        assertThat(sleeps).containsExactly(COOLDOWN);
    }

    @Test
    void testExecute_InterruptedPausePropagates() {
        // Arrange
        BatchExecutor interrupting = new BatchExecutor(duration -> {
            throw new InterruptedException("revoked");
        });

        // Act & Assert
        assertThatThrownBy(() -> interrupting.execute(List.of(1L, 2L), ticketId -> { }, DELAY))
                .isInstanceOf(InterruptedException.class);
    }

    @Test
    void testIsRateLimitSignal() {
        assertThat(BatchExecutor.isRateLimitSignal(new RemoteApiException(429, "slow down"))).isTrue();
        assertThat(BatchExecutor.isRateLimitSignal(new RemoteApiException(0, "Rate limit exceeded"))).isTrue();
        assertThat(BatchExecutor.isRateLimitSignal(new RemoteApiException(500, "server error"))).isFalse();
        assertThat(BatchExecutor.isRateLimitSignal(new RuntimeException("rate limit hit"))).isTrue();
        assertThat(BatchExecutor.isRateLimitSignal(new RuntimeException((String) null))).isFalse();
    }

    @Test
    void testToPayload() throws Exception {
        // Arrange
        BatchResult result = executor.execute(List.of(5L, 6L), ticketId -> {
            if (ticketId == 6L) {
                throw new IllegalArgumentException("closed ticket");
            }
        }, Duration.ZERO);

        // Act & Assert
        assertThat(result.toPayload())
                .containsEntry("successful", 1)
                .containsEntry("failed", 1)
                .containsEntry("successful_tickets", List.of(5L))
                .containsEntry("failed_tickets", List.of(6L))
                .containsEntry("errors", List.of("Ticket 6: closed ticket"));
    }
}
