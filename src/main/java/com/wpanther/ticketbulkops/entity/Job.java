package com.wpanther.ticketbulkops.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Duration;
import java.time.Instant;

/**
 * Entity tracking one asynchronous bulk run.
 * State is changed only through the transition methods; terminal jobs ignore further transitions.
 * Updates write changed columns only, so progress writes from the worker do not overwrite a cancellation.
 */
@Entity
@DynamicUpdate
@Table(name = "bulk_jobs", indexes = {
        @Index(name = "idx_bulk_jobs_owner", columnList = "owner_id"),
        @Index(name = "idx_bulk_jobs_status", columnList = "status"),
        @Index(name = "idx_bulk_jobs_operation", columnList = "operation_slug"),
        @Index(name = "idx_bulk_jobs_created", columnList = "created_at")
})
@Getter
@ToString(exclude = "resultData")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Task queue id, used for correlation and for revoking the queued work
    @Column(name = "external_id", nullable = false, unique = true)
    private String externalId;

    @Column(name = "operation_slug", nullable = false, length = 100)
    private String operationSlug;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "processed_items", nullable = false)
    private int processedItems;

    // JSON document, only present once completed
    @Lob
    @Column(name = "result_data")
    private String resultData;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    /**
     * New job in PENDING with nothing processed yet
     */
    public static Job create(String externalId, String operationSlug, int totalItems, String ownerId) {
        if (totalItems < 0) {
            throw new IllegalArgumentException("totalItems must not be negative");
        }
        Job job = new Job();
        job.externalId = externalId;
        job.operationSlug = operationSlug;
        job.totalItems = totalItems;
        job.ownerId = ownerId;
        job.status = JobStatus.PENDING;
        job.progress = 0;
        job.processedItems = 0;
        job.createdAt = Instant.now();
        return job;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Record progress and move to RUNNING.
     * The count never decreases and never exceeds totalItems, so replaying a value is harmless.
     *
     * @return false when the job is already terminal and nothing changed
     */
    public boolean advance(int processed) {
        if (isTerminal()) {
            return false;
        }
        if (status != JobStatus.RUNNING) {
            status = JobStatus.RUNNING;
        }
        if (startedAt == null) {
            startedAt = Instant.now();
        }
        int bounded = Math.min(Math.max(processed, processedItems), totalItems);
        processedItems = bounded;
        progress = computeProgress(bounded, totalItems);
        return true;
    }

    /**
     * @return false when the job is already terminal and nothing changed
     */
    public boolean complete(String resultJson) {
        if (isTerminal()) {
            return false;
        }
        status = JobStatus.COMPLETED;
        progress = 100;
        completedAt = Instant.now();
        resultData = resultJson;
        return true;
    }

    /**
     * @return false when the job is already terminal and nothing changed
     */
    public boolean fail(String message) {
        if (isTerminal()) {
            return false;
        }
        status = JobStatus.FAILED;
        errorMessage = message;
        completedAt = Instant.now();
        return true;
    }

    /**
     * @return false when the job is already terminal and nothing changed
     */
    public boolean cancel() {
        if (isTerminal()) {
            return false;
        }
        status = JobStatus.CANCELLED;
        completedAt = Instant.now();
        return true;
    }

    /**
     * Human readable run time, e.g. "1h 2m 3s", "2m 3s", "3s" or "Not started"
     */
    public String elapsedTime(Instant now) {
        Duration delta;
        if (completedAt != null) {
            delta = Duration.between(createdAt, completedAt);
        } else if (startedAt != null) {
            delta = Duration.between(startedAt, now);
        } else {
            return "Not started";
        }
        return formatDuration(delta);
    }

    static int computeProgress(int processed, int total) {
        if (total <= 0) {
            return 0;
        }
        return (int) ((100L * processed) / total);
    }

    static String formatDuration(Duration delta) {
        long totalSeconds = Math.max(0, delta.getSeconds());
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;

        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        } else if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
