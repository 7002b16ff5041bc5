package com.wpanther.ticketbulkops.queue;

import com.wpanther.ticketbulkops.exception.TaskSubmissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process task queue backed by the bulk job thread pool
 */
@Component
@Slf4j
public class ExecutorTaskQueue implements TaskQueue {

    private final Executor executor;

    // Queued or running work by external id
    private final Map<String, FutureTask<Void>> tasks = new ConcurrentHashMap<>();

    public ExecutorTaskQueue(@Qualifier("bulkJobExecutor") Executor executor) {
        this.executor = executor;
    }

    @Override
    public void submit(String externalId, Runnable unitOfWork) {
        FutureTask<Void> task = new FutureTask<>(unitOfWork, null) {
            @Override
            protected void done() {
                tasks.remove(externalId, this);
            }
        };

        if (tasks.putIfAbsent(externalId, task) != null) {
            throw new TaskSubmissionException("Task already queued: " + externalId, null);
        }

        try {
            executor.execute(task);
            log.info("Enqueued task {}, active tasks: {}", externalId, tasks.size());
        } catch (RejectedExecutionException e) {
            tasks.remove(externalId, task);
            log.error("Task queue rejected task {}", externalId, e);
            throw new TaskSubmissionException("Task queue is full, try again later", e);
        }
    }

    @Override
    public boolean revoke(String externalId) {
        FutureTask<Void> task = tasks.remove(externalId);
        if (task == null) {
            log.debug("Revoke requested for unknown or finished task {}", externalId);
            return false;
        }
        boolean cancelled = task.cancel(true);
        log.info("Revoked task {} (cancelled={})", externalId, cancelled);
        return true;
    }

    @Override
    public int activeCount() {
        return tasks.size();
    }
}
