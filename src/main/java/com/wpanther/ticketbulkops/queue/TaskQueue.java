package com.wpanther.ticketbulkops.queue;

/**
 * Queue that runs bulk jobs outside the request thread
 */
public interface TaskQueue {

    /**
     * Enqueue a unit of work under the given id
     *
     * @param externalId   unique id naming both the queue entry and the job
     * @param unitOfWork   work to run on a worker thread
     * @throws com.wpanther.ticketbulkops.exception.TaskSubmissionException if the queue refuses the work
     */
    void submit(String externalId, Runnable unitOfWork);

    /**
     * Revoke queued or running work. Running work is interrupted, not stopped immediately.
     *
     * @param externalId the id used on submit
     * @return true if the work was still known to the queue
     */
    boolean revoke(String externalId);

    /**
     * Number of units queued or running
     */
    int activeCount();
}
