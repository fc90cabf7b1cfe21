package com.yerin.bgjob.application;

/**
 * Unit of work invoked by the worker pool for queue jobs whose handler equals {@link #name()}.
 * Runs inside the job store transaction exposed by {@link JobExecution#getTransaction()}.
 */
public interface JobHandler {
    String name();

    /**
     * @return output recorded on the queue job and its history row; may be null
     */
    String handle(JobExecution execution) throws Exception;
}
