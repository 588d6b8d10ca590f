package com.netpilot.gateway.job;

import java.time.Instant;
import java.util.Map;

/**
 * One asynchronously executed operation call.
 *
 * Written only by the worker running it; transitions go through the
 * synchronized {@code mark*} methods and are checked against
 * {@link JobStatus#canTransitionTo}. Readers take a {@link #snapshot()}.
 */
public class Job {

    private final String              id;
    private final String              operationName;
    private final Map<String, Object> arguments;
    private final Instant             createdAt = Instant.now();

    private JobStatus status = JobStatus.PENDING;
    private Object    result;
    private String    error;
    private Instant   startedAt;
    private Instant   completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    /** @param arguments already copied; kept as given */
    public Job(String id, String operationName, Map<String, Object> arguments) {
        this.id            = id;
        this.operationName = operationName;
        this.arguments     = arguments;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public synchronized void markRunning() {
        transition(JobStatus.RUNNING);
        startedAt = Instant.now();
    }

    public synchronized void markDone(Object result) {
        transition(JobStatus.DONE);
        this.result = result;
        completedAt = Instant.now();
    }

    public synchronized void markError(String error) {
        transition(JobStatus.ERROR);
        this.error  = error;
        completedAt = Instant.now();
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot go from " + status + " to " + next);
        }
        status = next;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String              getId()            { return id; }
    public String              getOperationName() { return operationName; }
    public Map<String, Object> getArguments()     { return arguments; }
    public Instant             getCreatedAt()     { return createdAt; }
    public synchronized JobStatus getStatus()     { return status; }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, operationName, arguments, status, result, error,
                createdAt, startedAt, completedAt);
    }
}
