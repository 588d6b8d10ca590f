package com.netpilot.gateway.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.dispatch.DispatchResult;
import com.netpilot.gateway.dispatch.Dispatcher;
import com.netpilot.gateway.dispatch.PreparedCall;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs operations in the background and tracks them as {@link Job}s.
 *
 * <p>Each job is one task on a fixed worker pool. The task first prepares the
 * call through the {@link Dispatcher} (lookup, lazy load, permission check,
 * validation). A refusal there sends the job straight from PENDING to ERROR;
 * otherwise it goes RUNNING and then DONE or ERROR. Nothing thrown by a job
 * leaves its task, so one job cannot disturb another.
 *
 * <p>Submission never blocks on execution. Jobs have no timeout and cannot be
 * cancelled.
 */
@Service
public class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat    HEX    = HexFormat.of();
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS = new TypeReference<>() {};

    private final Dispatcher      dispatcher;
    private final JobStore        store;
    private final ObjectMapper    json;
    private final ExecutorService workers;

    public JobManager(Dispatcher dispatcher, JobStore store, JobProperties properties, ObjectMapper json) {
        this.dispatcher = dispatcher;
        this.store      = store;
        this.json       = json;
        AtomicInteger seq = new AtomicInteger();
        this.workers    = Executors.newFixedThreadPool(properties.workerThreads(), r -> {
            Thread t = new Thread(r, "gateway-job-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Start one operation in the background; returns its job id immediately. */
    public String submit(String operationName, Map<String, Object> arguments) {
        Job job = newJob(operationName, copy(arguments));
        log.info("Job {} submitted: '{}'", job.getId(), operationName);
        try {
            workers.submit(() -> run(job));
        } catch (RejectedExecutionException e) {
            log.warn("Job {} rejected: job workers are shut down", job.getId());
            job.markError("Job manager is shut down; job was not started");
        }
        return job.getId();
    }

    /** Submit every operation; ids come back in submission order. */
    public List<String> submitBatch(List<BatchOperation> operations) {
        return operations.stream()
                .map(op -> submit(op.tool(), op.arguments()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    public Optional<JobSnapshot> status(String jobId) {
        return store.findById(jobId).map(Job::snapshot);
    }

    /** One element per id, in order; empty for ids this process never issued. */
    public List<Optional<JobSnapshot>> statusBatch(List<String> jobIds) {
        return jobIds.stream().map(this::status).toList();
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Job workers still busy after 10s; abandoning {} running jobs",
                    workers.shutdownNow().size());
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    void run(Job job) {
        try {
            PreparedCall call;
            try {
                call = dispatcher.prepare(job.getOperationName(), job.getArguments(),
                        OperationContext.forJob(job.getId()));
            } catch (OperationException e) {
                DispatchResult refused = dispatcher.rejected(job.getOperationName(), job.getArguments(), e);
                job.markError(refused.error());
                log.info("Job {} refused: {}", job.getId(), refused.error());
                return;
            }

            job.markRunning();
            DispatchResult result = call.invoke();
            if (result.success() || result.isConfirmationRequired()) {
                job.markDone(result.payload());
                log.info("Job {} done{}", job.getId(),
                        result.isConfirmationRequired() ? " (confirmation required)" : "");
            } else {
                job.markError(result.error());
                log.info("Job {} failed: {}", job.getId(), result.error());
            }
        } catch (Throwable t) {
            log.error("Unhandled error in job {} ('{}'): {}", job.getId(), job.getOperationName(),
                    t.getMessage(), t);
            if (!job.getStatus().isTerminal()) {
                job.markError("Unhandled error: " + t);
            }
        }
    }

    private Job newJob(String operationName, Map<String, Object> arguments) {
        while (true) {
            Job job = new Job(newId(), operationName, arguments);
            if (store.add(job)) {
                return job;
            }
        }
    }

    /** 16 lowercase hex characters. */
    static String newId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    /** Deep copy through Jackson, unmodifiable at every level. */
    @SuppressWarnings("unchecked")
    private Map<String, Object> copy(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return Map.of();
        }
        return (Map<String, Object>) freeze(json.convertValue(arguments, ARGS));
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> frozen = new LinkedHashMap<>();
            map.forEach((k, v) -> frozen.put(k, freeze(v)));
            return Collections.unmodifiableMap(frozen);
        }
        if (value instanceof List<?> list) {
            List<Object> frozen = new ArrayList<>(list.size());
            list.forEach(v -> frozen.add(freeze(v)));
            return Collections.unmodifiableList(frozen);
        }
        return value;
    }
}
