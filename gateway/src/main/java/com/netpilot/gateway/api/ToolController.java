package com.netpilot.gateway.api;

import com.netpilot.gateway.api.dto.BatchStatusRequest;
import com.netpilot.gateway.api.dto.BatchStatusResponse;
import com.netpilot.gateway.api.dto.BatchSubmitRequest;
import com.netpilot.gateway.api.dto.BatchSubmitResponse;
import com.netpilot.gateway.api.dto.BatchSubmitResponse.SubmittedJob;
import com.netpilot.gateway.api.dto.ExecuteRequest;
import com.netpilot.gateway.api.dto.JobView;
import com.netpilot.gateway.dispatch.DiscoveryService;
import com.netpilot.gateway.dispatch.DiscoveryService.Discovery;
import com.netpilot.gateway.dispatch.DispatchResult;
import com.netpilot.gateway.dispatch.Dispatcher;
import com.netpilot.gateway.job.BatchOperation;
import com.netpilot.gateway.job.JobManager;
import com.netpilot.gateway.job.JobSnapshot;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * REST surface of the gateway.
 *
 * GET  /tools               - every registered operation, callable or not
 * POST /tools/execute       - run one operation synchronously
 * POST /tools/batch         - start operations in the background
 * POST /tools/batch/status  - poll background jobs
 *
 * Operation failures are part of the response body ({@code success:false}),
 * never an HTTP error.
 */
@RestController
@RequestMapping("/tools")
public class ToolController {

    private final DiscoveryService discovery;
    private final Dispatcher       dispatcher;
    private final JobManager       jobs;

    public ToolController(DiscoveryService discovery, Dispatcher dispatcher, JobManager jobs) {
        this.discovery  = discovery;
        this.dispatcher = dispatcher;
        this.jobs       = jobs;
    }

    @GetMapping
    public Discovery list() {
        return discovery.discover();
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/tools/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"tool":"toggle_traffic_route","arguments":{"route_id":"abc","confirm":true}}'
     */
    @PostMapping("/execute")
    public DispatchResult execute(@Valid @RequestBody ExecuteRequest req) {
        return dispatcher.dispatch(req.tool(), req.arguments());
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchSubmitResponse> submitBatch(@Valid @RequestBody BatchSubmitRequest req) {
        List<BatchOperation> operations = req.operations().stream()
                .map(BatchSubmitRequest.Entry::toOperation)
                .toList();
        List<String> ids = jobs.submitBatch(operations);

        List<SubmittedJob> submitted = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            submitted.add(new SubmittedJob(i, operations.get(i).tool(), ids.get(i)));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new BatchSubmitResponse(submitted));
    }

    /** Unknown ids are reported in place with status {@code unknown}. */
    @PostMapping("/batch/status")
    public BatchStatusResponse batchStatus(@Valid @RequestBody BatchStatusRequest req) {
        List<JobView> views = new ArrayList<>(req.jobIds().size());
        List<Optional<JobSnapshot>> snapshots = jobs.statusBatch(req.jobIds());
        for (int i = 0; i < snapshots.size(); i++) {
            String id = req.jobIds().get(i);
            views.add(snapshots.get(i).map(JobView::from).orElseGet(() -> JobView.unknown(id)));
        }
        return new BatchStatusResponse(views);
    }
}
