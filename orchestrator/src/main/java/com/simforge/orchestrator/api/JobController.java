package com.simforge.orchestrator.api;

import com.simforge.orchestrator.api.dto.JobResponse;
import com.simforge.orchestrator.api.dto.JobResultResponse;
import com.simforge.orchestrator.api.dto.SubmitJobRequest;
import com.simforge.orchestrator.materials.MaterialResolver;
import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.model.JobOptions;
import com.simforge.orchestrator.model.JobResult;
import com.simforge.orchestrator.model.ScoredAttempt;
import com.simforge.orchestrator.progress.ProgressEvent;
import com.simforge.orchestrator.service.JobService;
import com.simforge.orchestrator.service.TrackedJob;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for simulation jobs.
 *
 * POST   /jobs               : submit a new simulation request
 * GET    /jobs               : every registered job, oldest first
 * GET    /jobs/{id}          : poll state, current stage and latest progress
 * GET    /jobs/{id}/progress : every progress event recorded so far
 * GET    /jobs/{id}/result   : terminal result (202 while the job is still running)
 * GET    /jobs/{id}/download : scene file of the best attempt
 * POST   /jobs/{id}/cancel   : request cooperative cancellation
 * DELETE /jobs/{id}          : forget a finished job
 * GET    /materials          : material names known to the catalog
 */
@RestController
public class JobController {

    private final JobService       jobService;
    private final MaterialResolver materials;

    public JobController(JobService jobService, MaterialResolver materials) {
        this.jobService = jobService;
        this.materials  = materials;
    }

    /**
     * Submit a new simulation job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"request":"20 wooden blocks falling on a concrete floor","maxRefinementIterations":2}'
     */
    @PostMapping("/jobs")
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        Job job;
        try {
            JobOptions options = new JobOptions(req.refinementEnabled(), req.maxRefinementIterations());
            job = jobService.submit(req.request(), options);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        TrackedJob tracked = find(job.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(tracked));
    }

    @GetMapping("/jobs")
    public List<JobResponse> listJobs() {
        return jobService.list().stream().map(JobResponse::from).toList();
    }

    @GetMapping("/jobs/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(find(id));
    }

    @GetMapping("/jobs/{id}/progress")
    public List<ProgressEvent> getProgress(@PathVariable UUID id) {
        return find(id).progress().events();
    }

    /**
     * HTTP 200 : job is terminal, body is the full result
     * HTTP 202 : job is still running
     * HTTP 404 : job ID not found
     */
    @GetMapping("/jobs/{id}/result")
    public ResponseEntity<?> getResult(@PathVariable UUID id) {
        Job job = find(id).job();
        JobResult result = job.getResult();
        if (result == null) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "jobState", job.getState().name()));
        }
        return ResponseEntity.ok(JobResultResponse.from(result));
    }

    /**
     * HTTP 200 : the .blend file of the best attempt
     * HTTP 404 : job unknown, no attempt produced a scene, or the file is gone
     * HTTP 409 : job is still running
     */
    @GetMapping("/jobs/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable UUID id) {
        JobResult result = find(id).job().getResult();
        if (result == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Job not finished yet: " + id);
        }
        ScoredAttempt best = result.best();
        if (best == null || best.execution().outputRef() == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job produced no scene: " + id);
        }
        Path file = Path.of(best.execution().outputRef());
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Scene file no longer on disk: " + file);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.getFileName().toString()).build().toString())
                .body(new FileSystemResource(file));
    }

    @PostMapping("/jobs/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable UUID id) {
        return switch (jobService.cancel(id)) {
            case NOT_FOUND -> throw notFound(id);
            case ALREADY_FINISHED -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT, "Job already finished: " + id);
            case REQUESTED, ALREADY_REQUESTED -> ResponseEntity.accepted()
                    .body(Map.of("jobId", id.toString(), "status", "cancel_requested"));
        };
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        return switch (jobService.delete(id)) {
            case NOT_FOUND -> throw notFound(id);
            case STILL_RUNNING -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT, "Job still running, cancel it first: " + id);
            case DELETED -> ResponseEntity.noContent().build();
        };
    }

    @GetMapping("/materials")
    public List<String> listMaterials() {
        return materials.names();
    }

    private TrackedJob find(UUID id) {
        return jobService.find(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }
}
