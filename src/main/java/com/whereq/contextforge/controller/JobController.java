package com.whereq.contextforge.controller;

import com.whereq.contextforge.dto.CreateJobRequest;
import com.whereq.contextforge.dto.JobCancellationResponse;
import com.whereq.contextforge.dto.JobStatsResponse;
import com.whereq.contextforge.dto.JobStatusResponse;
import com.whereq.contextforge.dto.JobSubmitResponse;
import com.whereq.contextforge.exception.CancellationRejectedException;
import com.whereq.contextforge.exception.JobAccessDeniedException;
import com.whereq.contextforge.exception.NotFoundException;
import com.whereq.contextforge.exception.QuotaExceededException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.service.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for job status, cancellation and statistics
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Background job status and management")
public class JobController {

    @Autowired
    private JobService jobService;

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Status, progress and result of a job owned by the caller")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(
            @PathVariable String jobId,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);

        return jobService.getJob(jobId, userId)
            .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobStatusResponse.error(e.getMessage()))))
            .onErrorResume(JobAccessDeniedException.class, e -> {
                log.warn("User {} denied access to job {}", userId, jobId);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.FORBIDDEN)
                    .body(JobStatusResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error fetching job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobStatusResponse.error("Internal server error")));
            });
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel a job", description = "Only jobs that have not started executing can be cancelled")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);

        log.info("Job cancellation request for {} from user {}", jobId, userId);

        return jobService.cancelJob(jobId, userId)
            .map(ResponseEntity::ok)
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobCancellationResponse.error(jobId, null, e.getMessage()))))
            .onErrorResume(JobAccessDeniedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(JobCancellationResponse.error(jobId, null, e.getMessage()))))
            .onErrorResume(CancellationRejectedException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(JobCancellationResponse.error(jobId, e.getCurrentStatus(), e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobCancellationResponse.error(jobId, null, "Internal server error")));
            });
    }

    @GetMapping("/stats")
    @Operation(summary = "Job statistics", description = "Caller's recent jobs by status and type plus queue state")
    public Mono<ResponseEntity<JobStatsResponse>> getStats(
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        return jobService.getStats(CallerIdentity.resolve(userHeader))
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error fetching job stats", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "Caller's jobs, most recent first")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listJobs(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) JobStatus status,
            @RequestParam(required = false) JobType type,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        return jobService.listJobs(CallerIdentity.resolve(userHeader), limit, status, type)
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error listing jobs", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @PostMapping
    @Operation(summary = "Create a job", description = "Enqueue one typed job for the caller")
    public Mono<ResponseEntity<JobSubmitResponse>> createJob(
            @Valid @RequestBody CreateJobRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);

        log.info("Received job submission from user {}: type={}", userId, request.getType());

        return jobService.submitJob(request, userId)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(ValidationException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }
}
