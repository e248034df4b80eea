package com.whereq.contextforge.controller;

import com.whereq.contextforge.queue.JobQueue;
import com.whereq.contextforge.worker.WorkerPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and worker pool status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private WorkerPool workerPool;

    @Autowired
    private JobQueue jobQueue;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its workers are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
                Map<String, Object> health = new HashMap<>();
                health.put("status", workerPool.isRunning() ? "UP" : "DEGRADED");
                health.put("service", "contextforge-pipeline");

                Map<String, Object> workers = new HashMap<>();
                workers.put("running", workerPool.isRunning());
                workers.put("workers", workerPool.getWorkerCount());
                workers.put("activeExecutions", workerPool.getActiveExecutions());
                health.put("workers", workers);

                health.put("queue", Map.of("waitingJobs", jobQueue.size()));
                return ResponseEntity.ok(health);
            })
            .onErrorResume(e -> {
                Map<String, Object> health = new HashMap<>();
                health.put("status", "UP");
                health.put("service", "contextforge-pipeline");
                health.put("workers", Map.of("status", "ERROR", "error", String.valueOf(e.getMessage())));
                return Mono.just(ResponseEntity.ok(health));
            });
    }
}
