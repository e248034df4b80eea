package com.whereq.contextforge.controller;

import com.whereq.contextforge.dto.DuplicateDetectionRequest;
import com.whereq.contextforge.dto.PipelineProcessRequest;
import com.whereq.contextforge.dto.PipelineResponse;
import com.whereq.contextforge.exception.NotFoundException;
import com.whereq.contextforge.exception.QuotaExceededException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.OptimizationOptions;
import com.whereq.contextforge.model.PipelineConfig;
import com.whereq.contextforge.pipeline.PipelineConfigUpdate;
import com.whereq.contextforge.pipeline.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for pipeline triggers, status and configuration
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Optimization pipeline triggers and configuration")
public class PipelineController {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @PostMapping("/process")
    @Operation(summary = "Process items",
        description = "Run the pipeline for one item (single), a list of items (batch) or a collection")
    public Mono<ResponseEntity<PipelineResponse>> process(
            @RequestParam(defaultValue = "single") String mode,
            @RequestBody PipelineProcessRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);
        OptimizationOptions options = OptimizationOptions.builder()
            .userId(userId)
            .forceReprocess(request.isForceReprocess())
            .targetModels(request.getTargetModels())
            .skipIfOptimized(request.isSkipIfOptimized())
            .build();

        log.info("Pipeline process request from user {}: mode={}", userId, mode);

        Mono<PipelineResponse> response = switch (mode) {
            case "single" -> Mono.fromCallable(() -> processSingle(request, options));
            case "batch" -> Mono.fromCallable(() -> processBatch(request, options));
            case "collection" -> Mono.fromCallable(() -> processCollection(request, options, userId));
            default -> Mono.error(new ValidationException("Invalid processing mode: " + mode));
        };

        return withErrorMapping(response.subscribeOn(Schedulers.boundedElastic()));
    }

    @PostMapping("/duplicates")
    @Operation(summary = "Detect duplicates",
        description = "Start duplicate detection (detect) or similarity scoring against a source item (similarity)")
    public Mono<ResponseEntity<PipelineResponse>> duplicates(
            @RequestParam(defaultValue = "detect") String mode,
            @Valid @RequestBody DuplicateDetectionRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);

        Mono<PipelineResponse> response = switch (mode) {
            case "detect" -> Mono.fromCallable(() -> detectDuplicates(request, userId));
            case "similarity" -> Mono.fromCallable(() -> scoreSimilarity(request, userId));
            default -> Mono.error(new ValidationException("Invalid mode: " + mode));
        };

        return withErrorMapping(response.subscribeOn(Schedulers.boundedElastic()));
    }

    @GetMapping("/status")
    @Operation(summary = "Pipeline status", description = "Caller's recent pipeline jobs and the current configuration")
    public Mono<ResponseEntity<Map<String, Object>>> status(
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) String userHeader) {

        String userId = CallerIdentity.resolve(userHeader);

        return Mono.fromCallable(() -> {
                Map<String, Object> body = new HashMap<>();
                body.put("status", orchestrator.getPipelineStatus(userId));
                body.put("config", orchestrator.getConfig());
                return ResponseEntity.ok(body);
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error fetching pipeline status for user {}", userId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/config")
    @Operation(summary = "Get pipeline configuration")
    public Mono<PipelineConfig> getConfig() {
        return Mono.fromCallable(orchestrator::getConfig);
    }

    @PutMapping("/config")
    @Operation(summary = "Update pipeline configuration", description = "Fields left out keep their current value")
    public Mono<ResponseEntity<PipelineConfig>> updateConfig(@RequestBody PipelineConfigUpdate update) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.updateConfig(update)))
            .onErrorResume(ValidationException.class, e -> {
                log.warn("Rejected pipeline configuration update: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    private PipelineResponse processSingle(PipelineProcessRequest request, OptimizationOptions options) {
        if (request.getItemId() == null || request.getItemId().isBlank()) {
            throw new ValidationException("itemId is required");
        }
        List<String> jobIds = orchestrator.processItem(request.getItemId(),
            options.toBuilder().itemId(request.getItemId()).build());
        return PipelineResponse.builder()
            .success(true)
            .message(jobIds.isEmpty() ? "Item already optimized, nothing to do" : "Item processing started")
            .itemId(request.getItemId())
            .jobIds(jobIds)
            .build();
    }

    private PipelineResponse processBatch(PipelineProcessRequest request, OptimizationOptions options) {
        List<String> itemIds = request.getItemIds();
        if (itemIds == null || itemIds.isEmpty()) {
            throw new ValidationException("itemIds must not be empty");
        }
        orchestrator.startBatch(itemIds, options);
        return PipelineResponse.builder()
            .success(true)
            .message("Batch processing started for " + itemIds.size() + " items")
            .itemCount(itemIds.size())
            .build();
    }

    private PipelineResponse processCollection(PipelineProcessRequest request, OptimizationOptions options, String userId) {
        if (request.getCollectionId() == null || request.getCollectionId().isBlank()) {
            throw new ValidationException("collectionId is required");
        }
        List<String> itemIds = orchestrator.findCollectionItemIds(userId, request.getCollectionId());
        if (itemIds.isEmpty()) {
            return PipelineResponse.builder()
                .success(false)
                .message("No items found in collection")
                .collectionId(request.getCollectionId())
                .build();
        }
        orchestrator.startBatch(itemIds, options);
        return PipelineResponse.builder()
            .success(true)
            .message("Collection processing started for " + itemIds.size() + " items")
            .itemCount(itemIds.size())
            .collectionId(request.getCollectionId())
            .build();
    }

    private PipelineResponse detectDuplicates(DuplicateDetectionRequest request, String userId) {
        Optional<String> jobId = orchestrator.runDuplicateDetection(userId, request.getCollectionId());
        return PipelineResponse.builder()
            .success(true)
            .message(jobId.isPresent() ? "Duplicate detection started" : "Duplicate detection skipped")
            .collectionId(request.getCollectionId())
            .jobIds(jobId.map(List::of).orElse(List.of()))
            .build();
    }

    private PipelineResponse scoreSimilarity(DuplicateDetectionRequest request, String userId) {
        if (request.getSourceItemId() == null || request.getSourceItemId().isBlank()) {
            throw new ValidationException("sourceItemId is required");
        }
        if (request.getTargetItemIds() == null) {
            throw new ValidationException("targetItemIds is required");
        }
        List<String> jobIds = orchestrator.runSimilarityScoring(
            request.getSourceItemId(), request.getTargetItemIds(), userId, request.getAlgorithm());
        return PipelineResponse.builder()
            .success(true)
            .message("Similarity scoring started")
            .sourceItemId(request.getSourceItemId())
            .targetCount(request.getTargetItemIds().size())
            .jobIds(jobIds)
            .build();
    }

    private Mono<ResponseEntity<PipelineResponse>> withErrorMapping(Mono<PipelineResponse> response) {
        return response
            .map(ResponseEntity::ok)
            .onErrorResume(ValidationException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(PipelineResponse.error(e.getMessage())));
            })
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(PipelineResponse.error(e.getMessage()))))
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(PipelineResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected pipeline error", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(PipelineResponse.error("Internal server error")));
            });
    }
}
