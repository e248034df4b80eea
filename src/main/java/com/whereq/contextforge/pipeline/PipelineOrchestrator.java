package com.whereq.contextforge.pipeline;

import com.whereq.contextforge.exception.NotFoundException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.integration.AuditLog;
import com.whereq.contextforge.integration.ItemStore;
import com.whereq.contextforge.integration.JobNotifier;
import com.whereq.contextforge.model.AuditEvent;
import com.whereq.contextforge.model.ContentItem;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.NotificationEvent;
import com.whereq.contextforge.model.NotificationEvent.EventType;
import com.whereq.contextforge.model.OptimizationOptions;
import com.whereq.contextforge.model.PipelineConfig;
import com.whereq.contextforge.model.TargetModel;
import com.whereq.contextforge.model.payload.ClassificationPayload;
import com.whereq.contextforge.model.payload.DeduplicationPayload;
import com.whereq.contextforge.model.payload.OptimizationPayload;
import com.whereq.contextforge.model.payload.QualityAssessmentPayload;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload.Algorithm;
import com.whereq.contextforge.queue.JobOptions;
import com.whereq.contextforge.queue.JobQueue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides which background jobs to create for items, batches and collections.
 * Owns the automation policy; it creates jobs through the queue but never changes their state.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class PipelineOrchestrator {

    static final int DUPLICATE_CANDIDATE_LIMIT = 1000;
    static final int STATUS_WINDOW = 20;
    static final int RECENT_JOBS = 10;

    private static final String DEFAULT_FORMAT = "text";
    private static final String DEFAULT_TYPE = "prompt";

    private final JobQueue jobQueue;
    private final ItemStore itemStore;
    private final AuditLog auditLog;
    private final JobNotifier notifier;
    private final PipelineSettings settings;
    private final Duration interBatchDelay;

    public PipelineOrchestrator(JobQueue jobQueue,
                                ItemStore itemStore,
                                AuditLog auditLog,
                                JobNotifier notifier,
                                PipelineSettings settings,
                                Duration interBatchDelay) {
        this.jobQueue = jobQueue;
        this.itemStore = itemStore;
        this.auditLog = auditLog;
        this.notifier = notifier;
        this.settings = settings;
        this.interBatchDelay = interBatchDelay;
    }

    public PipelineConfig getConfig() {
        return settings.snapshot();
    }

    public PipelineConfig updateConfig(PipelineConfigUpdate update) {
        return settings.update(update);
    }

    /**
     * Create the pipeline jobs for one item
     *
     * @return ids of the created jobs, empty when the item is skipped (already optimized or blank)
     * @throws NotFoundException if the item does not exist or belongs to another user
     */
    public List<String> processItem(String itemId, OptimizationOptions options) {
        String userId = requireUser(options);
        ContentItem item = itemStore.findById(itemId)
            .filter(found -> userId.equals(found.getUserId()))
            .orElseThrow(() -> NotFoundException.item(itemId));

        if (item.isOptimized() && options.isSkipIfOptimized() && !options.isForceReprocess()) {
            log.info("Skipping item {}: already optimized", itemId);
            return List.of();
        }
        if (item.getContent() == null || item.getContent().isBlank()) {
            log.warn("Skipping item {}: no content to process", itemId);
            return List.of();
        }

        PipelineConfig config = settings.snapshot();
        JobOptions jobOptions = JobOptions.withPriority(config.getPriority());
        String content = item.getContent();
        String format = item.getFormat() != null ? item.getFormat() : DEFAULT_FORMAT;
        List<String> jobIds = new ArrayList<>();

        try {
            if (config.isEnableQualityAssessment()) {
                jobIds.add(jobQueue.addJob(JobType.QUALITY_ASSESSMENT, QualityAssessmentPayload.builder()
                    .userId(userId)
                    .itemId(itemId)
                    .content(content)
                    .type(item.getType() != null ? item.getType() : DEFAULT_TYPE)
                    .format(format)
                    .build(), jobOptions));
            }

            if (config.isEnableAutoClassification()) {
                jobIds.add(jobQueue.addJob(JobType.CLASSIFICATION, ClassificationPayload.builder()
                    .userId(userId)
                    .itemId(itemId)
                    .content(content)
                    .format(format)
                    .targetModels(options.getTargetModels())
                    .build(), jobOptions));
            }

            if (config.isEnableAutoOptimization()) {
                for (TargetModel targetModel : options.effectiveTargetModels()) {
                    jobIds.add(jobQueue.addJob(JobType.OPTIMIZATION, OptimizationPayload.builder()
                        .userId(userId)
                        .itemId(itemId)
                        .content(content)
                        .targetModel(targetModel)
                        .currentFormat(format)
                        .build(), jobOptions));
                }
            }
        } catch (RuntimeException e) {
            log.error("Pipeline failed for item {} after creating jobs {}: {}", itemId, jobIds, e.getMessage());
            notify(userId, NotificationEvent.pipeline(EventType.PIPELINE_FAILED,
                "Pipeline failed for item " + itemId + ": " + e.getMessage()));
            throw e;
        }

        auditLog.append(AuditEvent.builder()
            .userId(userId)
            .action("pipeline_execution")
            .entityType("item")
            .entityId(itemId)
            .metadata(Map.of(
                "jobIds", jobIds,
                "forceReprocess", options.isForceReprocess(),
                "targetModels", options.effectiveTargetModels()))
            .build());

        log.info("Created {} pipeline job(s) for item {}", jobIds.size(), itemId);
        notify(userId, NotificationEvent.pipeline(EventType.PIPELINE_STARTED,
            "Created " + jobIds.size() + " job(s) for item " + itemId));
        return jobIds;
    }

    /**
     * Process items in chunks of the configured batch size. Items of a chunk run concurrently,
     * chunks run one after another. Item failures are collected, never raised.
     */
    public Mono<BatchResult> processBatch(List<String> itemIds, OptimizationOptions options) {
        if (itemIds == null || itemIds.isEmpty()) {
            return Mono.error(new ValidationException("itemIds must not be empty"));
        }
        try {
            requireUser(options);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        int batchSize = settings.snapshot().getBatchSize();
        List<List<String>> chunks = chunk(itemIds, batchSize);
        log.info("Processing batch of {} items in {} chunk(s)", itemIds.size(), chunks.size());

        return Flux.range(0, chunks.size())
            .concatMap(index -> {
                Mono<List<ItemOutcome>> chunkRun = processChunk(chunks.get(index), options);
                boolean last = index == chunks.size() - 1;
                return last || interBatchDelay.isZero() ? chunkRun : chunkRun.delayElement(interBatchDelay);
            })
            .flatMapIterable(outcomes -> outcomes)
            .collect(() -> BatchResult.builder().totalItems(itemIds.size()).build(), this::accumulate);
    }

    /**
     * Run {@link #processBatch} in the background. Completion and failure are logged and pushed
     * to the notifier; the returned handle replays the outcome to any subscriber.
     */
    public Mono<BatchResult> startBatch(List<String> itemIds, OptimizationOptions options) {
        String userId = options != null ? options.getUserId() : null;
        Mono<BatchResult> run = processBatch(itemIds, options)
            .doOnSuccess(result -> {
                log.info("Batch finished: {} processed, {} failed, {} job(s) created",
                    result.getProcessedItems(), result.getFailedItems(), result.getJobIds().size());
                notify(userId, NotificationEvent.pipeline(EventType.BATCH_COMPLETED,
                    "Batch processed " + result.getProcessedItems() + "/" + result.getTotalItems()
                        + " item(s), " + result.getFailedItems() + " failed"));
            })
            .doOnError(error -> {
                log.error("Batch processing failed", error);
                notify(userId, NotificationEvent.pipeline(EventType.PIPELINE_FAILED,
                    "Batch processing failed: " + error.getMessage()));
            })
            .cache();

        run.onErrorResume(e -> Mono.empty()) // failure already logged and pushed
            .subscribe();
        return run;
    }

    /**
     * Ids of a user's items in a collection, most recent first
     */
    public List<String> findCollectionItemIds(String userId, String collectionId) {
        return itemStore.list(userId, collectionId, Integer.MAX_VALUE).stream()
            .map(ContentItem::getId)
            .toList();
    }

    /**
     * Create one deduplication job over the user's items, always at the default similarity threshold
     *
     * @param collectionId restrict to one collection, null for all items
     * @return the job id, empty when detection is disabled or there are fewer than two items
     */
    public Optional<String> runDuplicateDetection(String userId, String collectionId) {
        if (!settings.snapshot().isEnableDuplicateDetection()) {
            log.info("Duplicate detection disabled, ignoring request from user {}", userId);
            return Optional.empty();
        }

        List<ContentItem> items = itemStore.list(userId, collectionId, DUPLICATE_CANDIDATE_LIMIT);
        if (items.size() < 2) {
            log.info("Skipping duplicate detection for user {}: {} item(s) found", userId, items.size());
            return Optional.empty();
        }

        List<DeduplicationPayload.CandidateItem> candidates = items.stream()
            .map(item -> DeduplicationPayload.CandidateItem.builder()
                .id(item.getId())
                .name(item.getName())
                .content(item.getContent() != null ? item.getContent() : "")
                .build())
            .toList();

        String jobId = jobQueue.addJob(JobType.DEDUPLICATION, DeduplicationPayload.builder()
            .userId(userId)
            .collectionId(collectionId)
            .items(candidates)
            .threshold(DeduplicationPayload.DEFAULT_THRESHOLD)
            .build(), JobOptions.withPriority(settings.snapshot().getPriority()));

        log.info("Started duplicate detection job {} over {} items", jobId, candidates.size());
        notify(userId, NotificationEvent.pipeline(EventType.DUPLICATE_DETECTION_STARTED,
            "Comparing " + candidates.size() + " items"));
        return Optional.of(jobId);
    }

    public List<String> runSimilarityScoring(String sourceItemId, List<String> targetItemIds, String userId) {
        return runSimilarityScoring(sourceItemId, targetItemIds, userId, Algorithm.SEMANTIC);
    }

    /**
     * Create one similarity job per target item that exists
     *
     * @throws NotFoundException if the source item does not exist or belongs to another user
     */
    public List<String> runSimilarityScoring(String sourceItemId,
                                             List<String> targetItemIds,
                                             String userId,
                                             Algorithm algorithm) {
        ContentItem source = itemStore.findById(sourceItemId)
            .filter(item -> Objects.equals(userId, item.getUserId()))
            .orElseThrow(() -> NotFoundException.item(sourceItemId));
        List<ContentItem> targets = itemStore.findAllById(targetItemIds == null ? List.of() : targetItemIds).stream()
            .filter(item -> Objects.equals(userId, item.getUserId()))
            .toList();

        JobOptions jobOptions = JobOptions.withPriority(settings.snapshot().getPriority());
        List<String> jobIds = new ArrayList<>();
        for (ContentItem target : targets) {
            jobIds.add(jobQueue.addJob(JobType.SIMILARITY_SCORING, SimilarityScoringPayload.builder()
                .userId(userId)
                .sourceItemId(source.getId())
                .targetItemId(target.getId())
                .sourceContent(source.getContent() != null ? source.getContent() : "")
                .targetContent(target.getContent() != null ? target.getContent() : "")
                .algorithm(algorithm != null ? algorithm : Algorithm.SEMANTIC)
                .build(), jobOptions));
        }
        log.info("Created {} similarity job(s) for source item {}", jobIds.size(), sourceItemId);
        return jobIds;
    }

    /**
     * Counts over the user's most recent jobs
     */
    public PipelineStatus getPipelineStatus(String userId) {
        List<Job> jobs = jobQueue.getUserJobs(userId, STATUS_WINDOW);

        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            byStatus.put(status, 0L);
        }
        Map<JobType, Long> byType = new EnumMap<>(JobType.class);
        for (Job job : jobs) {
            byStatus.merge(job.getStatus(), 1L, Long::sum);
            byType.merge(job.getType(), 1L, Long::sum);
        }

        return PipelineStatus.builder()
            .total(jobs.size())
            .jobsByStatus(byStatus)
            .jobsByType(byType)
            .recentJobs(jobs.subList(0, Math.min(RECENT_JOBS, jobs.size())))
            .build();
    }

    /**
     * Run the pipeline for a freshly created or imported item
     */
    public List<String> autoProcessNewItem(String itemId, String userId) {
        return processItem(itemId, OptimizationOptions.builder()
            .itemId(itemId)
            .userId(userId)
            .skipIfOptimized(true)
            .build());
    }

    private Mono<List<ItemOutcome>> processChunk(List<String> chunk, OptimizationOptions options) {
        return Flux.fromIterable(chunk)
            .flatMap(itemId -> Mono.fromCallable(() -> processItem(itemId, options.toBuilder().itemId(itemId).build()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(jobIds -> ItemOutcome.success(itemId, jobIds))
                .onErrorResume(e -> {
                    log.warn("Failed to process item {} in batch: {}", itemId, e.getMessage());
                    return Mono.just(ItemOutcome.failure(itemId, e));
                }), chunk.size())
            .collectList();
    }

    private void accumulate(BatchResult result, ItemOutcome outcome) {
        if (outcome.error == null) {
            result.setProcessedItems(result.getProcessedItems() + 1);
            result.getJobIds().addAll(outcome.jobIds);
        } else {
            result.setFailedItems(result.getFailedItems() + 1);
            String message = outcome.error.getMessage() != null
                ? outcome.error.getMessage()
                : outcome.error.getClass().getSimpleName();
            result.getErrors().add(new BatchResult.ItemError(outcome.itemId, message));
        }
    }

    private void notify(String userId, NotificationEvent event) {
        notifier.push(userId, event).subscribe();
    }

    private static String requireUser(OptimizationOptions options) {
        if (options == null || options.getUserId() == null || options.getUserId().isBlank()) {
            throw new ValidationException("userId is required");
        }
        return options.getUserId();
    }

    static <T> List<List<T>> chunk(List<T> values, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < values.size(); i += size) {
            chunks.add(values.subList(i, Math.min(values.size(), i + size)));
        }
        return chunks;
    }

    private static final class ItemOutcome {
        private final String itemId;
        private final List<String> jobIds;
        private final Throwable error;

        private ItemOutcome(String itemId, List<String> jobIds, Throwable error) {
            this.itemId = itemId;
            this.jobIds = jobIds;
            this.error = error;
        }

        static ItemOutcome success(String itemId, List<String> jobIds) {
            return new ItemOutcome(itemId, jobIds, null);
        }

        static ItemOutcome failure(String itemId, Throwable error) {
            return new ItemOutcome(itemId, List.of(), error);
        }
    }
}
