package com.whereq.contextforge.queue;

import com.whereq.contextforge.exception.QuotaExceededException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.JobPayload;
import com.whereq.contextforge.store.JobStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-process job queue.
 * Job records live in the {@link JobStore}; a per-type skip list indexes the PENDING ones by
 * priority and enqueue order. Claiming polls the index and then compare-and-sets the record
 * from PENDING to PROCESSING, so an entry left behind by a cancelled job is simply skipped.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final JobStore store;
    private final Validator validator;
    private final Supplier<JobPriority> defaultPriority;
    private final long maxSize;
    private final int defaultMaxAttempts;

    private final Map<JobType, ConcurrentSkipListSet<QueueEntry>> pending = new EnumMap<>(JobType.class);
    private final AtomicLong sequence = new AtomicLong();

    // PENDING + RETRY jobs, used for backpressure
    private final AtomicLong waiting = new AtomicLong();

    public InMemoryJobQueue(JobStore store,
                            Validator validator,
                            Supplier<JobPriority> defaultPriority,
                            long maxSize,
                            int defaultMaxAttempts) {
        this.store = store;
        this.validator = validator;
        this.defaultPriority = defaultPriority;
        this.maxSize = maxSize;
        this.defaultMaxAttempts = defaultMaxAttempts;
        for (JobType type : JobType.values()) {
            pending.put(type, new ConcurrentSkipListSet<>());
        }
    }

    @Override
    public String addJob(JobType type, JobPayload payload, JobOptions options) {
        validate(type, payload);
        JobOptions effective = options != null ? options : JobOptions.defaults();

        int maxAttempts = effective.getMaxAttempts() != null ? effective.getMaxAttempts() : defaultMaxAttempts;
        if (maxAttempts < 1) {
            throw new ValidationException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        JobPriority priority = effective.getPriority() != null ? effective.getPriority() : defaultPriority.get();

        if (waiting.incrementAndGet() > maxSize) {
            waiting.decrementAndGet();
            throw new QuotaExceededException("Job queue is full (" + maxSize + " jobs waiting)");
        }

        Job job = Job.builder()
            .id("job-" + UUID.randomUUID())
            .type(type)
            .payload(payload)
            .priority(priority)
            .status(JobStatus.PENDING)
            .attempts(0)
            .maxAttempts(maxAttempts)
            .progress(0)
            .userId(payload.getUserId())
            .createdAt(Instant.now())
            .sequence(sequence.incrementAndGet())
            .build();

        try {
            store.insert(job);
        } catch (RuntimeException e) {
            waiting.decrementAndGet();
            throw e;
        }
        pending.get(type).add(QueueEntry.of(job));

        log.info("Enqueued {} job {} for user {} (priority {})", type, job.getId(), job.getUserId(), priority);
        return job.getId();
    }

    @Override
    public Optional<Job> getJobStatus(String jobId) {
        return store.findById(jobId);
    }

    @Override
    public OptionalInt getJobProgress(String jobId) {
        return store.findById(jobId)
            .map(job -> OptionalInt.of(job.getProgress()))
            .orElseGet(OptionalInt::empty);
    }

    @Override
    public List<Job> getUserJobs(String userId, int limit) {
        return store.findByUser(userId, limit);
    }

    @Override
    public boolean cancelJob(String jobId) {
        Optional<Job> cancelled = store.update(jobId,
            job -> job.getStatus().isCancellable(),
            job -> job.toBuilder()
                .status(JobStatus.CANCELLED)
                .completedAt(Instant.now())
                .build());

        cancelled.ifPresent(job -> {
            waiting.decrementAndGet();
            pending.get(job.getType()).remove(QueueEntry.of(job));
            log.info("Cancelled job {}", jobId);
        });
        return cancelled.isPresent();
    }

    @Override
    public Map<JobType, QueueStats> getQueueStats() {
        Map<JobType, QueueStats> stats = new EnumMap<>(JobType.class);
        for (JobType type : JobType.values()) {
            stats.put(type, new QueueStats());
        }
        for (Job job : store.findAll()) {
            stats.get(job.getType()).increment(job.getStatus());
        }
        return stats;
    }

    @Override
    public long size() {
        return waiting.get();
    }

    @Override
    public Optional<Job> claimNext(JobType type) {
        ConcurrentSkipListSet<QueueEntry> index = pending.get(type);
        QueueEntry entry;
        while ((entry = index.pollFirst()) != null) {
            Optional<Job> claimed = store.update(entry.getJobId(),
                job -> job.getStatus() == JobStatus.PENDING,
                job -> job.toBuilder()
                    .status(JobStatus.PROCESSING)
                    .progress(0)
                    .startedAt(job.getStartedAt() != null ? job.getStartedAt() : Instant.now())
                    .build());
            if (claimed.isPresent()) {
                waiting.decrementAndGet();
                log.debug("Claimed job {} (attempt {}/{})", entry.getJobId(),
                    claimed.get().getAttempts() + 1, claimed.get().getMaxAttempts());
                return claimed;
            }
            log.debug("Skipping stale queue entry for job {}", entry.getJobId());
        }
        return Optional.empty();
    }

    @Override
    public boolean updateProgress(String jobId, int attempt, int progress) {
        int bounded = Math.max(0, Math.min(100, progress));
        return store.update(jobId,
            job -> isCurrentClaim(job, attempt),
            job -> job.toBuilder()
                .progress(Math.max(job.getProgress(), bounded))
                .build())
            .isPresent();
    }

    @Override
    public Optional<Job> markCompleted(String jobId, int attempt, JobResult result) {
        Instant now = Instant.now();
        JobResult stored = (result != null ? result : JobResult.empty()).toBuilder()
            .completedAt(now)
            .build();
        Optional<Job> completed = store.update(jobId,
            job -> isCurrentClaim(job, attempt),
            job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(100)
                .result(stored)
                .error(null)
                .completedAt(now)
                .build());
        if (completed.isEmpty()) {
            log.warn("Dropped completion of job {} attempt {}: claim is no longer current", jobId, attempt);
        }
        return completed;
    }

    @Override
    public Optional<Job> markFailed(String jobId, int attempt, String error, boolean retryable) {
        Optional<Job> failed = store.update(jobId,
            job -> isCurrentClaim(job, attempt),
            job -> {
                int attempts = job.getAttempts() + 1;
                if (retryable && attempts < job.getMaxAttempts()) {
                    return job.toBuilder()
                        .status(JobStatus.RETRY)
                        .attempts(attempts)
                        .error(error)
                        .build();
                }
                return job.toBuilder()
                    .status(JobStatus.FAILED)
                    .attempts(attempts)
                    .error(error)
                    .completedAt(Instant.now())
                    .build();
            });
        failed.filter(job -> job.getStatus() == JobStatus.RETRY)
            .ifPresent(job -> waiting.incrementAndGet());
        if (failed.isEmpty()) {
            log.warn("Dropped failure of job {} attempt {}: claim is no longer current", jobId, attempt);
        }
        return failed;
    }

    @Override
    public boolean requeue(String jobId) {
        Optional<Job> requeued = store.update(jobId,
            job -> job.getStatus() == JobStatus.RETRY,
            job -> job.toBuilder().status(JobStatus.PENDING).build());
        requeued.ifPresent(job -> pending.get(job.getType()).add(QueueEntry.of(job)));
        return requeued.isPresent();
    }

    @Override
    public int requeueRetrying() {
        int requeued = 0;
        for (Job job : store.findAll()) {
            if (job.getStatus() == JobStatus.RETRY && requeue(job.getId())) {
                requeued++;
            }
        }
        return requeued;
    }

    @Override
    public int purgeTerminalJobs(Instant cutoff) {
        return store.removeTerminalBefore(cutoff);
    }

    private static boolean isCurrentClaim(Job job, int attempt) {
        return job.getStatus() == JobStatus.PROCESSING && job.getAttempts() == attempt;
    }

    private void validate(JobType type, JobPayload payload) {
        if (type == null) {
            throw new ValidationException("Job type is required");
        }
        if (payload == null) {
            throw new ValidationException("Payload is required for " + type + " jobs");
        }
        if (!type.accepts(payload)) {
            throw new ValidationException("Payload " + payload.getClass().getSimpleName()
                + " does not match job type " + type + " (expected "
                + type.getPayloadClass().getSimpleName() + ")");
        }
        Set<ConstraintViolation<JobPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .toList();
            throw new ValidationException("Invalid " + type + " payload: " + String.join(", ", messages), messages);
        }
    }
}
