package com.whereq.contextforge.worker;

import com.whereq.contextforge.exception.JobExecutionException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.integration.JobNotifier;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.NotificationEvent;
import com.whereq.contextforge.model.NotificationEvent.EventType;
import com.whereq.contextforge.model.RetryPolicy;
import com.whereq.contextforge.queue.JobQueue;
import com.whereq.contextforge.queue.QueueStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background workers that claim jobs from the queue and execute them.
 *
 * Each job type with a registered handler gets its own set of worker loops. A loop claims
 * one job at a time, runs the handler on the bounded elastic scheduler under the execution
 * timeout and records the outcome through the queue. Failures are retried with exponential
 * backoff until the job's attempt budget is spent.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class WorkerPool {

    private final JobQueue jobQueue;
    private final JobHandlerRegistry handlerRegistry;
    private final JobNotifier notifier;
    private final WorkerPoolSettings settings;
    private final RetryPolicy retryPolicy;

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter retryCounter;
    private final Timer executionTimer;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger activeExecutions = new AtomicInteger();
    private final List<Disposable> workers = new CopyOnWriteArrayList<>();
    private volatile Scheduler retryScheduler;

    public WorkerPool(JobQueue jobQueue,
                      JobHandlerRegistry handlerRegistry,
                      JobNotifier notifier,
                      WorkerPoolSettings settings,
                      RetryPolicy retryPolicy,
                      MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.handlerRegistry = handlerRegistry;
        this.notifier = notifier;
        this.settings = settings;
        this.retryPolicy = retryPolicy;

        successCounter = Counter.builder("contextforge.jobs.succeeded")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failureCounter = Counter.builder("contextforge.jobs.failed")
            .description("Number of jobs that failed permanently")
            .register(meterRegistry);

        retryCounter = Counter.builder("contextforge.jobs.retried")
            .description("Number of failed executions scheduled for retry")
            .register(meterRegistry);

        executionTimer = Timer.builder("contextforge.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        retryScheduler = Schedulers.newParallel("job-retry", 1);

        int recovered = jobQueue.requeueRetrying();
        if (recovered > 0) {
            log.info("Requeued {} job(s) left in RETRY by a previous run", recovered);
        }

        for (JobHandler handler : handlerRegistry.getHandlers()) {
            int concurrency = settings.concurrencyFor(handler.getJobType());
            for (int i = 0; i < concurrency; i++) {
                workers.add(workerLoop(handler, i));
            }
            log.info("Started {} worker(s) for {} jobs", concurrency, handler.getJobType());
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workers.forEach(Disposable::dispose);
        workers.clear();
        if (retryScheduler != null) {
            retryScheduler.dispose();
        }
        long processing = 0;
        long retrying = 0;
        for (QueueStats stats : jobQueue.getQueueStats().values()) {
            processing += stats.getProcessing();
            retrying += stats.getRetry();
        }
        if (processing > 0 || retrying > 0) {
            log.warn("Worker pool stopped with {} job(s) in PROCESSING and {} in RETRY; "
                + "RETRY jobs are requeued on the next start", processing, retrying);
        } else {
            log.info("Worker pool stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getWorkerCount() {
        return workers.size();
    }

    public int getActiveExecutions() {
        return activeExecutions.get();
    }

    private Disposable workerLoop(JobHandler handler, int index) {
        return Mono.defer(() -> pollOnce(handler))
            .repeat(running::get)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                processed -> { },
                error -> log.error("Worker {}-{} terminated unexpectedly", handler.getJobType(), index, error));
    }

    /**
     * Claim and execute at most one job, or wait one poll interval when none is pending
     */
    private Mono<Boolean> pollOnce(JobHandler handler) {
        if (!running.get()) {
            return Mono.just(false);
        }
        Optional<Job> claimed;
        try {
            claimed = jobQueue.claimNext(handler.getJobType());
        } catch (RuntimeException e) {
            log.error("Failed to claim {} job", handler.getJobType(), e);
            return Mono.delay(settings.getPollInterval()).thenReturn(false);
        }
        return claimed
            .map(job -> execute(handler, job).thenReturn(true))
            .orElseGet(() -> Mono.delay(settings.getPollInterval()).thenReturn(false));
    }

    private Mono<Void> execute(JobHandler handler, Job job) {
        int attempt = job.getAttempts();
        log.info("Starting execution of job {} ({}, attempt {}/{})",
            job.getId(), job.getType(), attempt + 1, job.getMaxAttempts());
        notify(job, NotificationEvent.forJob(EventType.JOB_STARTED, job, null));

        ProgressReporter reporter = (percentage, message) -> reportProgress(job, attempt, percentage, message);
        long startTime = System.currentTimeMillis();
        activeExecutions.incrementAndGet();

        return Mono.fromCallable(() -> handler.execute(job, reporter))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(settings.getExecutionTimeout())
            .defaultIfEmpty(JobResult.empty())
            .doOnNext(result -> handleSuccess(job, attempt, result, elapsedSince(startTime)))
            .doOnError(error -> handleFailure(job, attempt, error, elapsedSince(startTime)))
            .onErrorResume(e -> Mono.empty()) // outcome already recorded, keep the loop alive
            .doFinally(signal -> activeExecutions.decrementAndGet())
            .then();
    }

    private void reportProgress(Job job, int attempt, int percentage, String message) {
        try {
            if (jobQueue.updateProgress(job.getId(), attempt, percentage)) {
                notify(job, NotificationEvent.builder()
                    .type(EventType.JOB_PROGRESS)
                    .jobId(job.getId())
                    .jobType(job.getType())
                    .status(JobStatus.PROCESSING)
                    .progress(percentage)
                    .message(message)
                    .build());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record progress for job {}: {}", job.getId(), e.getMessage());
        }
    }

    private void handleSuccess(Job job, int attempt, JobResult result, long executionTime) {
        executionTimer.record(Duration.ofMillis(executionTime));
        try {
            JobResult timed = result.toBuilder().executionTimeMs(executionTime).build();
            jobQueue.markCompleted(job.getId(), attempt, timed).ifPresent(completed -> {
                successCounter.increment();
                log.info("Job {} completed in {}ms", job.getId(), executionTime);
                notify(completed, NotificationEvent.forJob(EventType.JOB_COMPLETED, completed, timed.getSummary()));
            });
        } catch (RuntimeException e) {
            log.error("Failed to record completion of job {}", job.getId(), e);
        }
    }

    private void handleFailure(Job job, int attempt, Throwable error, long executionTime) {
        executionTimer.record(Duration.ofMillis(executionTime));
        boolean retryable = isRetryable(error);
        String message = describe(error);
        try {
            jobQueue.markFailed(job.getId(), attempt, message, retryable).ifPresent(failed -> {
                if (failed.getStatus() == JobStatus.RETRY) {
                    scheduleRetry(failed, error);
                } else {
                    failureCounter.increment();
                    log.warn("Job {} failed permanently after {} attempt(s): {}",
                        failed.getId(), failed.getAttempts(), message, error);
                    notify(failed, NotificationEvent.forJob(EventType.JOB_FAILED, failed, message));
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to record failure of job {}", job.getId(), e);
        }
    }

    private void scheduleRetry(Job job, Throwable error) {
        retryCounter.increment();
        long delay = calculateBackoff(job.getAttempts(), retryPolicy, ThreadLocalRandom.current().nextDouble());
        log.info("Retrying job {} in {}ms (attempt {}/{}): {}",
            job.getId(), delay, job.getAttempts() + 1, job.getMaxAttempts(), error.getMessage());
        notify(job, NotificationEvent.forJob(EventType.JOB_RETRY, job, job.getError()));

        Scheduler scheduler = retryScheduler;
        if (!running.get() || scheduler == null) {
            log.warn("Worker pool stopped, job {} stays in RETRY", job.getId());
            return;
        }
        scheduler.schedule(() -> requeue(job.getId()), delay, TimeUnit.MILLISECONDS);
    }

    private void requeue(String jobId) {
        try {
            if (!jobQueue.requeue(jobId)) {
                log.info("Job {} left RETRY during its backoff, not requeued", jobId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to requeue job {}", jobId, e);
        }
    }

    private void notify(Job job, NotificationEvent event) {
        try {
            notifier.push(job.getUserId(), event).subscribe();
        } catch (RuntimeException e) {
            log.warn("Failed to push {} for job {}: {}", event.getType(), job.getId(), e.getMessage());
        }
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Job execution timed out after " + settings.getExecutionTimeout();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof JobExecutionException executionError) {
            return executionError.isRetryable();
        }
        return !(error instanceof ValidationException);
    }

    /**
     * Exponential backoff delay before the next attempt
     *
     * @param failedAttempts failed executions so far, at least 1
     * @param policy retry policy
     * @param jitterSample uniform sample in [0, 1); 0.5 means no jitter
     * @return delay in milliseconds, never above the policy's maximum interval
     */
    static long calculateBackoff(int failedAttempts, RetryPolicy policy, double jitterSample) {
        long initialInterval = policy.getInitialIntervalMs();
        int multiplier = policy.getBackoffMultiplier();
        long maxInterval = policy.getMaxIntervalMs();

        double backoff = Math.min(initialInterval * Math.pow(multiplier, Math.max(0, failedAttempts - 1)), maxInterval);
        double jitter = backoff * policy.getJitterFactor() * (2 * jitterSample - 1);
        return Math.max(0, Math.min(maxInterval, Math.round(backoff + jitter)));
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
