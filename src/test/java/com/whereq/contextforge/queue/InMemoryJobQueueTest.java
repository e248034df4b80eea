package com.whereq.contextforge.queue;

import com.whereq.contextforge.exception.QuotaExceededException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.ClassificationPayload;
import com.whereq.contextforge.model.payload.QualityAssessmentPayload;
import com.whereq.contextforge.store.InMemoryJobStore;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobQueueTest {

    private static Validator validator;

    private InMemoryJobQueue queue;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(new InMemoryJobStore(), validator, () -> JobPriority.NORMAL, 1000, 3);
    }

    @Test
    void addJobCreatesPendingRecord() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        Job job = queue.getJobStatus(jobId).orElseThrow();
        assertThat(jobId).startsWith("job-");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getAttempts()).isZero();
        assertThat(job.getMaxAttempts()).isEqualTo(3);
        assertThat(job.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(job.getUserId()).isEqualTo("alice");
        assertThat(job.getCreatedAt()).isNotNull();
        assertThat(queue.getJobProgress(jobId)).hasValue(0);
    }

    @Test
    void addJobRejectsPayloadOfAnotherType() {
        assertThatThrownBy(() -> queue.addJob(JobType.OPTIMIZATION, classification("alice")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("does not match job type OPTIMIZATION");
        assertThat(queue.size()).isZero();
    }

    @Test
    void addJobReportsEveryViolation() {
        ClassificationPayload payload = ClassificationPayload.builder().userId("alice").build();

        assertThatThrownBy(() -> queue.addJob(JobType.CLASSIFICATION, payload))
            .isInstanceOfSatisfying(ValidationException.class, e ->
                assertThat(e.getViolations()).hasSize(2)
                    .anyMatch(v -> v.startsWith("content"))
                    .anyMatch(v -> v.startsWith("format")));
    }

    @Test
    void addJobRejectsNonPositiveMaxAttempts() {
        JobOptions options = JobOptions.builder().maxAttempts(0).build();

        assertThatThrownBy(() -> queue.addJob(JobType.CLASSIFICATION, classification("alice"), options))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void claimFollowsPriorityThenEnqueueOrder() {
        String low = queue.addJob(JobType.CLASSIFICATION, classification("alice"), JobOptions.withPriority(JobPriority.LOW));
        String normal1 = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        String urgent = queue.addJob(JobType.CLASSIFICATION, classification("alice"), JobOptions.withPriority(JobPriority.URGENT));
        String normal2 = queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        List<String> claimed = new ArrayList<>();
        Optional<Job> next;
        while ((next = queue.claimNext(JobType.CLASSIFICATION)).isPresent()) {
            claimed.add(next.get().getId());
        }

        assertThat(claimed).containsExactly(urgent, normal1, normal2, low);
    }

    @Test
    void claimOnlyReturnsJobsOfTheRequestedType() {
        queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        assertThat(queue.claimNext(JobType.QUALITY_ASSESSMENT)).isEmpty();
        assertThat(queue.claimNext(JobType.CLASSIFICATION)).isPresent();
    }

    @Test
    void claimMovesJobToProcessing() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();

        assertThat(claimed.getId()).isEqualTo(jobId);
        assertThat(claimed.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(claimed.getStartedAt()).isNotNull();
        assertThat(queue.size()).isZero();
    }

    @Test
    void concurrentClaimsNeverHandOutTheSameJobTwice() throws Exception {
        int jobs = 200;
        for (int i = 0; i < jobs; i++) {
            queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        }

        Set<String> claimed = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    Optional<Job> job;
                    while ((job = queue.claimNext(JobType.CLASSIFICATION)).isPresent()) {
                        if (!claimed.add(job.get().getId())) {
                            synchronized (duplicates) {
                                duplicates.add(job.get().getId());
                            }
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(duplicates).isEmpty();
        assertThat(claimed).hasSize(jobs);
    }

    @Test
    void cancelPendingJobRemovesItFromTheQueue() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        assertThat(queue.cancelJob(jobId)).isTrue();

        Job job = queue.getJobStatus(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(queue.claimNext(JobType.CLASSIFICATION)).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void cancelProcessingJobIsRejected() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        queue.claimNext(JobType.CLASSIFICATION);

        assertThat(queue.cancelJob(jobId)).isFalse();
        assertThat(queue.getJobStatus(jobId)).get().extracting(Job::getStatus).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void cancelUnknownJobReturnsFalse() {
        assertThat(queue.cancelJob("job-missing")).isFalse();
    }

    @Test
    void progressIsClampedAndNeverDecreases() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();

        assertThat(queue.updateProgress(jobId, claimed.getAttempts(), 40)).isTrue();
        queue.updateProgress(jobId, claimed.getAttempts(), 10);
        assertThat(queue.getJobProgress(jobId)).hasValue(40);

        queue.updateProgress(jobId, claimed.getAttempts(), 250);
        assertThat(queue.getJobProgress(jobId)).hasValue(100);
    }

    @Test
    void progressFromAStaleAttemptIsIgnored() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();

        assertThat(queue.updateProgress(jobId, claimed.getAttempts() + 1, 50)).isFalse();
        assertThat(queue.getJobProgress(jobId)).hasValue(0);
    }

    @Test
    void markCompletedStoresResult() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();

        Optional<Job> completed = queue.markCompleted(jobId, claimed.getAttempts(),
            JobResult.builder().summary("done").build());

        assertThat(completed).isPresent();
        Job job = completed.get();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getResult().getSummary()).isEqualTo("done");
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getResult().getCompletedAt()).isEqualTo(job.getCompletedAt());
    }

    @Test
    void completedJobCannotBeCompletedAgain() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();
        queue.markCompleted(jobId, claimed.getAttempts(), JobResult.empty());

        assertThat(queue.markCompleted(jobId, claimed.getAttempts(), JobResult.empty())).isEmpty();
        assertThat(queue.markFailed(jobId, claimed.getAttempts(), "late", true)).isEmpty();
    }

    @Test
    void retryableFailuresExhaustTheAttemptBudget() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));

        for (int run = 1; run <= 3; run++) {
            Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();
            Job failed = queue.markFailed(jobId, claimed.getAttempts(), "boom " + run, true).orElseThrow();
            assertThat(failed.getAttempts()).isEqualTo(run);
            if (run < 3) {
                assertThat(failed.getStatus()).isEqualTo(JobStatus.RETRY);
                assertThat(queue.claimNext(JobType.CLASSIFICATION)).isEmpty();
                assertThat(queue.requeue(jobId)).isTrue();
            } else {
                assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
                assertThat(failed.getError()).isEqualTo("boom 3");
            }
        }
        assertThat(queue.requeue(jobId)).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    void nonRetryableFailureIsTerminalImmediately() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();

        Job failed = queue.markFailed(jobId, claimed.getAttempts(), "bad input", false).orElseThrow();

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getAttempts()).isEqualTo(1);
    }

    @Test
    void jobInRetryCanBeCancelled() {
        String jobId = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();
        queue.markFailed(jobId, claimed.getAttempts(), "boom", true);

        assertThat(queue.cancelJob(jobId)).isTrue();
        assertThat(queue.requeue(jobId)).isFalse();
        assertThat(queue.getJobStatus(jobId)).get().extracting(Job::getStatus).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void requeueRetryingMovesOnlyRetryJobsBackToPending() {
        String retrying = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        Job claimed = queue.claimNext(JobType.CLASSIFICATION).orElseThrow();
        queue.markFailed(retrying, claimed.getAttempts(), "boom", true);
        String waiting = queue.addJob(JobType.CLASSIFICATION, classification("bob"));

        assertThat(queue.requeueRetrying()).isEqualTo(1);

        assertThat(queue.getJobStatus(retrying)).get().extracting(Job::getStatus).isEqualTo(JobStatus.PENDING);
        assertThat(queue.getJobStatus(waiting)).get().extracting(Job::getStatus).isEqualTo(JobStatus.PENDING);
        assertThat(queue.requeueRetrying()).isZero();
    }

    @Test
    void addJobFailsWhenQueueIsFull() {
        InMemoryJobQueue small = new InMemoryJobQueue(new InMemoryJobStore(), validator, () -> JobPriority.NORMAL, 2, 3);
        small.addJob(JobType.CLASSIFICATION, classification("alice"));
        small.addJob(JobType.CLASSIFICATION, classification("alice"));

        assertThatThrownBy(() -> small.addJob(JobType.CLASSIFICATION, classification("alice")))
            .isInstanceOf(QuotaExceededException.class);

        small.claimNext(JobType.CLASSIFICATION);
        assertThat(small.addJob(JobType.CLASSIFICATION, classification("alice"))).isNotBlank();
    }

    @Test
    void queueStatsCountJobsByTypeAndStatus() {
        String first = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        queue.addJob(JobType.QUALITY_ASSESSMENT, quality("bob"));
        queue.cancelJob(first);

        QueueStats classification = queue.getQueueStats().get(JobType.CLASSIFICATION);
        assertThat(classification.getPending()).isEqualTo(1);
        assertThat(classification.getCancelled()).isEqualTo(1);
        assertThat(classification.getTotal()).isEqualTo(2);
        assertThat(queue.getQueueStats().get(JobType.QUALITY_ASSESSMENT).getPending()).isEqualTo(1);
        assertThat(queue.getQueueStats().get(JobType.EMBEDDING).getTotal()).isZero();
    }

    @Test
    void userJobsAreScopedToTheOwner() {
        queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        queue.addJob(JobType.QUALITY_ASSESSMENT, quality("bob"));

        assertThat(queue.getUserJobs("alice", 10)).extracting(Job::getUserId).containsOnly("alice");
        assertThat(queue.getUserJobs("carol", 10)).isEmpty();
    }

    @Test
    void purgeRemovesOnlyOldTerminalJobs() {
        String cancelled = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        String pendingJob = queue.addJob(JobType.CLASSIFICATION, classification("alice"));
        queue.cancelJob(cancelled);

        int purged = queue.purgeTerminalJobs(Instant.now().plusSeconds(1));

        assertThat(purged).isEqualTo(1);
        assertThat(queue.getJobStatus(cancelled)).isEmpty();
        assertThat(queue.getJobStatus(pendingJob)).isPresent();
    }

    private static ClassificationPayload classification(String userId) {
        return ClassificationPayload.builder()
            .userId(userId)
            .itemId("item-1")
            .content("You are a helpful assistant")
            .format("text")
            .build();
    }

    private static QualityAssessmentPayload quality(String userId) {
        return QualityAssessmentPayload.builder()
            .userId(userId)
            .itemId("item-2")
            .content("Summarize the document")
            .type("prompt")
            .format("text")
            .build();
    }
}
