package com.whereq.contextforge.store;

import com.whereq.contextforge.model.Job;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-process job store. Every mutation runs inside {@link ConcurrentHashMap#computeIfPresent},
 * which serializes writers per job id and gives compare-and-set semantics.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    static final Comparator<Job> MOST_RECENT_FIRST = Comparator
        .comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(Comparator.comparingLong(Job::getSequence).reversed());

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(Job job) {
        Job existing = jobs.putIfAbsent(job.getId(), job);
        if (existing != null) {
            throw new IllegalStateException("Job " + job.getId() + " already exists");
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<Job> update(String jobId, Predicate<Job> precondition, UnaryOperator<Job> mutation) {
        if (jobId == null) {
            return Optional.empty();
        }
        AtomicReference<Job> applied = new AtomicReference<>();
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.isTerminal() || !precondition.test(current)) {
                return current;
            }
            Job next = mutation.apply(current);
            if (!next.getId().equals(current.getId())) {
                throw new IllegalStateException("Job id is immutable: " + current.getId());
            }
            if (next.getStatus() != current.getStatus()
                && !current.getStatus().canTransitionTo(next.getStatus())) {
                throw new IllegalStateException("Illegal transition for job " + id + ": "
                    + current.getStatus() + " -> " + next.getStatus());
            }
            applied.set(next);
            return next;
        });
        return Optional.ofNullable(applied.get());
    }

    @Override
    public List<Job> findByUser(String userId, int limit) {
        return jobs.values().stream()
            .filter(job -> job.getUserId() != null && job.getUserId().equals(userId))
            .sorted(MOST_RECENT_FIRST)
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public List<Job> findAll() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public int removeTerminalBefore(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        jobs.values().removeIf(job -> {
            boolean expired = job.isTerminal()
                && job.getCompletedAt() != null
                && job.getCompletedAt().isBefore(cutoff);
            if (expired) {
                removed.incrementAndGet();
            }
            return expired;
        });
        if (removed.get() > 0) {
            log.info("Removed {} finished jobs completed before {}", removed.get(), cutoff);
        }
        return removed.get();
    }
}
