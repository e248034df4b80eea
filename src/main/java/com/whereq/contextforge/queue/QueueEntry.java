package com.whereq.contextforge.queue;

import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobPriority;
import lombok.Value;

import java.util.Comparator;

/**
 * Pending index entry: higher priority first, then enqueue order
 */
@Value
class QueueEntry implements Comparable<QueueEntry> {

    private static final Comparator<QueueEntry> ORDER = Comparator
        .comparing(QueueEntry::getPriority, Comparator.reverseOrder())
        .thenComparingLong(QueueEntry::getSequence)
        .thenComparing(QueueEntry::getJobId);

    String jobId;
    JobPriority priority;
    long sequence;

    static QueueEntry of(Job job) {
        return new QueueEntry(job.getId(), job.getPriority(), job.getSequence());
    }

    @Override
    public int compareTo(QueueEntry other) {
        return ORDER.compare(this, other);
    }
}
