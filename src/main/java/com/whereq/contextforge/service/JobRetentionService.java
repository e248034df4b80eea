package com.whereq.contextforge.service;

import com.whereq.contextforge.config.ContextForgeProperties;
import com.whereq.contextforge.queue.JobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Purges finished jobs once they are past the configured retention
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobRetentionService {

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private ContextForgeProperties properties;

    @Scheduled(fixedDelayString = "${contextforge.queue.purge-interval:PT1H}",
        initialDelayString = "${contextforge.queue.purge-interval:PT1H}")
    public void scheduledPurge() {
        purgeExpiredJobs(Instant.now());
    }

    /**
     * @param now reference time
     * @return number of removed jobs
     */
    public int purgeExpiredJobs(Instant now) {
        Instant cutoff = now.minus(properties.getQueue().getRetention());
        int removed = jobQueue.purgeTerminalJobs(cutoff);
        log.debug("Retention pass removed {} job(s) finished before {}", removed, cutoff);
        return removed;
    }
}
