package com.whereq.contextforge.worker;

import com.whereq.contextforge.model.JobType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers indexed by job type, at most one per type
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> handlers) {
        for (JobHandler handler : handlers) {
            JobHandler previous = this.handlers.putIfAbsent(handler.getJobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + handler.getJobType() + ": "
                    + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered job handlers for {}", this.handlers.keySet());
    }

    public Optional<JobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Collection<JobHandler> getHandlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }
}
