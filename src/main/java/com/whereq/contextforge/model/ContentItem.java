package com.whereq.contextforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A curated prompt, agent, rule or template as seen by the pipeline
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem {
    private String id;

    /**
     * Owner of the item
     */
    private String userId;

    private String name;

    private String content;

    /**
     * prompt, agent, rule, template or other
     */
    private String type;

    private String subType;

    /**
     * Source format (markdown, json, yaml, text...)
     */
    private String format;

    @Builder.Default
    private Set<String> collectionIds = new HashSet<>();

    /**
     * Prior optimizations recorded for the item
     */
    @Builder.Default
    private List<ItemOptimization> optimizations = new ArrayList<>();

    private Instant createdAt;

    public boolean isOptimized() {
        return optimizations != null && !optimizations.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemOptimization {
        private TargetModel targetModel;
        private Instant createdAt;
    }
}
