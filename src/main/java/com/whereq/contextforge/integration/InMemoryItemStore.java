package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.ContentItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Item store kept in memory. Items are copied on the way in and out.
 */
@Slf4j
public class InMemoryItemStore implements ItemStore {

    private final Map<String, ContentItem> items = new ConcurrentHashMap<>();

    @Override
    public Optional<ContentItem> findById(String itemId) {
        return itemId == null ? Optional.empty() : Optional.ofNullable(items.get(itemId)).map(InMemoryItemStore::copy);
    }

    @Override
    public List<ContentItem> list(String userId, String collectionId, int limit) {
        return items.values().stream()
            .filter(item -> Objects.equals(item.getUserId(), userId))
            .filter(item -> collectionId == null || item.getCollectionIds().contains(collectionId))
            .sorted(Comparator.comparing(ContentItem::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(Math.max(0, limit))
            .map(InMemoryItemStore::copy)
            .toList();
    }

    @Override
    public List<ContentItem> findAllById(Collection<String> itemIds) {
        List<ContentItem> found = new ArrayList<>();
        for (String itemId : itemIds) {
            findById(itemId).ifPresent(found::add);
        }
        return found;
    }

    @Override
    public ContentItem save(ContentItem item) {
        ContentItem stored = copy(item);
        if (stored.getId() == null) {
            stored.setId("item-" + UUID.randomUUID());
        }
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(Instant.now());
        }
        items.put(stored.getId(), stored);
        log.debug("Saved item {} for user {}", stored.getId(), stored.getUserId());
        return copy(stored);
    }

    @Override
    public Optional<ContentItem> insertIfAbsent(ContentItem item) {
        ContentItem stored = copy(item);
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(Instant.now());
        }
        if (items.putIfAbsent(Objects.requireNonNull(stored.getId(), "item id"), stored) != null) {
            return Optional.empty();
        }
        log.debug("Inserted item {} for user {}", stored.getId(), stored.getUserId());
        return Optional.of(copy(stored));
    }

    @Override
    public Optional<ContentItem> recordOptimization(String itemId, ContentItem.ItemOptimization optimization) {
        ContentItem updated = items.computeIfPresent(itemId, (id, current) -> {
            ContentItem next = copy(current);
            next.getOptimizations().add(optimization);
            return next;
        });
        return Optional.ofNullable(updated).map(InMemoryItemStore::copy);
    }

    @Override
    public Optional<ContentItem> updateClassification(String itemId, String type, String subType) {
        ContentItem updated = items.computeIfPresent(itemId, (id, current) -> {
            ContentItem next = copy(current);
            next.setType(type);
            next.setSubType(subType);
            return next;
        });
        return Optional.ofNullable(updated).map(InMemoryItemStore::copy);
    }

    private static ContentItem copy(ContentItem item) {
        return item.toBuilder()
            .collectionIds(item.getCollectionIds() != null ? new HashSet<>(item.getCollectionIds()) : new HashSet<>())
            .optimizations(item.getOptimizations() != null ? new ArrayList<>(item.getOptimizations()) : new ArrayList<>())
            .build();
    }
}
