package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.ContentItem;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Access to the content items the pipeline works on
 */
public interface ItemStore {

    Optional<ContentItem> findById(String itemId);

    /**
     * Items owned by a user, most recent first
     *
     * @param userId owner
     * @param collectionId restrict to one collection, null for all items
     * @param limit maximum number of items
     */
    List<ContentItem> list(String userId, String collectionId, int limit);

    /**
     * Items for the given ids in the order requested; unknown ids are skipped
     */
    List<ContentItem> findAllById(Collection<String> itemIds);

    /**
     * Insert or replace an item, assigning an id when it has none
     */
    ContentItem save(ContentItem item);

    /**
     * Insert an item with a caller-chosen id unless one with that id is already stored
     *
     * @return the stored item, empty if the id was taken
     */
    Optional<ContentItem> insertIfAbsent(ContentItem item);

    /**
     * Append an optimization record to an item
     *
     * @return the updated item, empty if it does not exist
     */
    Optional<ContentItem> recordOptimization(String itemId, ContentItem.ItemOptimization optimization);

    /**
     * Set the detected type of an item, leaving every other field as stored
     *
     * @return the updated item, empty if it does not exist
     */
    Optional<ContentItem> updateClassification(String itemId, String type, String subType);
}
