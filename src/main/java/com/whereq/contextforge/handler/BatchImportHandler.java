package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.integration.ItemStore;
import com.whereq.contextforge.model.ContentItem;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.BatchImportPayload;
import com.whereq.contextforge.model.payload.BatchImportPayload.ImportFile;
import com.whereq.contextforge.pipeline.PipelineOrchestrator;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns imported files into items and runs the pipeline on each new item.
 * A file that fails to import or process is recorded and the import continues.
 * Item ids are derived from the import and the file path, so a retried import
 * skips files an earlier attempt already stored instead of creating them twice.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class BatchImportHandler extends AbstractJobHandler<BatchImportPayload> {

    private final ItemStore itemStore;
    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public BatchImportHandler(ItemStore itemStore, PipelineOrchestrator orchestrator, ObjectMapper objectMapper) {
        super(JobType.BATCH_IMPORT, BatchImportPayload.class);
        this.itemStore = itemStore;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, BatchImportPayload payload, ProgressReporter progress) {
        List<ImportFile> files = payload.getFiles();
        ObjectNode data = objectMapper.createObjectNode();
        data.put("importId", payload.getImportId());
        ArrayNode imported = data.putArray("items");
        ArrayNode errors = data.putArray("errors");
        int pipelineJobs = 0;
        int skipped = 0;

        for (int i = 0; i < files.size(); i++) {
            ImportFile file = files.get(i);
            try {
                Optional<ContentItem> inserted = itemStore.insertIfAbsent(toItem(payload, file));
                if (inserted.isPresent()) {
                    ContentItem item = inserted.get();
                    List<String> jobIds = orchestrator.autoProcessNewItem(item.getId(), payload.getUserId());
                    pipelineJobs += jobIds.size();
                    imported.addObject()
                        .put("path", file.getPath())
                        .put("itemId", item.getId())
                        .put("jobs", jobIds.size());
                } else {
                    log.info("Import {}: {} already imported, skipping", payload.getImportId(), file.getPath());
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Import {}: failed to import {}: {}", payload.getImportId(), file.getPath(), e.getMessage());
                errors.addObject()
                    .put("path", file.getPath())
                    .put("message", e.getMessage());
            }
            progress.report(percentOf(i + 1, files.size()), "Imported " + (i + 1) + "/" + files.size() + " files");
        }

        data.put("pipelineJobs", pipelineJobs);
        data.put("skipped", skipped);
        return JobResult.builder()
            .summary("Imported " + imported.size() + "/" + files.size() + " files")
            .data(data)
            .build();
    }

    private static ContentItem toItem(BatchImportPayload payload, ImportFile file) {
        Set<String> collections = new HashSet<>();
        if (payload.getCollectionId() != null) {
            collections.add(payload.getCollectionId());
        }
        return ContentItem.builder()
            .id(itemId(payload, file))
            .userId(payload.getUserId())
            .name(fileName(file.getPath()))
            .content(file.getContent())
            .format(formatOf(file.getPath()))
            .collectionIds(collections)
            .build();
    }

    static String itemId(BatchImportPayload payload, ImportFile file) {
        String key = payload.getUserId() + ":" + payload.getImportId() + ":" + file.getPath();
        return "item-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    private static int percentOf(int done, int total) {
        return (int) (100L * done / total);
    }

    static String fileName(String path) {
        String normalized = path.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String formatOf(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".md") || lower.endsWith(".markdown") || lower.endsWith(".mdc")) {
            return "markdown";
        }
        if (lower.endsWith(".json")) {
            return "json";
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return "yaml";
        }
        return "text";
    }
}
