package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.DeduplicationPayload;
import com.whereq.contextforge.model.payload.DeduplicationPayload.CandidateItem;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds groups of near-identical items.
 *
 * Every pair of candidates is compared: identical normalized content scores 1.0, anything
 * else the word-set similarity. Pairs at or above the threshold are then merged into groups,
 * strongest pairs first, each group keeping the most detailed item as its canonical one.
 *
 * @author WhereQ Inc.
 */
public class DeduplicationHandler extends AbstractJobHandler<DeduplicationPayload> {

    private final ObjectMapper objectMapper;

    public DeduplicationHandler(ObjectMapper objectMapper) {
        super(JobType.DEDUPLICATION, DeduplicationPayload.class);
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, DeduplicationPayload payload, ProgressReporter progress) {
        List<CandidateItem> items = payload.getItems();
        progress.report(10, "Comparing " + items.size() + " items");

        List<String> normalized = items.stream().map(item -> TextSimilarity.normalize(item.getContent())).toList();
        List<Pair> matches = new ArrayList<>();
        int comparisons = items.size() * (items.size() - 1) / 2;
        int done = 0;
        for (int i = 0; i < items.size(); i++) {
            for (int j = i + 1; j < items.size(); j++) {
                double similarity = normalized.get(i).equals(normalized.get(j))
                    ? 1.0
                    : TextSimilarity.jaccard(items.get(i).getContent(), items.get(j).getContent());
                if (similarity >= payload.getThreshold()) {
                    matches.add(new Pair(i, j, similarity));
                }
                done++;
            }
            progress.report(10 + (int) (70L * done / Math.max(1, comparisons)), "Compared " + done + "/" + comparisons + " pairs");
        }

        progress.report(85, "Grouping duplicates");
        List<DuplicateGroup> groups = group(items, matches);
        int totalDuplicates = groups.stream().mapToInt(g -> g.getDuplicates().size()).sum();

        ObjectNode data = objectMapper.createObjectNode();
        data.put("collectionId", payload.getCollectionId());
        data.put("totalItems", items.size());
        data.put("matchingPairs", matches.size());
        data.put("duplicateGroups", groups.size());
        data.put("totalDuplicates", totalDuplicates);
        data.set("groups", objectMapper.valueToTree(groups));

        return JobResult.builder()
            .summary("Found " + groups.size() + " duplicate group(s) among " + items.size() + " items")
            .data(data)
            .build();
    }

    static List<DuplicateGroup> group(List<CandidateItem> items, List<Pair> matches) {
        List<Pair> strongestFirst = new ArrayList<>(matches);
        strongestFirst.sort(Comparator.comparingDouble(Pair::getSimilarity).reversed());

        List<DuplicateGroup> groups = new ArrayList<>();
        Map<Integer, DuplicateGroup> groupOf = new HashMap<>();
        for (Pair pair : strongestFirst) {
            DuplicateGroup first = groupOf.get(pair.getFirst());
            DuplicateGroup second = groupOf.get(pair.getSecond());
            if (first == null && second == null) {
                CandidateItem a = items.get(pair.getFirst());
                CandidateItem b = items.get(pair.getSecond());
                CandidateItem canonical = selectCanonical(a, b);
                CandidateItem duplicate = canonical == a ? b : a;
                DuplicateGroup group = new DuplicateGroup(canonical.getId(), new ArrayList<>(List.of(duplicate.getId())),
                    pair.getSimilarity());
                groups.add(group);
                groupOf.put(pair.getFirst(), group);
                groupOf.put(pair.getSecond(), group);
            } else if (first != null && second == null) {
                first.getDuplicates().add(items.get(pair.getSecond()).getId());
                groupOf.put(pair.getSecond(), first);
            } else if (first == null) {
                second.getDuplicates().add(items.get(pair.getFirst()).getId());
                groupOf.put(pair.getFirst(), second);
            }
        }
        return groups;
    }

    /**
     * Prefer clearly longer content, then the more descriptive name, then the first item
     */
    static CandidateItem selectCanonical(CandidateItem first, CandidateItem second) {
        int firstLength = first.getContent().length();
        int secondLength = second.getContent().length();
        if (firstLength > secondLength * 1.2) {
            return first;
        }
        if (secondLength > firstLength * 1.2) {
            return second;
        }
        int firstName = first.getName() == null ? 0 : first.getName().length();
        int secondName = second.getName() == null ? 0 : second.getName().length();
        return secondName > firstName ? second : first;
    }

    @Value
    static class Pair {
        int first;
        int second;
        double similarity;
    }

    @Data
    @AllArgsConstructor
    public static class DuplicateGroup {
        private String canonical;
        private List<String> duplicates;
        private double similarity;
    }
}
