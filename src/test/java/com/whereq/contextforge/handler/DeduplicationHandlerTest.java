package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.contextforge.handler.DeduplicationHandler.DuplicateGroup;
import com.whereq.contextforge.handler.DeduplicationHandler.Pair;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.DeduplicationPayload;
import com.whereq.contextforge.model.payload.DeduplicationPayload.CandidateItem;
import com.whereq.contextforge.worker.ProgressReporter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicationHandlerTest {

    private final DeduplicationHandler handler = new DeduplicationHandler(new ObjectMapper());

    @Test
    void groupsItemsWithIdenticalNormalizedContent() throws Exception {
        List<CandidateItem> items = List.of(
            candidate("a", "Summary", "Write a summary of the text"),
            candidate("b", "Summary prompt v2", "write a   SUMMARY of the text"),
            candidate("c", "Translator", "Translate the following paragraph into French"));

        JobResult result = handler.execute(job(items, 0.8), ProgressReporter.noop());

        JsonNode data = result.getData();
        assertThat(data.get("totalItems").asInt()).isEqualTo(3);
        assertThat(data.get("matchingPairs").asInt()).isEqualTo(1);
        assertThat(data.get("duplicateGroups").asInt()).isEqualTo(1);
        assertThat(data.get("totalDuplicates").asInt()).isEqualTo(1);
        JsonNode group = data.get("groups").get(0);
        assertThat(group.get("canonical").asText()).isEqualTo("b");
        assertThat(group.get("duplicates").get(0).asText()).isEqualTo("a");
        assertThat(group.get("similarity").asDouble()).isEqualTo(1.0);
    }

    @Test
    void thresholdControlsWhichPairsMatch() throws Exception {
        List<CandidateItem> items = List.of(
            candidate("a", "one", "alpha beta gamma delta"),
            candidate("b", "two", "alpha beta gamma epsilon"));

        JsonNode strict = handler.execute(job(items, 0.8), ProgressReporter.noop()).getData();
        JsonNode loose = handler.execute(job(items, 0.6), ProgressReporter.noop()).getData();

        assertThat(strict.get("duplicateGroups").asInt()).isZero();
        assertThat(loose.get("duplicateGroups").asInt()).isEqualTo(1);
        assertThat(loose.get("groups").get(0).get("similarity").asDouble()).isEqualTo(0.6);
    }

    @Test
    void reportsProgressUpToGrouping() throws Exception {
        List<Integer> reported = new ArrayList<>();
        List<CandidateItem> items = List.of(
            candidate("a", "one", "first"),
            candidate("b", "two", "second"),
            candidate("c", "three", "third"));

        handler.execute(job(items, 0.8), (percentage, message) -> reported.add(percentage));

        assertThat(reported).isSorted().contains(10, 85);
        assertThat(reported).allMatch(p -> p <= 85);
    }

    @Test
    void strongestPairsClaimItemsFirst() {
        List<CandidateItem> items = List.of(
            candidate("a", "a", "same length text"),
            candidate("b", "b", "same length text"),
            candidate("c", "c", "same length text"));
        List<Pair> matches = List.of(new Pair(0, 1, 0.9), new Pair(1, 2, 0.95));

        List<DuplicateGroup> groups = DeduplicationHandler.group(items, matches);

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.getCanonical()).isEqualTo("b");
            assertThat(group.getDuplicates()).containsExactly("c", "a");
            assertThat(group.getSimilarity()).isEqualTo(0.95);
        });
    }

    @Test
    void canonicalPrefersClearlyLongerContent() {
        CandidateItem shortItem = candidate("short", "A very descriptive name", "tiny");
        CandidateItem longItem = candidate("long", "x", "a much longer body of text");

        assertThat(DeduplicationHandler.selectCanonical(shortItem, longItem)).isSameAs(longItem);
        assertThat(DeduplicationHandler.selectCanonical(longItem, shortItem)).isSameAs(longItem);
    }

    @Test
    void canonicalFallsBackToNameThenFirstItem() {
        CandidateItem first = candidate("first", "abc", "0123456789");
        CandidateItem second = candidate("second", "abcdef", "0123456789a");
        CandidateItem twin = candidate("twin", "abc", "0123456789");

        assertThat(DeduplicationHandler.selectCanonical(first, second)).isSameAs(second);
        assertThat(DeduplicationHandler.selectCanonical(first, twin)).isSameAs(first);
    }

    private static CandidateItem candidate(String id, String name, String content) {
        return CandidateItem.builder().id(id).name(name).content(content).build();
    }

    private static Job job(List<CandidateItem> items, double threshold) {
        return Job.builder()
            .id("job-dedup")
            .type(JobType.DEDUPLICATION)
            .status(JobStatus.PROCESSING)
            .userId("alice")
            .payload(DeduplicationPayload.builder()
                .userId("alice")
                .items(items)
                .threshold(threshold)
                .build())
            .build();
    }
}
