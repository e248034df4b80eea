package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.contextforge.integration.AiResponse;
import com.whereq.contextforge.integration.ContentIntelligenceService;
import com.whereq.contextforge.integration.InMemoryItemStore;
import com.whereq.contextforge.model.ContentItem;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.TargetModel;
import com.whereq.contextforge.model.payload.ClassificationPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

class ClassificationHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ContentIntelligenceService intelligenceService;

    private InMemoryItemStore itemStore;
    private ClassificationHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        itemStore = new InMemoryItemStore();
        handler = new ClassificationHandler(intelligenceService, itemStore, objectMapper);
    }

    @Test
    void storesDetectedTypeOnTheItem() throws Exception {
        itemStore.save(ContentItem.builder().id("item-1").userId("alice").content("You are an agent").build());
        when(intelligenceService.classify(eq("alice"), eq("You are an agent"), eq("markdown"), any()))
            .thenReturn(AiResponse.builder()
                .content("agent")
                .confidence(0.92)
                .tokens(120)
                .model("gpt-4o-mini")
                .metadata(objectMapper.createObjectNode().put("type", "agent").put("subType", "coding"))
                .build());
        List<Integer> reported = new ArrayList<>();

        JobResult result = handler.execute(job("item-1"), (percentage, message) -> reported.add(percentage));

        assertThat(reported).containsExactly(10, 30, 80);
        assertThat(result.getConfidence()).isEqualTo(0.92);
        assertThat(result.getTokensUsed()).isEqualTo(120);
        assertThat(result.getData().get("type").asText()).isEqualTo("agent");
        assertThat(result.getData().get("characteristics").get("format").asText()).isEqualTo("markdown");
        ContentItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.getType()).isEqualTo("agent");
        assertThat(item.getSubType()).isEqualTo("coding");
    }

    @Test
    void leavesItemUntouchedWithoutADetectedType() throws Exception {
        itemStore.save(ContentItem.builder().id("item-1").userId("alice").type("prompt").content("x").build());
        when(intelligenceService.classify(any(), any(), any(), any()))
            .thenReturn(AiResponse.builder().content("unclear").build());

        JobResult result = handler.execute(job("item-1"), (percentage, message) -> { });

        assertThat(result.getSummary()).isEqualTo("Classified as unclear");
        assertThat(itemStore.findById("item-1").orElseThrow().getType()).isEqualTo("prompt");
    }

    @Test
    void keepsOptimizationsRecordedWhileClassifying() throws Exception {
        itemStore.save(ContentItem.builder().id("item-1").userId("alice").content("You are an agent").build());
        when(intelligenceService.classify(any(), any(), any(), any())).thenAnswer(invocation -> {
            itemStore.recordOptimization("item-1", ContentItem.ItemOptimization.builder()
                .targetModel(TargetModel.OPENAI)
                .createdAt(Instant.now())
                .build());
            return AiResponse.builder()
                .content("agent")
                .metadata(objectMapper.createObjectNode().put("type", "agent"))
                .build();
        });

        handler.execute(job("item-1"), (percentage, message) -> { });

        ContentItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.getType()).isEqualTo("agent");
        assertThat(item.getOptimizations()).hasSize(1);
        assertThat(item.isOptimized()).isTrue();
    }

    private static Job job(String itemId) {
        return Job.builder()
            .id("job-cls")
            .type(JobType.CLASSIFICATION)
            .status(JobStatus.PROCESSING)
            .userId("alice")
            .payload(ClassificationPayload.builder()
                .userId("alice")
                .itemId(itemId)
                .content("You are an agent")
                .format("markdown")
                .build())
            .build();
    }
}
