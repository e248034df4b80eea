package com.whereq.contextforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.contextforge.handler.BatchImportHandler;
import com.whereq.contextforge.handler.ClassificationHandler;
import com.whereq.contextforge.handler.DeduplicationHandler;
import com.whereq.contextforge.handler.EmbeddingHandler;
import com.whereq.contextforge.handler.OptimizationHandler;
import com.whereq.contextforge.handler.QualityAssessmentHandler;
import com.whereq.contextforge.handler.SimilarityScoringHandler;
import com.whereq.contextforge.integration.AiGatewayClient;
import com.whereq.contextforge.integration.AuditLog;
import com.whereq.contextforge.integration.InMemoryItemStore;
import com.whereq.contextforge.integration.ItemStore;
import com.whereq.contextforge.integration.JobNotifier;
import com.whereq.contextforge.integration.LoggingAuditLog;
import com.whereq.contextforge.integration.WebhookNotifier;
import com.whereq.contextforge.model.PipelineConfig;
import com.whereq.contextforge.pipeline.PipelineOrchestrator;
import com.whereq.contextforge.pipeline.PipelineSettings;
import com.whereq.contextforge.queue.InMemoryJobQueue;
import com.whereq.contextforge.queue.JobQueue;
import com.whereq.contextforge.store.InMemoryJobStore;
import com.whereq.contextforge.store.JobStore;
import com.whereq.contextforge.worker.JobHandler;
import com.whereq.contextforge.worker.JobHandlerRegistry;
import com.whereq.contextforge.worker.WorkerPool;
import com.whereq.contextforge.worker.WorkerPoolSettings;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Wires the job store, queue, pipeline, handlers and worker pool.
 * Every component is a single explicitly constructed instance.
 *
 * @author WhereQ Inc.
 */
@Configuration
public class JobProcessingConfig {

    @Bean
    public JobStore jobStore() {
        return new InMemoryJobStore();
    }

    @Bean
    public PipelineSettings pipelineSettings(ContextForgeProperties properties) {
        ContextForgeProperties.PipelineDefaults defaults = properties.getPipeline();
        return new PipelineSettings(PipelineConfig.builder()
            .enableAutoClassification(defaults.isEnableAutoClassification())
            .enableAutoOptimization(defaults.isEnableAutoOptimization())
            .enableDuplicateDetection(defaults.isEnableDuplicateDetection())
            .enableQualityAssessment(defaults.isEnableQualityAssessment())
            .batchSize(defaults.getBatchSize())
            .priority(defaults.getPriority())
            .build());
    }

    @Bean
    public JobQueue jobQueue(JobStore jobStore,
                             Validator validator,
                             PipelineSettings pipelineSettings,
                             ContextForgeProperties properties) {
        return new InMemoryJobQueue(
            jobStore,
            validator,
            () -> pipelineSettings.snapshot().getPriority(),
            properties.getQueue().getMaxSize(),
            properties.getRetry().getMaxAttempts());
    }

    @Bean
    public ItemStore itemStore() {
        return new InMemoryItemStore();
    }

    @Bean
    public AuditLog auditLog(ObjectMapper objectMapper) {
        return new LoggingAuditLog(objectMapper);
    }

    @Bean
    public JobNotifier jobNotifier(WebClient.Builder webClientBuilder, ContextForgeProperties properties) {
        return new WebhookNotifier(
            webClientBuilder,
            properties.getNotifications().getWebhookUrl(),
            properties.getNotifications().getEvents());
    }

    @Bean
    public AiGatewayClient aiGatewayClient(WebClient.Builder webClientBuilder, ContextForgeProperties properties) {
        ContextForgeProperties.AiConfig ai = properties.getAi();
        return new AiGatewayClient(webClientBuilder, ai.getBaseUrl(), ai.getApiKey(), ai.getTimeout());
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(JobQueue jobQueue,
                                                     ItemStore itemStore,
                                                     AuditLog auditLog,
                                                     JobNotifier jobNotifier,
                                                     PipelineSettings pipelineSettings,
                                                     ContextForgeProperties properties) {
        return new PipelineOrchestrator(jobQueue, itemStore, auditLog, jobNotifier, pipelineSettings,
            properties.getPipeline().getBatchDelay());
    }

    // Handlers

    @Bean
    public ClassificationHandler classificationHandler(AiGatewayClient aiGatewayClient,
                                                       ItemStore itemStore,
                                                       ObjectMapper objectMapper) {
        return new ClassificationHandler(aiGatewayClient, itemStore, objectMapper);
    }

    @Bean
    public OptimizationHandler optimizationHandler(AiGatewayClient aiGatewayClient,
                                                   ItemStore itemStore,
                                                   ObjectMapper objectMapper) {
        return new OptimizationHandler(aiGatewayClient, itemStore, objectMapper);
    }

    @Bean
    public QualityAssessmentHandler qualityAssessmentHandler(AiGatewayClient aiGatewayClient, ObjectMapper objectMapper) {
        return new QualityAssessmentHandler(aiGatewayClient, objectMapper);
    }

    @Bean
    public EmbeddingHandler embeddingHandler(AiGatewayClient aiGatewayClient, ObjectMapper objectMapper) {
        return new EmbeddingHandler(aiGatewayClient, objectMapper);
    }

    @Bean
    public SimilarityScoringHandler similarityScoringHandler(AiGatewayClient aiGatewayClient, ObjectMapper objectMapper) {
        return new SimilarityScoringHandler(aiGatewayClient, objectMapper);
    }

    @Bean
    public DeduplicationHandler deduplicationHandler(ObjectMapper objectMapper) {
        return new DeduplicationHandler(objectMapper);
    }

    @Bean
    public BatchImportHandler batchImportHandler(ItemStore itemStore,
                                                 PipelineOrchestrator pipelineOrchestrator,
                                                 ObjectMapper objectMapper) {
        return new BatchImportHandler(itemStore, pipelineOrchestrator, objectMapper);
    }

    @Bean
    public JobHandlerRegistry jobHandlerRegistry(List<JobHandler> handlers) {
        return new JobHandlerRegistry(handlers);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public WorkerPool workerPool(JobQueue jobQueue,
                                 JobHandlerRegistry jobHandlerRegistry,
                                 JobNotifier jobNotifier,
                                 ContextForgeProperties properties,
                                 MeterRegistry meterRegistry) {
        ContextForgeProperties.WorkersConfig workers = properties.getWorkers();
        WorkerPoolSettings settings = WorkerPoolSettings.builder()
            .defaultConcurrency(workers.getDefaultConcurrency())
            .concurrency(workers.getConcurrency())
            .pollInterval(workers.getPollInterval())
            .executionTimeout(workers.getExecutionTimeout())
            .build();
        return new WorkerPool(jobQueue, jobHandlerRegistry, jobNotifier, settings, properties.getRetry(), meterRegistry);
    }
}
