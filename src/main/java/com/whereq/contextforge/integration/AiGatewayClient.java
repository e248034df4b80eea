package com.whereq.contextforge.integration;

import com.whereq.contextforge.exception.JobExecutionException;
import com.whereq.contextforge.exception.PermanentExecutionException;
import com.whereq.contextforge.exception.TransientExecutionException;
import com.whereq.contextforge.model.TargetModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the AI gateway that fronts the LLM and embedding providers.
 * Calls are blocking; handlers invoke them from the bounded elastic scheduler.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class AiGatewayClient implements ContentIntelligenceService, EmbeddingService {

    private final WebClient webClient;
    private final Duration timeout;

    public AiGatewayClient(WebClient.Builder webClientBuilder, String baseUrl, String apiKey, Duration timeout) {
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public AiResponse classify(String userId, String content, String format, List<TargetModel> targetModels) {
        Map<String, Object> body = new HashMap<>();
        body.put("userId", userId);
        body.put("content", content);
        body.put("format", format);
        if (targetModels != null) {
            body.put("targetModels", targetModels);
        }
        return post("/v1/classify", body, AiResponse.class);
    }

    @Override
    public AiResponse optimize(String userId, String content, String currentFormat, TargetModel targetModel) {
        return post("/v1/optimize", Map.of(
            "userId", userId,
            "content", content,
            "format", currentFormat,
            "targetModel", targetModel.getId()
        ), AiResponse.class);
    }

    @Override
    public AiResponse assessQuality(String userId, String content, String type, String format) {
        return post("/v1/quality", Map.of(
            "userId", userId,
            "content", content,
            "type", type,
            "format", format
        ), AiResponse.class);
    }

    @Override
    public EmbeddingResponse embed(String userId, String content, String providerId) {
        Map<String, Object> body = new HashMap<>();
        body.put("userId", userId);
        body.put("content", content);
        if (providerId != null) {
            body.put("providerId", providerId);
        }
        return post("/v1/embeddings", body, EmbeddingResponse.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        T response;
        try {
            response = webClient.post()
                .uri(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            throw translate(path, Exceptions.unwrap(e));
        }
        if (response == null) {
            throw new TransientExecutionException("AI gateway returned an empty response for " + path);
        }
        return response;
    }

    /**
     * Client errors are permanent except request timeout and rate limiting; everything else may succeed later
     */
    static JobExecutionException translate(String path, Throwable error) {
        if (error instanceof JobExecutionException executionError) {
            return executionError;
        }
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            String message = "AI gateway " + path + " responded " + status + ": " + responseError.getStatusText();
            if (status >= 400 && status < 500 && status != 408 && status != 429) {
                return new PermanentExecutionException(message, responseError);
            }
            log.warn(message);
            return new TransientExecutionException(message, responseError);
        }
        if (error instanceof TimeoutException) {
            return new TransientExecutionException("AI gateway " + path + " timed out", error);
        }
        return new TransientExecutionException("AI gateway " + path + " unavailable: " + error.getMessage(), error);
    }
}
