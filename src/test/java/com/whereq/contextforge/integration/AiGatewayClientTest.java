package com.whereq.contextforge.integration;

import com.whereq.contextforge.exception.JobExecutionException;
import com.whereq.contextforge.exception.PermanentExecutionException;
import com.whereq.contextforge.exception.TransientExecutionException;
import com.whereq.contextforge.model.TargetModel;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiGatewayClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void classifyPostsToTheGatewayWithCredentials() {
        AiGatewayClient client = client(HttpStatus.OK,
            "{\"content\":\"agent\",\"confidence\":0.9,\"tokens\":42,\"model\":\"m\",\"metadata\":{\"type\":\"agent\"}}");

        AiResponse response = client.classify("alice", "You are an agent", "markdown", List.of(TargetModel.OPENAI));

        assertThat(response.getContent()).isEqualTo("agent");
        assertThat(response.getTokens()).isEqualTo(42);
        assertThat(response.getMetadata().get("type").asText()).isEqualTo("agent");
        ClientRequest request = requests.get(0);
        assertThat(request.url().getPath()).isEqualTo("/v1/classify");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
    }

    @Test
    void embedReadsTheVector() {
        AiGatewayClient client = client(HttpStatus.OK, "{\"vector\":[0.1,0.2,0.3],\"model\":\"embed\",\"tokens\":3}");

        EmbeddingResponse response = client.embed("alice", "hello", null);

        assertThat(response.getDimensions()).isEqualTo(3);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/embeddings");
    }

    @Test
    void badRequestFailsPermanently() {
        AiGatewayClient client = client(HttpStatus.BAD_REQUEST, "{\"error\":\"content too long\"}");

        assertThatThrownBy(() -> client.optimize("alice", "x", "text", TargetModel.GEMINI))
            .isInstanceOf(PermanentExecutionException.class)
            .hasMessageContaining("/v1/optimize")
            .hasMessageContaining("400");
    }

    @Test
    void serverErrorIsTransient() {
        AiGatewayClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> client.assessQuality("alice", "x", "prompt", "text"))
            .isInstanceOf(TransientExecutionException.class);
    }

    @Test
    void translateClassifiesFailures() {
        assertThat(AiGatewayClient.translate("/v1/x", responseError(HttpStatus.NOT_FOUND)).isRetryable()).isFalse();
        assertThat(AiGatewayClient.translate("/v1/x", responseError(HttpStatus.UNPROCESSABLE_ENTITY)).isRetryable()).isFalse();
        assertThat(AiGatewayClient.translate("/v1/x", responseError(HttpStatus.TOO_MANY_REQUESTS)).isRetryable()).isTrue();
        assertThat(AiGatewayClient.translate("/v1/x", responseError(HttpStatus.REQUEST_TIMEOUT)).isRetryable()).isTrue();
        assertThat(AiGatewayClient.translate("/v1/x", responseError(HttpStatus.BAD_GATEWAY)).isRetryable()).isTrue();
        assertThat(AiGatewayClient.translate("/v1/x", new TimeoutException()).isRetryable()).isTrue();
        assertThat(AiGatewayClient.translate("/v1/x", new ConnectException("refused")).isRetryable()).isTrue();

        JobExecutionException original = new PermanentExecutionException("already classified");
        assertThat(AiGatewayClient.translate("/v1/x", original)).isSameAs(original);
    }

    private AiGatewayClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        });
        return new AiGatewayClient(builder, "http://gateway.test", "secret", Duration.ofSeconds(5));
    }

    private static WebClientResponseException responseError(HttpStatus status) {
        return WebClientResponseException.create(status.value(), status.getReasonPhrase(),
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
    }
}
