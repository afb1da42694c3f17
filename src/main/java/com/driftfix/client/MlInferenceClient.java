package com.driftfix.client;

import com.driftfix.domain.FeatureMatrix;
import com.driftfix.exception.InferenceException;
import com.driftfix.exception.InferenceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@ConditionalOnProperty(name = "ml.api.enabled", havingValue = "true")
public class MlInferenceClient implements InferenceClient, ModelMetadataProvider {

    @Value("${ml.api.base-url}")
    private String baseUrl;

    @Value("${ml.api.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${ml.api.metadata-timeout-seconds:3}")
    private int metadataTimeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("MlInferenceClient initialised → {}", baseUrl);
    }

    @Override
    public Mono<FeatureMatrix> predict(String modelId, FeatureMatrix features) {
        return webClient.post().uri("/models/{modelId}/predict", modelId)
            .bodyValue(buildBody(features))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new InferenceException("Inference API rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new InferenceUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toOutputs)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((retrySpec, sig) -> new InferenceUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, InferenceUnavailableException::new);
    }

    @Override
    public OptionalInt expectedFeatureCount(String modelId) {
        try {
            JsonNode info = webClient.get().uri("/models/{modelId}/metadata", modelId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(Duration.ofSeconds(metadataTimeoutSeconds));
            if (info == null || !info.hasNonNull("input_feature_count")) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(info.get("input_feature_count").asInt());
        } catch (Exception ex) {
            log.warn("Model metadata unavailable | modelId={} | reason={}", modelId, ex.getClass().getSimpleName());
            return OptionalInt.empty();
        }
    }

    // accepts "outputs" as rows of scores, or "predictions" as one score per row
    private FeatureMatrix toOutputs(JsonNode json) {
        if (json != null && json.hasNonNull("outputs") && json.get("outputs").isArray()) {
            JsonNode rows = json.get("outputs");
            double[][] values = new double[rows.size()][];
            for (int i = 0; i < rows.size(); i++) {
                JsonNode row = rows.get(i);
                if (!row.isArray()) {
                    throw new InferenceException("Inference API row " + i + " is not an array: " + row);
                }
                values[i] = new double[row.size()];
                for (int j = 0; j < row.size(); j++) {
                    values[i][j] = row.get(j).asDouble();
                }
            }
            return FeatureMatrix.of(values);
        }
        if (json != null && json.hasNonNull("predictions") && json.get("predictions").isArray()) {
            JsonNode preds = json.get("predictions");
            double[][] values = new double[preds.size()][1];
            for (int i = 0; i < preds.size(); i++) {
                values[i][0] = preds.get(i).asDouble();
            }
            return FeatureMatrix.of(values);
        }
        throw new InferenceException("Inference API response missing 'outputs' or 'predictions': " + json);
    }

    private ObjectNode buildBody(FeatureMatrix features) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode instances = node.putArray("instances");
        for (int i = 0; i < features.sampleCount(); i++) {
            ArrayNode row = instances.addArray();
            for (double v : features.row(i)) {
                row.add(v);
            }
        }
        return node;
    }
}
