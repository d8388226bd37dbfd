package com.netcourier.rag.service.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.netcourier.rag.config.RagProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "rag.embedding", name = "provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    private final WebClient webClient;
    private final String model;
    private final int dimension;
    private final Duration timeout;

    public OpenAiEmbeddingClient(@Qualifier("embeddingsWebClient") WebClient webClient,
                                 RagProperties properties,
                                 @Value("${rag.embedding.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClient;
        this.model = properties.embedding().model();
        this.dimension = properties.embedding().dimension();
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public Mono<List<float[]>> embed(List<String> texts) {
        // only the v3 models accept a requested output dimension
        Integer dimensions = model.startsWith("text-embedding-3") ? dimension : null;
        return webClient.post()
                .uri("/v1/embeddings")
                .bodyValue(new EmbeddingRequest(model, texts, dimensions))
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .timeout(timeout)
                .map(this::toVectors)
                .onErrorMap(WebClientResponseException.class, this::wrap)
                .onErrorMap(WebClientRequestException.class,
                        ex -> new EmbeddingCallException(0, "Embedding provider unreachable: " + ex.getMessage(), ex));
    }

    @Override
    public String modelName() {
        return model;
    }

    private List<float[]> toVectors(EmbeddingResponse response) {
        if (response.data() == null) {
            return List.of();
        }
        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(data -> {
                    float[] vector = new float[data.embedding().size()];
                    for (int i = 0; i < vector.length; i++) {
                        vector[i] = data.embedding().get(i);
                    }
                    return vector;
                })
                .toList();
    }

    private EmbeddingCallException wrap(WebClientResponseException exception) {
        int status = exception.getStatusCode().value();
        log.warn("Embedding call returned {}: {}", status, exception.getResponseBodyAsString());
        return new EmbeddingCallException(status, "Embedding call returned " + status, exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EmbeddingRequest(String model, List<String> input, Integer dimensions) {
    }

    record EmbeddingResponse(List<EmbeddingData> data, String model) {
    }

    record EmbeddingData(int index, List<Float> embedding) {
    }
}
