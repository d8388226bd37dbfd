package com.netcourier.rag.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient qdrantWebClient(@Value("${rag.vector-store.qdrant.base-url:http://localhost:6333}") String baseUrl,
                                     @Value("${rag.vector-store.qdrant.api-key:}") String apiKey) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("api-key", apiKey);
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${rag.embedding.base-url:https://api.openai.com}") String baseUrl,
                                         @Value("${rag.embedding.api-key:${OPENAI_API_KEY:}}") String apiKey,
                                         @Value("${rag.embedding.timeout-seconds:30}") long timeoutSeconds) {
        return openAiClient(baseUrl, apiKey, timeoutSeconds);
    }

    @Bean
    public WebClient llmWebClient(@Value("${rag.generation.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${rag.generation.api-key:${OPENAI_API_KEY:}}") String apiKey,
                                  @Value("${rag.generation.timeout-seconds:60}") long timeoutSeconds) {
        return openAiClient(baseUrl, apiKey, timeoutSeconds);
    }

    private WebClient openAiClient(String baseUrl, String apiKey, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private ExchangeStrategies exchangeStrategies() {
        // embedding responses for a full batch run to several megabytes
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
