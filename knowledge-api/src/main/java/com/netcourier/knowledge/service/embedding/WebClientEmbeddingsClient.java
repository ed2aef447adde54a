package com.netcourier.knowledge.service.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Client for an OpenAI-compatible {@code /v1/embeddings} endpoint.
 */
@Component
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    static final int MAX_BATCH_SIZE = 100;

    private final WebClient embeddingsWebClient;
    private final String model;
    private final int batchSize;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                     @Value("${knowledge.embeddings.model:text-embedding-3-small}") String model,
                                     @Value("${knowledge.embeddings.batch-size:100}") int batchSize) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
        this.batchSize = Math.max(1, Math.min(batchSize, MAX_BATCH_SIZE));
    }

    @Override
    public float[] embed(String text) {
        List<EmbeddingData> data = request(text);
        if (data.isEmpty() || data.get(0).embedding() == null) {
            throw new EmbeddingServiceException("Embedding API returned no vector");
        }
        return data.get(0).embedding();
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            int to = Math.min(from + batchSize, texts.size());
            List<EmbeddingData> data = new ArrayList<>(request(texts.subList(from, to)));
            if (data.size() != to - from) {
                throw new EmbeddingServiceException("Embedding API returned " + data.size() + " vectors for " + (to - from) + " texts");
            }
            data.sort(Comparator.comparingInt(EmbeddingData::index));
            for (int i = 0; i < data.size(); i++) {
                if (data.get(i).index() != i) {
                    throw new EmbeddingServiceException("Embedding API returned indexes that do not cover 0.." + (data.size() - 1));
                }
            }
            data.forEach(item -> vectors.add(item.embedding()));
            if (texts.size() > batchSize) {
                log.info("Embedded {}/{} texts", to, texts.size());
            }
        }
        return vectors;
    }

    private List<EmbeddingData> request(Object input) {
        try {
            EmbeddingResponse response = embeddingsWebClient.post()
                    .uri("/v1/embeddings")
                    .bodyValue(new EmbeddingRequest(model, input))
                    .retrieve()
                    .bodyToMono(EmbeddingResponse.class)
                    .onErrorMap(WebClientResponseException.class, this::wrap)
                    .block();
            if (response == null || response.data() == null) {
                throw new EmbeddingServiceException("Embedding API returned an empty response");
            }
            return response.data();
        } catch (EmbeddingServiceException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Embedding API call failed: {}", e.getMessage());
            throw new EmbeddingServiceException("Failed to reach embedding API", e);
        }
    }

    private EmbeddingServiceException wrap(WebClientResponseException exception) {
        int status = exception.getStatusCode().value();
        String body = exception.getResponseBodyAsString();
        log.warn("Embedding API returned {}: {}", status, body);
        return new EmbeddingServiceException(status, body, exception);
    }

    private record EmbeddingRequest(String model, Object input) {}

    private record EmbeddingResponse(List<EmbeddingData> data) {}

    private record EmbeddingData(float[] embedding, int index) {}
}
