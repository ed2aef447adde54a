package com.netcourier.knowledge.service.vectorstore;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorIndex} over the Qdrant REST API.
 */
@Component
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    static final int UPSERT_BATCH_SIZE = 100;
    private static final String DISTANCE = "Cosine";
    private static final String KEYWORD_SCHEMA = "keyword";

    private final WebClient qdrantWebClient;
    private final String collection;
    private final int vectorSize;

    public QdrantVectorIndex(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                             @Value("${knowledge.qdrant.collection:knowledge_base}") String collection,
                             @Value("${knowledge.qdrant.vector-size:1536}") int vectorSize) {
        this.qdrantWebClient = qdrantWebClient;
        this.collection = collection;
        this.vectorSize = vectorSize;
    }

    @Override
    public boolean exists() {
        try {
            CollectionsResponse response = qdrantWebClient.get()
                    .uri("/collections")
                    .retrieve()
                    .bodyToMono(CollectionsResponse.class)
                    .block();
            return response != null && response.names().contains(collection);
        } catch (Exception e) {
            log.warn("Qdrant collection check for '{}' failed: {}", collection, e.getMessage());
            return false;
        }
    }

    @Override
    public void create() {
        if (exists()) {
            log.info("Collection '{}' already exists", collection);
            return;
        }
        CreateCollectionRequest request = new CreateCollectionRequest(
                new VectorParams(vectorSize, DISTANCE),
                new OptimizersConfig(2),
                1);
        execute("create collection " + collection, qdrantWebClient.put()
                .uri("/collections/{collection}", collection)
                .bodyValue(request), Void.class);
        for (String field : List.of(PayloadFields.DOCUMENT_ID, PayloadFields.CATEGORY)) {
            execute("create payload index " + field, qdrantWebClient.put()
                    .uri("/collections/{collection}/index?wait=true", collection)
                    .bodyValue(new PayloadIndexRequest(field, KEYWORD_SCHEMA)), Void.class);
        }
        log.info("Created collection '{}' (size {}, distance {})", collection, vectorSize, DISTANCE);
    }

    @Override
    public void delete() {
        if (!exists()) {
            return;
        }
        execute("delete collection " + collection, qdrantWebClient.delete()
                .uri("/collections/{collection}", collection), Void.class);
        log.info("Deleted collection '{}'", collection);
    }

    @Override
    public void upsert(List<VectorPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        for (int from = 0; from < points.size(); from += UPSERT_BATCH_SIZE) {
            int to = Math.min(from + UPSERT_BATCH_SIZE, points.size());
            List<QdrantPoint> batch = points.subList(from, to).stream()
                    .map(point -> new QdrantPoint(point.id(), point.vector(), point.payload()))
                    .toList();
            execute("upsert points " + from + ".." + to, qdrantWebClient.put()
                    .uri("/collections/{collection}/points?wait=true", collection)
                    .bodyValue(new UpsertRequest(batch)), Void.class);
            log.info("Indexed {}/{} points into '{}'", to, points.size(), collection);
        }
    }

    @Override
    public void deleteByFilter(PayloadFilter filter) {
        execute("delete points by " + filter.field(), qdrantWebClient.post()
                .uri("/collections/{collection}/points/delete?wait=true", collection)
                .bodyValue(new DeleteRequest(toQdrantFilter(filter))), Void.class);
        log.info("Deleted points of '{}' where {} = {}", collection, filter.field(), filter.value());
    }

    @Override
    public List<ScoredPoint> search(float[] vector, int limit, double scoreThreshold, PayloadFilter filter) {
        SearchRequest request = new SearchRequest(vector, limit, scoreThreshold, toQdrantFilter(filter), true);
        SearchResponse response = execute("search " + collection, qdrantWebClient.post()
                .uri("/collections/{collection}/points/search", collection)
                .bodyValue(request), SearchResponse.class);
        if (response == null || response.result() == null) {
            return List.of();
        }
        return response.result().stream()
                .map(hit -> new ScoredPoint(String.valueOf(hit.id()), hit.score(), payloadOrEmpty(hit.payload())))
                .toList();
    }

    @Override
    public ScrollPage scroll(PayloadFilter filter, List<String> payloadFields, int limit, Object offset) {
        try {
            return fetchPage(filter, payloadFields, limit, offset).block();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Failed to scroll " + collection, e);
        }
    }

    @Override
    public Flux<PointRecord> scrollAll(List<String> payloadFields, int pageSize) {
        return fetchPage(null, payloadFields, pageSize, null)
                .expand(page -> page.hasNext()
                        ? fetchPage(null, payloadFields, pageSize, page.nextOffset())
                        : Mono.empty())
                .flatMapIterable(ScrollPage::points);
    }

    @Override
    public CollectionStats stats() {
        if (!exists()) {
            return CollectionStats.notCreated();
        }
        CollectionInfoResponse response = execute("read collection " + collection, qdrantWebClient.get()
                .uri("/collections/{collection}", collection), CollectionInfoResponse.class);
        if (response == null || response.result() == null) {
            return CollectionStats.notCreated();
        }
        CollectionInfo info = response.result();
        return new CollectionStats(info.pointsCount() == null ? 0 : info.pointsCount(), info.status());
    }

    private Mono<ScrollPage> fetchPage(PayloadFilter filter, List<String> payloadFields, int limit, Object offset) {
        Object withPayload = payloadFields == null || payloadFields.isEmpty() ? Boolean.TRUE : payloadFields;
        ScrollRequest request = new ScrollRequest(toQdrantFilter(filter), limit, offset, withPayload, false);
        return qdrantWebClient.post()
                .uri("/collections/{collection}/points/scroll", collection)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ScrollResponse.class)
                .onErrorMap(WebClientResponseException.class, ex -> wrap("scroll " + collection, ex))
                .onErrorMap(ex -> !(ex instanceof VectorStoreException),
                        ex -> new VectorStoreException("Failed to scroll " + collection, ex))
                .map(ScrollResponse::toPage);
    }

    private <T> T execute(String action, WebClient.RequestHeadersSpec<?> request, Class<T> responseType) {
        try {
            return request.retrieve()
                    .bodyToMono(responseType)
                    .onErrorMap(WebClientResponseException.class, ex -> wrap(action, ex))
                    .block();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Qdrant call failed ({}): {}", action, e.getMessage());
            throw new VectorStoreException("Failed to " + action, e);
        }
    }

    private VectorStoreException wrap(String action, WebClientResponseException exception) {
        log.error("Qdrant returned {} for {}: {}", exception.getStatusCode().value(), action, exception.getResponseBodyAsString());
        return new VectorStoreException("Failed to " + action + ": Qdrant returned "
                + exception.getStatusCode().value() + " " + exception.getResponseBodyAsString(), exception);
    }

    private static QdrantFilter toQdrantFilter(PayloadFilter filter) {
        if (filter == null) {
            return null;
        }
        return switch (filter.operator()) {
            case EQUALS -> new QdrantFilter(List.of(new FieldCondition(filter.field(), new Match(filter.value()))));
        };
    }

    private static Map<String, Object> payloadOrEmpty(Map<String, Object> payload) {
        return payload == null ? Map.of() : payload;
    }

    private record CollectionsResponse(CollectionsResult result) {
        List<String> names() {
            if (result == null || result.collections() == null) {
                return List.of();
            }
            return result.collections().stream().map(CollectionDescription::name).toList();
        }
    }

    private record CollectionsResult(List<CollectionDescription> collections) {}

    private record CollectionDescription(String name) {}

    private record CreateCollectionRequest(VectorParams vectors,
                                           @JsonProperty("optimizers_config") OptimizersConfig optimizersConfig,
                                           @JsonProperty("replication_factor") int replicationFactor) {}

    private record VectorParams(int size, String distance) {}

    private record OptimizersConfig(@JsonProperty("default_segment_number") int defaultSegmentNumber) {}

    private record PayloadIndexRequest(@JsonProperty("field_name") String fieldName,
                                       @JsonProperty("field_schema") String fieldSchema) {}

    private record QdrantPoint(String id, float[] vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<QdrantPoint> points) {}

    private record DeleteRequest(QdrantFilter filter) {}

    private record QdrantFilter(List<FieldCondition> must) {}

    private record FieldCondition(String key, Match match) {}

    private record Match(String value) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SearchRequest(float[] vector,
                                 int limit,
                                 @JsonProperty("score_threshold") Double scoreThreshold,
                                 QdrantFilter filter,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    private record SearchResponse(List<SearchHit> result) {}

    private record SearchHit(Object id, double score, Map<String, Object> payload) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record ScrollRequest(QdrantFilter filter,
                                 int limit,
                                 Object offset,
                                 @JsonProperty("with_payload") Object withPayload,
                                 @JsonProperty("with_vector") boolean withVector) {}

    private record ScrollResponse(ScrollResult result) {
        ScrollPage toPage() {
            if (result == null || result.points() == null) {
                return new ScrollPage(Collections.emptyList(), null);
            }
            List<PointRecord> points = result.points().stream()
                    .map(point -> new PointRecord(String.valueOf(point.id()), payloadOrEmpty(point.payload())))
                    .toList();
            return new ScrollPage(points, result.nextPageOffset());
        }
    }

    private record ScrollResult(List<ScrolledPoint> points,
                                @JsonProperty("next_page_offset") Object nextPageOffset) {}

    private record ScrolledPoint(Object id, Map<String, Object> payload) {}

    private record CollectionInfoResponse(CollectionInfo result) {}

    private record CollectionInfo(String status, @JsonProperty("points_count") Long pointsCount) {}
}
