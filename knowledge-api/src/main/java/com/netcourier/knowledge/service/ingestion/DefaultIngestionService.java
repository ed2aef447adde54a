package com.netcourier.knowledge.service.ingestion;

import com.netcourier.knowledge.model.IngestionStats;
import com.netcourier.knowledge.service.embedding.EmbeddingsClient;
import com.netcourier.knowledge.service.vectorstore.VectorIndex;
import com.netcourier.knowledge.service.vectorstore.VectorPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final DocumentLocator documentLocator;
    private final DocumentParser documentParser;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;
    private final MeterRegistry meterRegistry;
    private final Counter indexedCounter;
    private final Counter skippedCounter;
    private final Timer ingestionTimer;

    public DefaultIngestionService(DocumentLocator documentLocator,
                                   DocumentParser documentParser,
                                   TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   VectorIndex vectorIndex,
                                   MeterRegistry meterRegistry) {
        this.documentLocator = documentLocator;
        this.documentParser = documentParser;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
        this.meterRegistry = meterRegistry;
        this.indexedCounter = meterRegistry.counter("knowledge.ingest.documents", "outcome", "indexed");
        this.skippedCounter = meterRegistry.counter("knowledge.ingest.documents", "outcome", "skipped");
        this.ingestionTimer = meterRegistry.timer("knowledge.ingest.duration");
    }

    @Override
    public IngestionStats ingest(Path root, boolean reset) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return ingestInternal(root.toAbsolutePath().normalize(), reset);
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    @Override
    public void removeDocument(String documentId) {
        vectorIndex.deleteByDocument(documentId);
    }

    private IngestionStats ingestInternal(Path root, boolean reset) {
        if (reset) {
            log.warn("Resetting knowledge base collection before ingesting {}", root);
            vectorIndex.delete();
        }
        List<Path> files = documentLocator.locate(root);
        log.info("Found {} documents under {}", files.size(), root);

        List<DocumentChunk> chunks = new ArrayList<>();
        int documents = 0;
        int skipped = 0;
        for (Path file : files) {
            List<DocumentChunk> documentChunks = parseAndChunk(file, root);
            if (documentChunks.isEmpty()) {
                skipped++;
                skippedCounter.increment();
                continue;
            }
            chunks.addAll(documentChunks);
            documents++;
            indexedCounter.increment();
        }

        if (chunks.isEmpty()) {
            log.warn("No chunks produced from {} ({} documents skipped)", root, skipped);
            return IngestionStats.empty(skipped);
        }

        vectorIndex.create();
        List<float[]> vectors = embeddingsClient.embedAll(chunks.stream().map(DocumentChunk::content).toList());
        if (vectors.size() != chunks.size()) {
            throw new IngestionException(HttpStatus.BAD_GATEWAY, "Embeddings response size did not match chunks");
        }
        List<VectorPoint> points = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            points.add(new VectorPoint(chunk.pointId(), vectors.get(i), chunk.toPayload()));
        }
        vectorIndex.upsert(points);

        List<String> categories = List.copyOf(chunks.stream()
                .map(chunk -> chunk.metadata().category())
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new)));
        log.info("Ingested {} documents ({} chunks, {} skipped) from {}", documents, chunks.size(), skipped, root);
        return new IngestionStats(documents, chunks.size(), categories, skipped);
    }

    /**
     * Failures are confined to the one document: logged and reported as no chunks.
     */
    private List<DocumentChunk> parseAndChunk(Path file, Path root) {
        Path relative = root.relativize(file);
        try {
            ParsedDocument document = documentParser.parse(file, root);
            List<DocumentChunk> chunks = DocumentChunk.forDocument(document, textChunker.chunk(document.content()));
            if (chunks.isEmpty()) {
                log.warn("Skipping {}: no text content", relative);
            } else {
                log.info("Processed {} -> {} chunks", relative, chunks.size());
            }
            return chunks;
        } catch (IngestionException ex) {
            log.warn("Skipping {}: {}", relative, ex.getMessage());
            return List.of();
        } catch (RuntimeException ex) {
            log.warn("Skipping {} after unexpected failure", relative, ex);
            return List.of();
        }
    }
}
