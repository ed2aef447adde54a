package com.netcourier.knowledge;

import com.netcourier.knowledge.model.DocumentSummary;
import com.netcourier.knowledge.model.IngestionStats;
import com.netcourier.knowledge.model.SearchResult;
import com.netcourier.knowledge.service.embedding.EmbeddingsClient;
import com.netcourier.knowledge.service.ingestion.BoundaryAwareTextChunker;
import com.netcourier.knowledge.service.ingestion.DefaultIngestionService;
import com.netcourier.knowledge.service.ingestion.DocumentParser;
import com.netcourier.knowledge.service.ingestion.FileSystemDocumentLocator;
import com.netcourier.knowledge.service.ingestion.TikaDocumentTextExtractor;
import com.netcourier.knowledge.service.retrieval.DefaultRetrievalService;
import com.netcourier.knowledge.service.retrieval.DocumentRegistry;
import com.netcourier.knowledge.service.vectorstore.InMemoryVectorIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ingests a small folder and queries it back through the retrieval side, with an in-memory index
 * and a bag-of-words embedding.
 */
class KnowledgePipelineTest {

    @TempDir
    Path root;

    private InMemoryVectorIndex vectorIndex;
    private DefaultIngestionService ingestionService;
    private DefaultRetrievalService retrievalService;
    private DocumentRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        write("faq/returns.txt", "Return policy\n\n" + "Items can be returned within 30 days. ".repeat(20)
                + "\n\nThe return policy covers unused items with a receipt.");
        write("faq/shipping.md", "# Shipping\n\nOrders ship within two business days to any address.");
        write("manuals/printer.txt", "Printer manual\n\nPress the green button to start printing a page.");

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        vectorIndex = new InMemoryVectorIndex();
        EmbeddingsClient embeddings = new BagOfWordsEmbeddings();
        ingestionService = new DefaultIngestionService(
                new FileSystemDocumentLocator(),
                new DocumentParser(new TikaDocumentTextExtractor()),
                new BoundaryAwareTextChunker(500, 50),
                embeddings,
                vectorIndex,
                meterRegistry);
        retrievalService = new DefaultRetrievalService(embeddings, vectorIndex, meterRegistry, 5, 0.0);
        registry = new DocumentRegistry(vectorIndex);
    }

    @Test
    void ingestedDocumentsAreSearchableByCategory() {
        IngestionStats stats = ingestionService.ingest(root, false);

        assertThat(stats.documents()).isEqualTo(3);
        assertThat(stats.categories()).containsExactly("faq", "manuals");

        List<SearchResult> results = retrievalService.search("return policy", 5, "faq");

        assertThat(results).isNotEmpty().allSatisfy(result -> assertThat(result.category()).isEqualTo("faq"));
        assertThat(results.get(0).documentName()).isEqualTo("returns.txt");
        assertThat(results).extracting(SearchResult::score).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void reingestingOverwritesExistingPoints() {
        ingestionService.ingest(root, false);
        int firstRun = vectorIndex.size();

        ingestionService.ingest(root, false);

        assertThat(vectorIndex.size()).isEqualTo(firstRun);
        assertThat(registry.listDocuments()).hasSize(3);
    }

    @Test
    void documentCanBeReassembledAndRemoved() {
        ingestionService.ingest(root, false);
        String returnsId = registry.listDocuments("faq").stream()
                .filter(document -> document.documentName().equals("returns.txt"))
                .map(DocumentSummary::documentId)
                .findFirst()
                .orElseThrow();

        assertThat(retrievalService.getDocument(returnsId)).hasValueSatisfying(document -> {
            assertThat(document.title()).isEqualTo("Return policy");
            assertThat(document.content()).startsWith("Return policy").contains("unused items with a receipt");
        });

        ingestionService.removeDocument(returnsId);

        assertThat(retrievalService.getDocument(returnsId)).isEmpty();
        assertThat(registry.listDocuments()).extracting(DocumentSummary::documentName)
                .containsExactlyInAnyOrder("shipping.md", "printer.txt");
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static final class BagOfWordsEmbeddings implements EmbeddingsClient {

        private static final int DIMENSIONS = 64;

        @Override
        public float[] embed(String text) {
            float[] vector = new float[DIMENSIONS];
            for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
                if (!word.isEmpty()) {
                    vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
                }
            }
            return vector;
        }

        @Override
        public List<float[]> embedAll(List<String> texts) {
            return texts.stream().map(this::embed).toList();
        }
    }
}
