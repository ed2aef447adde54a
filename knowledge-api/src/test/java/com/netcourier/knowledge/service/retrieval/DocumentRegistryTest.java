package com.netcourier.knowledge.service.retrieval;

import com.netcourier.knowledge.model.DocumentSummary;
import com.netcourier.knowledge.model.KnowledgeBaseStatus;
import com.netcourier.knowledge.service.vectorstore.CollectionStats;
import com.netcourier.knowledge.service.vectorstore.InMemoryVectorIndex;
import com.netcourier.knowledge.service.vectorstore.PayloadFields;
import com.netcourier.knowledge.service.vectorstore.VectorIndex;
import com.netcourier.knowledge.service.vectorstore.VectorPoint;
import com.netcourier.knowledge.service.vectorstore.VectorStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Flux;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentRegistryTest {

    private InMemoryVectorIndex vectorIndex;
    private DocumentRegistry registry;

    @BeforeEach
    void setUp() {
        vectorIndex = new InMemoryVectorIndex();
        vectorIndex.create();
        vectorIndex.upsert(List.of(
                point("p-1", "returns-1", "returns.txt", "faq", "Return policy"),
                point("p-2", "returns-1", "returns.txt", "faq", "Return policy (continued)"),
                point("p-3", "printer-1", "printer.pdf", "Manuals", "Printer manual"),
                point("p-4", "notes-1", "notes.md", null, "Notes"),
                point("p-5", "shipping-1", "shipping.docx", "faq", "Shipping")));
        registry = new DocumentRegistry(vectorIndex);
    }

    @Test
    void listsOneSummaryPerDocumentFromFirstChunk() {
        List<DocumentSummary> documents = registry.listDocuments();

        assertThat(documents).extracting(DocumentSummary::documentId)
                .containsExactly("returns-1", "printer-1", "notes-1", "shipping-1");
        assertThat(documents.get(0).title()).isEqualTo("Return policy");
        assertThat(documents.get(0).documentName()).isEqualTo("returns.txt");
    }

    @Test
    void filtersByCategoryIgnoringCase() {
        assertThat(registry.listDocuments("FAQ")).extracting(DocumentSummary::documentId)
                .containsExactly("returns-1", "shipping-1");
        assertThat(registry.listDocuments("manuals")).extracting(DocumentSummary::documentName)
                .containsExactly("printer.pdf");
        assertThat(registry.listDocuments(" ")).hasSize(4);
    }

    @Test
    void categoriesAreDistinctAndSorted() {
        assertThat(registry.listCategories()).containsExactly("Manuals", "faq");
    }

    @Test
    void removedDocumentDisappearsFromListing() {
        vectorIndex.deleteByDocument("returns-1");

        assertThat(registry.listDocuments()).extracting(DocumentSummary::documentId)
                .doesNotContain("returns-1")
                .hasSize(3);
    }

    @Test
    void statusReportsPointCount() {
        KnowledgeBaseStatus status = registry.status();

        assertThat(status.exists()).isTrue();
        assertThat(status.pointsCount()).isEqualTo(5);
        assertThat(registry.collectionStats().status()).isEqualTo("green");
    }

    @Test
    void absentCollectionListsNothingWithoutScanning() {
        VectorIndex absent = Mockito.mock(VectorIndex.class);
        when(absent.exists()).thenReturn(false);
        when(absent.stats()).thenReturn(CollectionStats.notCreated());
        DocumentRegistry emptyRegistry = new DocumentRegistry(absent);

        assertThat(emptyRegistry.listDocuments()).isEmpty();
        assertThat(emptyRegistry.listCategories()).isEmpty();
        assertThat(emptyRegistry.collectionExists()).isFalse();
        assertThat(emptyRegistry.status()).isEqualTo(new KnowledgeBaseStatus(false, 0, CollectionStats.NOT_CREATED));
        verify(absent, never()).scrollAll(anyList(), anyInt());
    }

    @Test
    void storeFailureMakesListingsUnavailable() {
        VectorIndex failing = Mockito.mock(VectorIndex.class);
        when(failing.exists()).thenReturn(true);
        when(failing.scrollAll(anyList(), anyInt())).thenReturn(Flux.error(new VectorStoreException("down")));
        when(failing.stats()).thenThrow(new VectorStoreException("down"));
        DocumentRegistry failingRegistry = new DocumentRegistry(failing);

        assertThatThrownBy(failingRegistry::listDocuments)
                .isInstanceOf(SearchUnavailableException.class)
                .hasCauseInstanceOf(VectorStoreException.class);
        assertThatThrownBy(failingRegistry::listCategories).isInstanceOf(SearchUnavailableException.class);
        assertThatThrownBy(() -> failingRegistry.listDocuments("faq")).isInstanceOf(SearchUnavailableException.class);
        assertThatThrownBy(failingRegistry::status).isInstanceOf(SearchUnavailableException.class);
        assertThatThrownBy(failingRegistry::collectionStats).isInstanceOf(SearchUnavailableException.class);
    }

    private static VectorPoint point(String id, String documentId, String name, String category, String title) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PayloadFields.DOCUMENT_ID, documentId);
        payload.put(PayloadFields.DOCUMENT_NAME, name);
        payload.put(PayloadFields.CATEGORY, category);
        payload.put(PayloadFields.TITLE, title);
        payload.put(PayloadFields.CONTENT, "content of " + id);
        return new VectorPoint(id, new float[] {1f, 0f}, payload);
    }
}
