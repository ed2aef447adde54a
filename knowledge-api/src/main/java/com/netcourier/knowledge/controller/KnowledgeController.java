package com.netcourier.knowledge.controller;

import com.netcourier.knowledge.model.AssembledDocument;
import com.netcourier.knowledge.model.DocumentSummary;
import com.netcourier.knowledge.model.KnowledgeBaseStatus;
import com.netcourier.knowledge.model.SearchResult;
import com.netcourier.knowledge.service.retrieval.DocumentRegistry;
import com.netcourier.knowledge.service.retrieval.RetrievalService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

@RestController
@RequestMapping(value = "/api/knowledge", produces = MediaType.APPLICATION_JSON_VALUE)
public class KnowledgeController {

    private final RetrievalService retrievalService;
    private final DocumentRegistry documentRegistry;

    public KnowledgeController(RetrievalService retrievalService, DocumentRegistry documentRegistry) {
        this.retrievalService = retrievalService;
        this.documentRegistry = documentRegistry;
    }

    @GetMapping("/search")
    public Mono<List<SearchResult>> search(@RequestParam("query") String query,
                                           @RequestParam(value = "topK", required = false) Integer topK,
                                           @RequestParam(value = "category", required = false) String category) {
        return blocking(() -> retrievalService.search(query, topK, category));
    }

    @GetMapping("/documents")
    public Mono<List<DocumentSummary>> documents(@RequestParam(value = "category", required = false) String category) {
        return blocking(() -> documentRegistry.listDocuments(category));
    }

    @GetMapping("/documents/{documentId}")
    public Mono<ResponseEntity<AssembledDocument>> document(@PathVariable String documentId) {
        return blocking(() -> retrievalService.getDocument(documentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @GetMapping("/categories")
    public Mono<List<String>> categories() {
        return blocking(documentRegistry::listCategories);
    }

    @GetMapping("/status")
    public Mono<KnowledgeBaseStatus> status() {
        return blocking(documentRegistry::status);
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
