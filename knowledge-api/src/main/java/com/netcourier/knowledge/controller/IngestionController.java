package com.netcourier.knowledge.controller;

import com.netcourier.knowledge.model.IngestRequest;
import com.netcourier.knowledge.model.IngestionStats;
import com.netcourier.knowledge.service.ingestion.IngestionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

@RestController
@RequestMapping("/admin")
public class IngestionController {

    private final IngestionService ingestionService;
    private final String defaultDocumentsPath;

    public IngestionController(IngestionService ingestionService,
                               @Value("${knowledge.ingest.documents-path:./knowledge_docs}") String defaultDocumentsPath) {
        this.ingestionService = ingestionService;
        this.defaultDocumentsPath = defaultDocumentsPath;
    }

    @PostMapping(value = "/ingest", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestionStats> ingest(@RequestBody(required = false) IngestRequest request) {
        String rootPath = request == null || request.rootPath() == null || request.rootPath().isBlank()
                ? defaultDocumentsPath
                : request.rootPath();
        boolean reset = request != null && request.reset();
        return Mono.fromCallable(() -> ingestionService.ingest(Path.of(rootPath), reset))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/documents/{documentId}")
    public Mono<ResponseEntity<Void>> removeDocument(@PathVariable String documentId) {
        return Mono.fromRunnable(() -> ingestionService.removeDocument(documentId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
