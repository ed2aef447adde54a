package com.netcourier.knowledge.service.ingestion;

import java.nio.file.Path;
import java.util.List;

public interface DocumentLocator {

    /**
     * Lists ingestible files below {@code root}. A missing or unreadable root yields an empty list.
     */
    List<Path> locate(Path root);
}
