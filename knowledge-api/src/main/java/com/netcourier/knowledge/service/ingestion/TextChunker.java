package com.netcourier.knowledge.service.ingestion;

import java.util.List;

public interface TextChunker {

    /**
     * Splits {@code text} into non-empty, overlapping segments. Blank input yields no segments.
     */
    List<String> chunk(String text);
}
