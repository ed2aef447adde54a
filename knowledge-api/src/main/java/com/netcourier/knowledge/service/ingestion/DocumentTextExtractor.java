package com.netcourier.knowledge.service.ingestion;

import java.io.InputStream;

public interface DocumentTextExtractor {

    /**
     * @throws DocumentParseException when the content cannot be decoded
     */
    String extract(String filename, InputStream inputStream);
}
