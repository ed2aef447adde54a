package com.netcourier.knowledge.service.ingestion;

import org.springframework.http.HttpStatus;

public class UnsupportedDocumentFormatException extends IngestionException {

    private final String extension;

    public UnsupportedDocumentFormatException(String extension) {
        super(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported file format: " + (extension.isEmpty() ? "(none)" : "." + extension));
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
