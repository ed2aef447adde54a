package com.netcourier.knowledge.service.ingestion;

import org.springframework.http.HttpStatus;

public class DocumentParseException extends IngestionException {

    public DocumentParseException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, message, cause);
    }
}
