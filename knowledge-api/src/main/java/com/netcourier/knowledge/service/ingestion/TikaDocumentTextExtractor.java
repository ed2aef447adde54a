package com.netcourier.knowledge.service.ingestion;

import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Optional;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public String extract(String filename, InputStream inputStream) {
        try {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            parser.parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString()).orElse("");
            log.debug("Extracted {} characters from {} ({})", text.length(), filename, metadata.get(Metadata.CONTENT_TYPE));
            return text;
        } catch (Exception e) {
            log.error("Failed to extract text from document {}", filename, e);
            throw new DocumentParseException("Failed to extract text from " + filename, e);
        }
    }
}
