package com.netcourier.knowledge.service.ingestion;

import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Reads a located file into a {@link ParsedDocument}. Word and PDF files go through the
 * {@link DocumentTextExtractor}; text and markdown files are decoded as UTF-8.
 */
@Component
public class DocumentParser {

    static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_SLUG_LENGTH = 30;
    private static final int HASH_LENGTH = 12;

    private final DocumentTextExtractor textExtractor;

    public DocumentParser(DocumentTextExtractor textExtractor) {
        this.textExtractor = textExtractor;
    }

    /**
     * @throws UnsupportedDocumentFormatException for extensions outside {@link DocumentFormat}
     * @throws DocumentParseException when the file cannot be read or decoded
     */
    public ParsedDocument parse(Path file, Path root) {
        String name = file.getFileName().toString();
        DocumentFormat format = DocumentFormat.fromFileName(name)
                .orElseThrow(() -> new UnsupportedDocumentFormatException(DocumentFormat.extensionOf(name)));
        byte[] bytes = readBytes(file);
        String content = format.binary() ? extractBinary(name, bytes) : new String(bytes, StandardCharsets.UTF_8);
        String path = file.toAbsolutePath().normalize().toString();
        return new ParsedDocument(
                documentIdFor(path),
                name,
                path,
                content,
                categoryOf(file, root),
                titleOf(content, name));
    }

    private byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + file, e);
        }
    }

    private String extractBinary(String name, byte[] bytes) {
        try (InputStream stream = new ByteArrayInputStream(bytes)) {
            return textExtractor.extract(name, stream);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read document stream for " + name, e);
        }
    }

    static String documentIdFor(String path) {
        String normalized = path.replace('\\', '/');
        String slug = FilenameUtils.getBaseName(normalized)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]", "-");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        return slug + "-" + sha256(normalized).substring(0, HASH_LENGTH);
    }

    /**
     * Top-level folder of {@code file} below {@code root}; null for files directly in the root.
     */
    static String categoryOf(Path file, Path root) {
        if (root == null) {
            return null;
        }
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        if (relative.getNameCount() > 1) {
            return relative.getName(0).toString();
        }
        return null;
    }

    static String titleOf(String content, String fallback) {
        if (content != null) {
            for (String line : content.split("\n")) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.length() <= MAX_TITLE_LENGTH) {
                    return trimmed;
                }
                return trimmed.substring(0, MAX_TITLE_LENGTH - 3) + "...";
            }
        }
        return fallback;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
