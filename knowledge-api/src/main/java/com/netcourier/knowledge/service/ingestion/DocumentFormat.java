package com.netcourier.knowledge.service.ingestion;

import org.apache.commons.io.FilenameUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum DocumentFormat {

    WORD(true, "docx", "doc"),
    PDF(true, "pdf"),
    PLAIN_TEXT(false, "txt", "md");

    private final boolean binary;
    private final Set<String> extensions;

    DocumentFormat(boolean binary, String... extensions) {
        this.binary = binary;
        this.extensions = Set.of(extensions);
    }

    public boolean binary() {
        return binary;
    }

    public static Optional<DocumentFormat> fromFileName(String filename) {
        String extension = extensionOf(filename);
        return Arrays.stream(values())
                .filter(format -> format.extensions.contains(extension))
                .findFirst();
    }

    public static boolean isSupported(String filename) {
        return fromFileName(filename).isPresent();
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        return FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
    }
}
