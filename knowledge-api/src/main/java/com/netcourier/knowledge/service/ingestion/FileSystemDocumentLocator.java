package com.netcourier.knowledge.service.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class FileSystemDocumentLocator implements DocumentLocator {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentLocator.class);

    @Override
    public List<Path> locate(Path root) {
        if (root == null) {
            return List.of();
        }
        Path start = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(start) || !Files.isReadable(start)) {
            log.warn("Document root {} is missing or unreadable", start);
            return List.of();
        }
        List<Path> documents = new ArrayList<>();
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(start) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && DocumentFormat.isSupported(file.getFileName().toString())) {
                        documents.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to scan document root {}", start, e);
            return List.of();
        }
        documents.sort(Comparator.naturalOrder());
        return List.copyOf(documents);
    }

    private boolean isHidden(Path dir) {
        Path name = dir.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
