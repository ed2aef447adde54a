package com.netcourier.knowledge.service.ingestion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemDocumentLocatorTest {

    @TempDir
    Path root;

    private final FileSystemDocumentLocator locator = new FileSystemDocumentLocator();

    @Test
    void findsSupportedFilesRecursivelyInSortedOrder() throws IOException {
        touch("b.md");
        touch("a.txt");
        touch("data.csv");
        touch("faq/returns.pdf");
        touch("faq/eu/Shipping.DOCX");
        touch("legacy/old.doc");

        List<Path> documents = locator.locate(root);

        assertThat(documents)
                .extracting(path -> root.relativize(path).toString().replace('\\', '/'))
                .containsExactlyInAnyOrder("a.txt", "b.md", "faq/returns.pdf", "faq/eu/Shipping.DOCX", "legacy/old.doc");
        assertThat(documents).isSorted().allSatisfy(path -> assertThat(path).isAbsolute());
    }

    @Test
    void skipsHiddenDirectories() throws IOException {
        touch(".git/notes.txt");
        touch("visible/.notes.txt");
        touch("visible/guide.txt");

        List<Path> documents = locator.locate(root);

        assertThat(documents)
                .extracting(path -> path.getFileName().toString())
                .containsExactlyInAnyOrder(".notes.txt", "guide.txt");
    }

    @Test
    void missingRootYieldsEmptyResult() {
        assertThat(locator.locate(root.resolve("does-not-exist"))).isEmpty();
        assertThat(locator.locate(null)).isEmpty();
    }

    @Test
    void fileAsRootYieldsEmptyResult() throws IOException {
        Path file = touch("single.txt");

        assertThat(locator.locate(file)).isEmpty();
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "content of " + relative);
        return file;
    }
}
