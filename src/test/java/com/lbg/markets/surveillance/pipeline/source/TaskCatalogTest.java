package com.lbg.markets.surveillance.pipeline.source;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class TaskCatalogTest {

    @Inject
    TaskCatalog catalog;

    private Path catalogDir;

    @BeforeEach
    void setup() throws IOException {
        catalogDir = Files.createTempDirectory("test-catalog-");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (catalogDir != null && Files.exists(catalogDir)) {
            try (Stream<Path> paths = Files.walk(catalogDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
            }
        }
    }

    @Test
    void shouldLoadBundledCatalog() throws IOException {
        List<FileTask> tasks = catalog.load("tasks.json");

        assertEquals(8, tasks.size());
        FileTask first = tasks.get(0);
        assertEquals("1", first.id());
        assertEquals("file_100.pdf", first.name());
        assertEquals("src-bucket-proj", first.source().bucket());
        assertEquals("project1/uuid1", first.source().key());
        assertEquals("dest-bucket-proj", first.destination().bucket());
        assertFalse(first.destination().hasKey());
        assertEquals("100", first.metadata().get("fileId"));
        assertEquals(FileTask.TaskStatus.READY, first.status());
    }

    @Test
    void shouldLoadCatalogFromDiskWithDefaultBucket() throws IOException {
        Path file = catalogDir.resolve("batch.json");
        Files.writeString(file, """
                [
                  {"id": "a", "src_bucket": "in", "src_key": "x/1", "meta": {"fileId": "9"}, "extra": true}
                ]
                """);

        List<FileTask> tasks = catalog.load(file.toString());

        assertEquals(1, tasks.size());
        assertEquals("a", tasks.get(0).name());
        assertEquals("dest-bucket-proj", tasks.get(0).destination().bucket());
    }

    @Test
    void shouldNameInvalidEntry() throws IOException {
        Path file = catalogDir.resolve("invalid.json");
        Files.writeString(file, "[{\"id\": \"7\", \"src_bucket\": \"\", \"src_key\": \"x\"}]");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> catalog.load("file://" + file));
        assertTrue(e.getMessage().contains("7"), e.getMessage());
    }

    @Test
    void shouldRejectNullMetadataValue() throws IOException {
        Path file = catalogDir.resolve("null-meta.json");
        Files.writeString(file, "[{\"id\": \"3\", \"src_bucket\": \"in\", \"src_key\": \"x\", \"meta\": {\"fileId\": null}}]");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> catalog.load(file.toString()));
        assertTrue(e.getMessage().contains("3"), e.getMessage());
        assertTrue(e.getMessage().contains("fileId"), e.getMessage());
    }

    @Test
    void shouldFailForMissingCatalog() {
        assertThrows(IOException.class, () -> catalog.load("missing.json"));
        assertThrows(IOException.class, () -> catalog.load(catalogDir.resolve("missing.json").toString()));
        assertThrows(IOException.class, () -> catalog.load(" "));
    }
}
