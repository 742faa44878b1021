package com.lbg.markets.surveillance.pipeline.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Loads the initial batch of tasks from a JSON array of {@link CatalogEntry}.
 * Locations starting with {@code file://} or {@code /} are read from disk, anything else
 * from the classpath.
 */
@ApplicationScoped
public class TaskCatalog {

    private static final Logger LOG = Logger.getLogger(TaskCatalog.class);

    private static final TypeReference<List<CatalogEntry>> ENTRIES = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final String defaultDestinationBucket;

    @Inject
    public TaskCatalog(
            ObjectMapper mapper,
            @ConfigProperty(name = "pipeline.destination.bucket", defaultValue = "dest-bucket") String defaultDestinationBucket
    ) {
        this.mapper = mapper;
        this.defaultDestinationBucket = defaultDestinationBucket;
    }

    public List<FileTask> load(String location) throws IOException {
        try (InputStream in = open(location)) {
            List<CatalogEntry> entries = mapper.readValue(in, ENTRIES);
            List<FileTask> tasks = entries.stream()
                    .map(entry -> toTask(entry, location))
                    .toList();
            LOG.infof("Loaded %d tasks from %s", tasks.size(), location);
            return tasks;
        }
    }

    private FileTask toTask(CatalogEntry entry, String location) {
        try {
            return entry.toTask(defaultDestinationBucket);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(
                    "Invalid entry %s in catalog %s: %s", entry.id(), location, e.getMessage()), e);
        }
    }

    private InputStream open(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IOException("Catalog location cannot be blank");
        }
        if (location.startsWith("file://") || location.startsWith("/")) {
            Path path = extractPath(location);
            if (!Files.exists(path)) {
                throw new IOException("Catalog does not exist: " + path);
            }
            return Files.newInputStream(path);
        }

        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (in == null) {
            throw new IOException("Catalog resource not found on classpath: " + location);
        }
        return in;
    }

    private Path extractPath(String uri) {
        if (uri.startsWith("file://")) {
            return Paths.get(uri.substring(7));
        }
        return Paths.get(uri);
    }
}
