package eu.virtualparadox.hybridrag.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Storage locations and ingestion limits, bound from {@code hybridrag.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "hybridrag")
@Getter @Setter
public class ApplicationConfig {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;

    /** Base folder of all local state. */
    private Path root;
    /** Lucene vector index folder. */
    private Path index;
    /** Model folder; the embedder is read from {@code <models>/retriever}. */
    private Path models;
    /** Upload limit, 10 MiB by default. */
    private long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;

    @PostConstruct
    public void ensureFolders() throws IOException {
        for (final Path folder : new Path[]{root, index, models}) {
            if (folder != null) {
                Files.createDirectories(folder);
            }
        }
    }
}
