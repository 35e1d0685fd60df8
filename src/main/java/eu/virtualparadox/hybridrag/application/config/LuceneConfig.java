package eu.virtualparadox.hybridrag.application.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lucene resources of the vector index.
 * <p>
 * All beans are {@link java.io.Closeable}; Spring closes them on shutdown in reverse dependency
 * order (searcher manager, writer, analyzer, directory).
 * <p>
 * The index is recreated on every start: the document catalog lives in memory, so vectors left
 * over from a previous run would reference unknown documents.
 */
@Slf4j
@Configuration
public class LuceneConfig {

    @Bean(destroyMethod = "close")
    public Directory luceneDirectory(final ApplicationConfig config) throws IOException {
        final Path indexPath = config.getIndex();
        Files.createDirectories(indexPath);
        return FSDirectory.open(indexPath);
    }

    /**
     * Only {@code StringField}s are indexed, so the analyzer is never applied to chunk text.
     */
    @Bean(destroyMethod = "close")
    public Analyzer luceneAnalyzer() {
        return new StandardAnalyzer();
    }

    @Bean(destroyMethod = "close")
    public IndexWriter indexWriter(final Directory directory, final Analyzer analyzer) throws IOException {
        final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE));
        // an empty commit lets the first SearcherManager open before any document is indexed
        writer.commit();
        log.info("Vector index (re)created at {}", directory);
        return writer;
    }

    @Bean(destroyMethod = "close")
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        return new SearcherManager(writer, null);
    }
}
