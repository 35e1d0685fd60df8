package eu.virtualparadox.hybridrag.ingest.lifecycle;

import eu.virtualparadox.hybridrag.application.config.ApplicationConfig;
import eu.virtualparadox.hybridrag.application.executor.IngestionExecutor;
import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;
import eu.virtualparadox.hybridrag.catalog.service.DocumentStore;
import eu.virtualparadox.hybridrag.ingest.chunker.TextChunker;
import eu.virtualparadox.hybridrag.ingest.chunker.TokenCounter;
import eu.virtualparadox.hybridrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.hybridrag.ingest.extractor.FileTextExtractor;
import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.ReindexService;
import eu.virtualparadox.hybridrag.rag.index.VectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.VectorQueryFilter;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndex;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentLifecycleManagerTest {

    private static final String POLICY = "Refunds are issued within thirty days. "
            + "Shipping is free for orders above fifty euros. "
            + "Support answers emails on working days.";

    @TempDir
    Path tempDir;

    private IndexWriter writer;
    private SearcherManager searcherManager;
    private VectorIndexService vectorIndex;
    private KeywordIndex keywordIndex;
    private DocumentStore documentStore;
    private ApplicationConfig config;
    private IngestionExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        writer = new IndexWriter(new ByteBuffersDirectory(), new IndexWriterConfig(new StandardAnalyzer()));
        searcherManager = new SearcherManager(writer, null);
        vectorIndex = new LuceneVectorIndexService(writer, searcherManager);
        keywordIndex = new KeywordIndex();
        documentStore = new DocumentStore();
        config = new ApplicationConfig();

        executor = new IngestionExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdown();
        searcherManager.close();
        writer.close();
    }

    @Test
    @DisplayName("Ingesting a file registers it and indexes it for both rankers")
    void ingest_indexesDocument() throws IOException {
        final Path file = write("policy.txt", POLICY);

        final IngestionResult result = manager(new HashingEmbeddingService()).ingest(file);

        final DocumentRecord doc = result.document();
        assertFalse(result.duplicate());
        assertTrue(result.vectorIndexed());
        assertTrue(result.chunkCount() > 0);
        assertEquals("policy.txt", doc.filename());
        assertEquals(EFileType.TXT, doc.fileType());
        assertEquals(Files.size(file), doc.sizeBytes());
        assertEquals(POLICY.split("\\s+").length, doc.wordCount());
        assertEquals(POLICY.length(), doc.charCount());
        assertThat(doc.hash()).matches("[0-9a-f]{32}");

        assertEquals(POLICY, documentStore.getText(doc.id()).orElseThrow());
        assertThat(keywordIndex.search("refunds", 5)).isNotEmpty();
        final List<SearchResult> semantic = vectorIndex.query(
                new HashingEmbeddingService().embedQuery("refunds thirty days"), 5, 0.0, VectorQueryFilter.none());
        assertThat(semantic).extracting(SearchResult::docId).containsOnly(doc.id());
    }

    @Test
    @DisplayName("Identical content is ingested only once")
    void ingest_skipsDuplicates() throws IOException {
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());
        final IngestionResult first = manager.ingest(write("policy.txt", POLICY));
        final int chunks = keywordIndex.size();

        final IngestionResult second = manager.ingest(write("copy.md", POLICY), "copy.md");

        assertTrue(second.duplicate());
        assertEquals(first.document().id(), second.document().id());
        assertEquals(0, second.chunkCount());
        assertEquals(1, documentStore.count());
        assertEquals(chunks, keywordIndex.size());
    }

    @Test
    @DisplayName("Unsupported and oversized files are rejected before registration")
    void ingest_validatesFile() throws IOException {
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());

        final IllegalArgumentException unsupported = assertThrows(IllegalArgumentException.class,
                () -> manager.ingest(write("notes.docx", POLICY)));
        assertThat(unsupported.getMessage()).contains("Unsupported file type");

        config.setMaxFileSizeBytes(10);
        final IllegalArgumentException tooLarge = assertThrows(IllegalArgumentException.class,
                () -> manager.ingest(write("policy.txt", POLICY)));
        assertThat(tooLarge.getMessage()).contains("File too large");

        assertEquals(0, documentStore.count());
    }

    @Test
    @DisplayName("Files without text are rejected")
    void ingest_rejectsEmptyText() throws IOException {
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());

        assertThrows(IllegalStateException.class, () -> manager.ingest(write("empty.md", "  \n ")));
        assertEquals(0, documentStore.count());
    }

    @Test
    @DisplayName("Embedding failures leave the document searchable by keyword")
    void ingest_fallsBackToKeywordOnly() throws IOException {
        final EmbeddingService broken = new HashingEmbeddingService() {
            @Override
            public List<float[]> embed(final List<String> texts) {
                throw new IllegalStateException("Embedding model is not loaded");
            }
        };

        final IngestionResult result = manager(broken).ingest(write("policy.txt", POLICY));

        assertFalse(result.vectorIndexed());
        assertTrue(result.chunkCount() > 0);
        assertEquals(1, documentStore.count());
        assertThat(keywordIndex.search("shipping", 5)).isNotEmpty();
    }

    @Test
    @DisplayName("A failing vector index rolls back the registration")
    void ingest_cleansUpOnIndexFailure() throws IOException {
        vectorIndex = new FailingVectorIndex();

        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());
        assertThrows(IllegalStateException.class, () -> manager.ingest(write("policy.txt", POLICY)));

        assertEquals(0, documentStore.count());
        assertEquals(0, keywordIndex.size());
    }

    @Test
    @DisplayName("Deleting a document removes it from the catalog and both indexes")
    void deleteDocument_removesEverywhere() throws IOException {
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());
        final String id = manager.ingest(write("policy.txt", POLICY)).document().id();
        manager.ingest(write("other.txt", "Completely different content about parking."));

        manager.deleteDocument(id);

        assertThat(manager.listDocuments()).extracting(DocumentRecord::filename).containsExactly("other.txt");
        assertThat(keywordIndex.search("refunds", 5)).isEmpty();
        assertThat(vectorIndex.query(new HashingEmbeddingService().embedQuery("refunds"), 10, 0.0,
                VectorQueryFilter.forDocument(id))).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> manager.deleteDocument(id));
    }

    @Test
    @DisplayName("Asynchronous ingestion registers immediately and indexes on the executor")
    void ingestAsync_indexesInBackground() throws IOException {
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());

        final IngestionResult queued = manager.ingestAsync(write("policy.txt", POLICY), "policy.txt");

        assertFalse(queued.duplicate());
        assertTrue(documentStore.findById(queued.document().id()).isPresent());

        executor.shutdown();
        final List<Chunk> indexed = keywordIndex.search("refunds", 5).stream()
                .map(hit -> hit.chunk())
                .toList();
        assertThat(indexed).extracting(Chunk::docId).containsOnly(queued.document().id());
    }

    @Test
    @DisplayName("Asynchronous indexing failures remove the document again")
    void ingestAsync_cleansUpOnFailure() throws IOException {
        vectorIndex = new FailingVectorIndex();
        final DocumentLifecycleManager manager = manager(new HashingEmbeddingService());

        manager.ingestAsync(write("policy.txt", POLICY), "policy.txt");
        executor.shutdown();

        assertEquals(0, documentStore.count());
        assertEquals(0, keywordIndex.size());
    }

    private DocumentLifecycleManager manager(final EmbeddingService embeddingService) {
        final TextChunker chunker = new TextChunker(new TextCleaner(), new TokenCounter(), 12, 3);
        final ReindexService reindexService = new ReindexService(chunker, embeddingService, vectorIndex, keywordIndex);
        return new DocumentLifecycleManager(config, documentStore, new FileTextExtractor(), reindexService, executor);
    }

    private Path write(final String name, final String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static final class FailingVectorIndex implements VectorIndexService {

        @Override
        public void upsert(final String docId, final List<Chunk> chunks, final List<float[]> vectors) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void deleteByDocId(final String docId) {
        }

        @Override
        public List<SearchResult> query(final float[] vector, final int k, final double minScore,
                                        final VectorQueryFilter filter) {
            return List.of();
        }
    }
}
