package eu.virtualparadox.hybridrag.ingest.lifecycle;

import eu.virtualparadox.hybridrag.application.config.ApplicationConfig;
import eu.virtualparadox.hybridrag.application.executor.IngestionExecutor;
import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;
import eu.virtualparadox.hybridrag.catalog.service.DocumentStore;
import eu.virtualparadox.hybridrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import eu.virtualparadox.hybridrag.rag.index.IndexingSummary;
import eu.virtualparadox.hybridrag.rag.index.ReindexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Manages the full lifecycle of documents:
 * <ul>
 *   <li>Catalog ({@link DocumentStore})</li>
 *   <li>Vector index (Lucene) and keyword index (BM25), through {@link ReindexService}</li>
 * </ul>
 * Ingestion validates the file (supported extension, size limit), extracts its text, skips content
 * that was already ingested (MD5 of the file bytes) and registers the document before indexing.
 * Supports both synchronous and asynchronous ingestion.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private static final String ERROR_NOT_FOUND = "Document not found: ";

    private final ApplicationConfig config;
    private final DocumentStore documentStore;
    private final TextExtractor textExtractor;
    private final ReindexService reindexService;
    private final IngestionExecutor ingestionExecutor;

    /**
     * Ingests a file and indexes it before returning.
     *
     * @param file     file to ingest
     * @param filename display filename (its extension selects the extractor)
     * @return the registered document and what was indexed
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file type is unsupported or the file is too large
     */
    public IngestionResult ingest(final Path file, final String filename) throws IOException {
        final Registration registration = register(file, filename);
        if (registration.duplicate()) {
            return IngestionResult.duplicateOf(registration.document());
        }

        final DocumentRecord document = registration.document();
        try {
            final IndexingSummary summary = reindexService.reindex(document, registration.text());
            return new IngestionResult(document, false, summary.chunkCount(), summary.vectorIndexed());
        } catch (final RuntimeException e) {
            log.error("Indexing failed, cleaning up {}", document.id(), e);
            cleanup(document.id());
            throw e;
        }
    }

    /**
     * Ingests a file using its own name as the display filename.
     *
     * @see #ingest(Path, String)
     */
    public IngestionResult ingest(final Path file) throws IOException {
        return ingest(file, file.getFileName().toString());
    }

    /**
     * Registers the document and queues indexing on the ingestion executor.
     * <p>If indexing fails, the document is removed from the catalog and both indexes.</p>
     *
     * @param file     file to ingest
     * @param filename display filename
     * @return the registered document; indexing may still be in progress
     * @throws IOException if the file cannot be read
     */
    public IngestionResult ingestAsync(final Path file, final String filename) throws IOException {
        final Registration registration = register(file, filename);
        if (registration.duplicate()) {
            return IngestionResult.duplicateOf(registration.document());
        }

        final DocumentRecord document = registration.document();
        ingestionExecutor.submit(() -> {
            try {
                log.info("Asynchronous indexing started for {}", document.id());
                reindexService.reindex(document, registration.text());
                log.info("Asynchronous indexing completed for {}", document.id());
            } catch (final Exception e) {
                log.error("Asynchronous indexing failed, cleaning up {}", document.id(), e);
                cleanup(document.id());
            }
        });

        return new IngestionResult(document, false, 0, false);
    }

    /**
     * Deletes a document from the catalog and both indexes.
     *
     * @param id document identifier
     * @throws IOException              if the vector index update fails
     * @throws IllegalArgumentException if the document is unknown
     */
    public void deleteDocument(final String id) throws IOException {
        final Optional<DocumentRecord> optDoc = documentStore.findById(id);
        if (optDoc.isEmpty()) {
            throw new IllegalArgumentException(ERROR_NOT_FOUND + id);
        }

        reindexService.remove(id);
        documentStore.delete(id);

        log.info("Deleted document {} ({}) from catalog and indexes", id, optDoc.get().filename());
    }

    /**
     * @return all documents, newest first
     */
    public List<DocumentRecord> listDocuments() {
        return documentStore.listAll();
    }

    /**
     * Validates, extracts and registers a document. Synchronized so that two concurrent uploads of
     * the same content cannot both pass the duplicate check.
     */
    private synchronized Registration register(final Path file, final String filename) throws IOException {
        final EFileType fileType = EFileType.fromFilename(filename)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported file type: " + filename));

        final long size = Files.size(file);
        if (size > config.getMaxFileSizeBytes()) {
            throw new IllegalArgumentException("File too large: " + filename + " (" + size
                    + " bytes, limit " + config.getMaxFileSizeBytes() + ")");
        }

        final String hash = DigestUtils.md5DigestAsHex(Files.readAllBytes(file));
        final Optional<DocumentRecord> existing = documentStore.findByHash(hash);
        if (existing.isPresent()) {
            log.info("Skipping {}: identical content already ingested as {}", filename, existing.get().id());
            return new Registration(existing.get(), null, true);
        }

        final String text = textExtractor.extractText(file, fileType);
        final DocumentRecord document = DocumentRecord.builder()
                .id(documentStore.newId())
                .filename(filename)
                .fileType(fileType)
                .sizeBytes(size)
                .hash(hash)
                .wordCount(StringUtils.split(text).length)
                .charCount(text.length())
                .uploadedAt(Instant.now())
                .build();

        documentStore.save(document, text);
        log.info("Registered document {} ({}, {} bytes)", document.id(), filename, size);
        return new Registration(document, text, false);
    }

    private void cleanup(final String id) {
        try {
            reindexService.remove(id);
        } catch (final IOException cleanupEx) {
            log.error("Cleanup failed for {}", id, cleanupEx);
        }
        documentStore.delete(id);
    }

    private record Registration(DocumentRecord document, String text, boolean duplicate) {
    }
}
