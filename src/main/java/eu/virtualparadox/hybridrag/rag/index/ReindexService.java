package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;
import eu.virtualparadox.hybridrag.ingest.chunker.TextChunker;
import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Orchestrates the indexing pipeline for documents:
 * <ol>
 *     <li>Chunk the extracted text ({@link TextChunker})</li>
 *     <li>Embed chunks to dense vectors ({@link EmbeddingService})</li>
 *     <li>Upsert chunks + vectors into the vector index</li>
 *     <li>Add the chunks to the BM25 {@link KeywordIndex}</li>
 * </ol>
 * <p>
 * The vector index and the keyword index are kept in sync per document: previous chunks of the
 * document are replaced in both. If embedding fails the document is still indexed for keyword
 * search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReindexService {

    private final TextChunker textChunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final KeywordIndex keywordIndex;

    /**
     * Indexes (or re-indexes) a single document.
     *
     * @param document catalog record
     * @param text     extracted text of the document
     * @return what was written
     * @throws IllegalStateException if the vector index cannot be updated
     */
    public IndexingSummary reindex(final DocumentRecord document, final String text) {
        final String docId = document.id();
        final List<Chunk> chunks = textChunker.chunkDocument(document, text);

        try {
            vectorIndexService.deleteByDocId(docId);
        } catch (final IOException e) {
            throw new IllegalStateException("Reindex failed for document: " + docId, e);
        }
        keywordIndex.remove(docId);

        if (chunks.isEmpty()) {
            log.warn("Document {} produced no chunks", docId);
            return new IndexingSummary(docId, 0, false);
        }

        final boolean vectorIndexed = indexVectors(docId, chunks);
        keywordIndex.add(chunks);

        log.info("Indexed document {} ({}): {} chunks, vectors={}",
                docId, document.filename(), chunks.size(), vectorIndexed);
        return new IndexingSummary(docId, chunks.size(), vectorIndexed);
    }

    /**
     * Removes a document from the vector and the keyword index.
     *
     * @param docId document identifier
     * @throws IOException if the vector index update fails
     */
    public void remove(final String docId) throws IOException {
        vectorIndexService.deleteByDocId(docId);
        keywordIndex.remove(docId);
    }

    private boolean indexVectors(final String docId, final List<Chunk> chunks) {
        final List<float[]> vectors;
        try {
            vectors = embeddingService.embed(chunks.stream().map(Chunk::text).toList());
        } catch (final RuntimeException e) {
            log.warn("Embedding failed for document {}, indexing for keyword search only", docId, e);
            return false;
        }

        try {
            vectorIndexService.upsert(docId, chunks, vectors);
            return true;
        } catch (final IOException e) {
            throw new IllegalStateException("Reindex failed for document: " + docId, e);
        }
    }
}
