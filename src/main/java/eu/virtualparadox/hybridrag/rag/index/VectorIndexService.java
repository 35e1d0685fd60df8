package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;

import java.io.IOException;
import java.util.List;

/**
 * Dense-vector backend of the semantic ranker.
 * <p>
 * Chunks are stored per document: a document's chunks are always replaced or removed together,
 * keyed by {@code docId}. The vector dimension is fixed by the first upsert; a different embedder
 * needs a fresh index.
 */
public interface VectorIndexService {

    /**
     * Replaces all chunks of {@code docId} with the given chunk/vector pairs and makes them
     * searchable before returning.
     *
     * @param docId   parent document identifier
     * @param chunks  chunks of that document, in order
     * @param vectors one vector per chunk, same order
     * @throws IOException              if the index cannot be written
     * @throws IllegalArgumentException on empty input, a size or dimension mismatch, or a chunk of
     *                                  another document
     */
    void upsert(final String docId,
                final List<Chunk> chunks,
                final List<float[]> vectors) throws IOException;

    /**
     * Removes every chunk of {@code docId}; unknown ids are a no-op.
     *
     * @param docId parent document identifier
     * @throws IOException if the index cannot be written
     */
    void deleteByDocId(final String docId) throws IOException;

    /**
     * @param vector   query vector
     * @param k        maximum number of results
     * @param minScore results scoring below this similarity are dropped
     * @param filter   optional metadata restriction, {@code null} for none
     * @return results with {@code source = SEMANTIC}, best first
     * @throws IOException if the index cannot be searched
     */
    List<SearchResult> query(final float[] vector,
                             final int k,
                             final double minScore,
                             final VectorQueryFilter filter) throws IOException;
}
