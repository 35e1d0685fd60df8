package eu.virtualparadox.hybridrag.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for texts.
 */
public interface EmbeddingService {

    /**
     * Embeds the given texts in batch.
     *
     * @param texts chunk texts
     * @return list of float vectors, one per text, same order
     * @throws IllegalStateException if the embedding model is unavailable or inference fails
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single query string into dense vector space.
     * <p>
     * Used at query time for semantic search.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     */
    float[] embedQuery(final String text);
}
