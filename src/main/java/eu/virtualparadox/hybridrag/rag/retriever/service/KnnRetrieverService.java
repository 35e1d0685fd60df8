package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.VectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.VectorQueryFilter;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Provides semantic query capabilities over the vector index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the user query using {@link EmbeddingService}</li>
 *   <li>Run an ANN search through {@link VectorIndexService}</li>
 *   <li>Drop results below the configured minimum similarity</li>
 * </ol>
 */
@Service
public final class KnnRetrieverService implements RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final double minScore;

    public KnnRetrieverService(final EmbeddingService embeddingService,
                               final VectorIndexService vectorIndexService,
                               @Value("${search.min-semantic-score:0.1}") final double minScore) {
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.minScore = minScore;
    }

    /**
     * Executes a semantic search against the whole index.
     *
     * @param query user input string
     * @param k     maximum number of results to return
     * @return list of {@link SearchResult} objects (never null)
     * @throws IOException if the index cannot be searched
     */
    @Override
    public List<SearchResult> search(final String query, final int k) throws IOException {
        return search(query, k, VectorQueryFilter.none());
    }

    /**
     * Executes a semantic search restricted by {@code filter}.
     *
     * @param query  user input string
     * @param k      maximum number of results to return
     * @param filter document or file type restriction
     * @return list of {@link SearchResult} objects (never null)
     * @throws IOException if the index cannot be searched
     */
    public List<SearchResult> search(final String query, final int k, final VectorQueryFilter filter) throws IOException {
        if (StringUtils.isBlank(query) || k <= 0) {
            return List.of();
        }
        final float[] vector = embeddingService.embedQuery(query);
        return vectorIndexService.query(vector, k, minScore, filter);
    }
}
