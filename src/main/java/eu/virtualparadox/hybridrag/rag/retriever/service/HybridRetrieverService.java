package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndex;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchStats;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hybrid retriever: combines ANN semantic search with BM25 keyword search.
 * <p>
 * Steps:
 * <ol>
 *   <li>Over-fetch {@code 2 * topK} candidates from each ranker</li>
 *   <li>Fuse both rankings with {@link ReciprocalRankFusion}</li>
 *   <li>Return the top {@code topK} {@link FusedResult}s</li>
 * </ol>
 * A ranker that throws is logged and treated as having returned nothing, so the other one still
 * answers. Blank queries and non-positive {@code topK} yield an empty list.
 */
@Slf4j
@Service
public class HybridRetrieverService {

    private final RetrieverService semanticRetriever;
    private final RetrieverService keywordRetriever;
    private final ReciprocalRankFusion fusion;
    private final KeywordIndex keywordIndex;

    public HybridRetrieverService(@Qualifier("knnRetrieverService") final RetrieverService semanticRetriever,
                                  @Qualifier("keywordRetrieverService") final RetrieverService keywordRetriever,
                                  final ReciprocalRankFusion fusion,
                                  final KeywordIndex keywordIndex) {
        this.semanticRetriever = semanticRetriever;
        this.keywordRetriever = keywordRetriever;
        this.fusion = fusion;
        this.keywordIndex = keywordIndex;
    }

    /**
     * Executes hybrid semantic + keyword search.
     *
     * @param query user query string
     * @param topK  maximum number of results
     * @return fused results, best first (never null)
     */
    public List<FusedResult> search(final String query, final int topK) {
        if (StringUtils.isBlank(query) || topK <= 0) {
            return List.of();
        }

        final int candidates = topK * 2;
        final List<SearchResult> semantic = runRanker("Semantic", semanticRetriever, query, candidates);
        final List<SearchResult> keyword = runRanker("Keyword", keywordRetriever, query, candidates);

        final List<FusedResult> fused = fusion.fuse(semantic, keyword, topK);
        log.info("Hybrid search returned {} results ({} semantic, {} keyword candidates)",
                fused.size(), semantic.size(), keyword.size());
        return fused;
    }

    /**
     * @return size of the keyword index and the fusion weight
     */
    public SearchStats stats() {
        return new SearchStats(keywordIndex.size(), keywordIndex.documentCount(), fusion.getAlpha());
    }

    private List<SearchResult> runRanker(final String name,
                                         final RetrieverService ranker,
                                         final String query,
                                         final int k) {
        try {
            final List<SearchResult> results = ranker.search(query, k);
            return results == null ? List.of() : results;
        } catch (final Exception e) {
            log.error("{} search failed for query: {}", name, query, e);
            return List.of();
        }
    }
}
