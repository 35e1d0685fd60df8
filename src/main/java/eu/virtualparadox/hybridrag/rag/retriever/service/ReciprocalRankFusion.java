package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.rag.retriever.model.ChunkKey;
import eu.virtualparadox.hybridrag.rag.retriever.model.ESearchSource;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted Reciprocal Rank Fusion of a semantic and a keyword ranking.
 * <p>
 * A result at 1-based rank {@code r} contributes {@code weight / (K + r)} with {@code K = 60};
 * the semantic ranking is weighted by {@code alpha}, the keyword ranking by {@code 1 - alpha}.
 * Results are identified by {@code (docId, chunkId)}. The semantic payload wins when both rankers
 * return a chunk, and such chunks are marked {@link ESearchSource#FUSED}. Ordering is by combined
 * score descending; ties keep first-seen order (semantic ranking first). A chunk repeated within
 * one ranking only counts at its best rank.
 */
@Component
public class ReciprocalRankFusion {

    public static final int K = 60;

    @Getter
    private final double alpha;

    public ReciprocalRankFusion(@Value("${search.alpha:0.5}") final double alpha) {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be in [0, 1]: " + alpha);
        }
        this.alpha = alpha;
    }

    /**
     * Fuses two rankings.
     *
     * @param semantic semantic results, best first
     * @param keyword  keyword results, best first
     * @param topK     maximum number of fused results
     * @return at most {@code topK} fused results, best first
     */
    public List<FusedResult> fuse(final List<SearchResult> semantic,
                                  final List<SearchResult> keyword,
                                  final int topK) {
        if (topK <= 0) {
            return List.of();
        }

        final Map<ChunkKey, Accumulator> fused = new LinkedHashMap<>();
        accumulate(fused, semantic, alpha, true);
        accumulate(fused, keyword, 1.0 - alpha, false);

        final List<FusedResult> results = new ArrayList<>(fused.size());
        for (final Accumulator acc : fused.values()) {
            final SearchResult payload = acc.seenBySemantic && acc.seenByKeyword
                    ? acc.payload.withSource(ESearchSource.FUSED)
                    : acc.payload;
            results.add(new FusedResult(payload, acc.score));
        }

        // List.sort is stable
        results.sort(Comparator.comparingDouble(FusedResult::combinedScore).reversed());
        return results.size() > topK ? List.copyOf(results.subList(0, topK)) : results;
    }

    private static void accumulate(final Map<ChunkKey, Accumulator> fused,
                                   final List<SearchResult> ranking,
                                   final double weight,
                                   final boolean semantic) {
        final Set<ChunkKey> seen = new HashSet<>();
        for (int i = 0; i < ranking.size(); i++) {
            final SearchResult r = ranking.get(i);
            final ChunkKey key = r.key();
            if (!seen.add(key)) {
                continue;
            }
            final int rank = i + 1;
            final Accumulator acc = fused.computeIfAbsent(key, k -> new Accumulator(r));
            acc.score += weight / (K + rank);
            if (semantic) {
                acc.seenBySemantic = true;
            } else {
                acc.seenByKeyword = true;
            }
        }
    }

    private static final class Accumulator {
        private final SearchResult payload;
        private double score;
        private boolean seenBySemantic;
        private boolean seenByKeyword;

        private Accumulator(final SearchResult payload) {
            this.payload = payload;
        }
    }
}
