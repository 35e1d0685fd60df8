package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import eu.virtualparadox.hybridrag.rag.retriever.model.ESearchSource;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ReciprocalRankFusionTest {

    @Test
    @DisplayName("A chunk ranked first by both rankers scores 1/61 with equal weights")
    void firstInBoth_scoresOneOverSixtyOne() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(0.5);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.83)),
                List.of(keyword("A", 1, 7.2)),
                5);

        assertEquals(1, fused.size());
        final FusedResult only = fused.get(0);
        assertEquals(1.0 / 61, only.combinedScore(), 1e-12);
        assertEquals(ESearchSource.FUSED, only.source());
        // semantic payload wins
        assertEquals(0.83, only.score());
    }

    @Test
    @DisplayName("Chunks found by one ranker keep that ranker as source")
    void singleRankerChunks_keepSource() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(0.5);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.9)),
                List.of(keyword("B", 1, 3.0)),
                5);

        assertThat(fused).extracting(FusedResult::source)
                .containsExactly(ESearchSource.SEMANTIC, ESearchSource.KEYWORD);
        // equal scores keep first-seen order: semantic keys first
        assertEquals(fused.get(0).combinedScore(), fused.get(1).combinedScore());
        assertEquals("A", fused.get(0).docId());
    }

    @Test
    @DisplayName("alpha = 1 orders by the semantic ranking only")
    void alphaOne_semanticOnly() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(1.0);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.9), semantic("B", 1, 0.8)),
                List.of(keyword("C", 1, 9.0), keyword("B", 1, 5.0)),
                5);

        assertThat(fused).extracting(FusedResult::docId).containsExactly("A", "B", "C");
        assertEquals(1.0 / 61, fused.get(0).combinedScore(), 1e-12);
        assertEquals(0.0, fused.get(2).combinedScore());
    }

    @Test
    @DisplayName("alpha = 0 orders by the keyword ranking only")
    void alphaZero_keywordOnly() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(0.0);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.9), semantic("B", 1, 0.8)),
                List.of(keyword("C", 1, 9.0), keyword("B", 1, 5.0)),
                5);

        assertThat(fused).extracting(FusedResult::docId).containsExactly("C", "B", "A");
    }

    @Test
    @DisplayName("Results are truncated to topK")
    void truncatesToTopK() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(0.5);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.9), semantic("B", 1, 0.8), semantic("C", 1, 0.7)),
                List.of(),
                2);

        assertThat(fused).extracting(FusedResult::docId).containsExactly("A", "B");
        assertThat(fusion.fuse(List.of(), List.of(), 3)).isEmpty();
        assertThat(fusion.fuse(List.of(semantic("A", 1, 0.9)), List.of(), 0)).isEmpty();
    }

    @Test
    @DisplayName("A chunk repeated within one ranking counts at its first rank only")
    void repeatedChunk_countsOnce() {
        final ReciprocalRankFusion fusion = new ReciprocalRankFusion(0.5);

        final List<FusedResult> fused = fusion.fuse(
                List.of(semantic("A", 1, 0.9), semantic("A", 1, 0.9)),
                List.of(),
                5);

        assertEquals(1, fused.size());
        assertEquals(0.5 / 61, fused.get(0).combinedScore(), 1e-12);
    }

    @Test
    @DisplayName("alpha outside [0, 1] is rejected")
    void invalidAlpha_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ReciprocalRankFusion(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new ReciprocalRankFusion(1.1));
        assertThrows(IllegalArgumentException.class, () -> new ReciprocalRankFusion(Double.NaN));
    }

    static SearchResult semantic(final String docId, final int chunkId, final double score) {
        return new SearchResult(chunkId, docId, "text of " + docId + chunkId, docId + ".pdf", EFileType.PDF,
                score, ESearchSource.SEMANTIC);
    }

    static SearchResult keyword(final String docId, final int chunkId, final double score) {
        return new SearchResult(chunkId, docId, "text of " + docId + chunkId, docId + ".pdf", EFileType.PDF,
                score, ESearchSource.KEYWORD);
    }
}
