package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import eu.virtualparadox.hybridrag.query.citation.Citation;
import eu.virtualparadox.hybridrag.rag.retriever.model.ESearchSource;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ContextBuilderTest {

    @Test
    @DisplayName("Results become numbered source blocks with matching citations")
    void build_numbersSources() {
        final AnswerContext context = new ContextBuilder(3000).build(List.of(
                result("a", 4, "Refunds take thirty days.", 0.9),
                result("b", 0, "Shipping is free.", 6.5)));

        assertEquals("[Source 1] Refunds take thirty days.\n\n[Source 2] Shipping is free.", context.context());
        assertThat(context.citations()).extracting(Citation::id).containsExactly(1, 2);

        final Citation first = context.citations().get(0);
        assertEquals("a", first.docId());
        assertEquals(4, first.chunkId());
        assertEquals("a.md", first.filename());
        assertEquals("Refunds take thirty days.", first.text());
        assertEquals(0.9, first.score());
        assertFalse(first.mentionedInAnswer());
    }

    @Test
    @DisplayName("Sources stop at the first one that would exceed the budget")
    void build_stopsAtBudget() {
        // estimates: 5, 5, 2 tokens
        final AnswerContext context = new ContextBuilder(10).build(List.of(
                result("a", 0, "x".repeat(20), 0.9),
                result("b", 0, "y".repeat(20), 0.8),
                result("c", 0, "z".repeat(8), 0.7)));

        assertThat(context.citations()).extracting(Citation::docId).containsExactly("a", "b");
    }

    @Test
    @DisplayName("A first source over budget yields an empty context")
    void build_firstSourceTooLarge() {
        final AnswerContext context = new ContextBuilder(9).build(List.of(
                result("a", 0, "x".repeat(40), 0.9),
                result("b", 0, "tiny", 0.8)));

        assertTrue(context.isEmpty());
        assertThat(context.citations()).isEmpty();
        assertTrue(new ContextBuilder(9).build(List.of()).isEmpty());
    }

    @Test
    @DisplayName("The budget must be positive")
    void constructor_validatesBudget() {
        assertThrows(IllegalArgumentException.class, () -> new ContextBuilder(0));
    }

    static FusedResult result(final String docId, final int chunkId, final String text, final double score) {
        return new FusedResult(new SearchResult(chunkId, docId, text, docId + ".md", EFileType.MD, score,
                ESearchSource.FUSED), 0.02);
    }
}
