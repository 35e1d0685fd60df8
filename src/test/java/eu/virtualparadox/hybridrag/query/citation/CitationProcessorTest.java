package eu.virtualparadox.hybridrag.query.citation;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CitationProcessorTest {

    private static final List<Citation> AVAILABLE = List.of(
            citation(1, "handbook.pdf"),
            citation(2, "faq.md"),
            citation(3, "notes.txt"));

    private final CitationProcessor processor = new CitationProcessor();

    @Test
    @DisplayName("Cited sources are returned once, in id order, marked as mentioned")
    void extract_returnsMentionedSources() {
        final CitationExtraction extraction = processor.extract(
                "Refunds take 30 days [Source 3]. A receipt is needed [Source 1] [Source 3].", AVAILABLE);

        assertFalse(extraction.fallback());
        assertThat(extraction.citations()).extracting(Citation::id).containsExactly(1, 3);
        assertThat(extraction.citations()).allMatch(Citation::mentionedInAnswer);
    }

    @Test
    @DisplayName("Out-of-range markers are ignored")
    void extract_ignoresOutOfRange() {
        final CitationExtraction extraction = processor.extract(
                "See [Source 0], [Source 2], [Source 4] and [Source 99999999999].", AVAILABLE);

        assertFalse(extraction.fallback());
        assertThat(extraction.citations()).extracting(Citation::id).containsExactly(2);
    }

    @Test
    @DisplayName("Without valid markers every source is returned unmarked")
    void extract_fallsBackToAllSources() {
        for (final String answer : List.of("No markers here.", "[Source 7]", "[source 1]", "[Source x]", "")) {
            final CitationExtraction extraction = processor.extract(answer, AVAILABLE);

            assertTrue(extraction.fallback(), answer);
            assertEquals(AVAILABLE, extraction.citations());
            assertThat(extraction.citations()).noneMatch(Citation::mentionedInAnswer);
        }
        assertTrue(processor.extract(null, AVAILABLE).fallback());
    }

    @Test
    @DisplayName("No available sources yields an empty fallback")
    void extract_withoutSources() {
        final CitationExtraction extraction = processor.extract("[Source 1]", List.of());

        assertTrue(extraction.fallback());
        assertThat(extraction.citations()).isEmpty();
        assertThat(processor.extract("[Source 1]", null).citations()).isEmpty();
    }

    @Test
    @DisplayName("Citations render as numbered source labels")
    void citation_asString() {
        assertEquals("[Source 2] faq.md (chunk 4)", citation(2, "faq.md").asString());
        assertThrows(IllegalArgumentException.class, () -> citation(0, "faq.md"));
    }

    private static Citation citation(final int id, final String filename) {
        return new Citation(id, "doc-" + id, id + 2, filename, EFileType.fromFilename(filename).orElseThrow(),
                "text " + id, 0.5, false);
    }
}
