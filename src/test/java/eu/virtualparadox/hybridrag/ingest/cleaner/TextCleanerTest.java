package eu.virtualparadox.hybridrag.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover newline handling, control chars, non-breaking spaces, zero-width spaces,
 * soft hyphens, page markers, typographic quotes and whitespace normalization.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        String input = "Refunds are issued within 30 days.";
        assertThat(cleaner.cleanText(input)).isEqualTo("Refunds are issued within 30 days.");
    }

    @Test
    void testNullAndEmptyBecomeEmpty() {
        assertThat(cleaner.cleanText(null)).isEmpty();
        assertThat(cleaner.cleanText("")).isEmpty();
        assertThat(cleaner.cleanText(" \n\t ")).isEmpty();
    }

    @Test
    void testLineBreaksAreReplacedWithSpaces() {
        assertThat(cleaner.cleanText("annual\nleave")).isEqualTo("annual leave");
        assertThat(cleaner.cleanText("line1\r\n\r\nline2")).isEqualTo("line1 line2");
    }

    @Test
    void testControlCharactersAreRemoved() {
        String input = "valid\u0007text"; // includes BEL control char
        assertThat(cleaner.cleanText(input)).isEqualTo("validtext");
    }

    @Test
    void testZeroWidthAndNonBreakingSpacesBecomeSpaces() {
        assertThat(cleaner.cleanText("word1\u200Bword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Cword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Dword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\uFEFFword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testSoftHyphenIsRemoved() {
        assertThat(cleaner.cleanText("reim\u00ADbursement")).isEqualTo("reimbursement");
    }

    @Test
    void testOtherFormatCharactersBecomeSpaces() {
        // U+202C POP DIRECTIONAL FORMATTING is a common PDF artifact
        assertThat(cleaner.cleanText("word1\u202Cword2")).isEqualTo("word1 word2");
    }

    @Test
    void testPageMarkersAreStripped() {
        String input = "[Page 1]\nFirst page ends here.\n\n[Page 12]\nSecond page.";
        assertThat(cleaner.cleanText(input)).isEqualTo("First page ends here. Second page.");
    }

    @Test
    void testTypographicQuotesAreNormalized() {
        String input = "\u201CQuoted\u201D and \u2018single\u2019 text";
        assertThat(cleaner.cleanText(input)).isEqualTo("\"Quoted\" and 'single' text");
    }

    @Test
    void testMultipleSpacesAreCollapsedAndTrimmed() {
        assertThat(cleaner.cleanText("   word1    word2   word3   ")).isEqualTo("word1 word2 word3");
    }

    @Test
    void testCombinedScenario() {
        String input = "line1\u00A0line2\nline3\u200Bline4   line5\u0008line6\u00ADend";
        // NBSP, newline and zero-width become spaces, control char and soft hyphen are removed
        assertThat(cleaner.cleanText(input)).isEqualTo("line1 line2 line3 line4 line5line6end");
    }
}
