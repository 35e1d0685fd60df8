package eu.virtualparadox.hybridrag.ingest.chunker;

/**
 * A sentence of the cleaned source text together with its position and token count.
 */
final class Sentence {
    /**
     * 0-based position of the sentence in the document.
     */
    final int index;
    /**
     * Sentence text without its terminal punctuation.
     */
    final String text;
    /**
     * Token count of {@link #text}.
     */
    final int tokens;

    Sentence(final int index, final String text, final int tokens) {
        this.index = index;
        this.text = text;
        this.tokens = tokens;
    }
}
