package eu.virtualparadox.hybridrag.ingest.chunker;

/**
 * Document-independent output of {@link TextChunker#chunk(String, int, int)}.
 *
 * @param text          chunk text, overlap prefix included
 * @param tokenCount    running token count recorded while packing
 * @param charCount     {@code text.length()}
 * @param startSentence first sentence index covered
 * @param endSentence   last sentence index covered
 */
public record ChunkSegment(String text, int tokenCount, int charCount, int startSentence, int endSentence) {

}
