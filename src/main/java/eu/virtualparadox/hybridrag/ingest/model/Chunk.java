package eu.virtualparadox.hybridrag.ingest.model;

import java.util.Objects;

/**
 * Immutable representation of a text chunk produced by cleaning + chunking.
 * <p>Every chunk belongs to exactly one document. The {@code chunkId} is the 0-based position of
 * the chunk inside its document; {@code (docId, chunkId)} identifies a chunk across the indexes.</p>
 *
 * @param chunkId       0-based sequence number inside the document
 * @param docId         parent document identifier
 * @param text          chunk text (never blank)
 * @param tokenCount    token count recorded by the chunker
 * @param charCount     length of {@code text} in characters
 * @param startSentence index of the first sentence covered (overlap included)
 * @param endSentence   index of the last sentence covered
 * @param filename      original filename of the parent document
 * @param fileType      format of the parent document
 */
public record Chunk(int chunkId,
                    String docId,
                    String text,
                    int tokenCount,
                    int charCount,
                    int startSentence,
                    int endSentence,
                    String filename,
                    EFileType fileType) {

    public Chunk {
        if (chunkId < 0) {
            throw new IllegalArgumentException("chunkId must be non-negative");
        }
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
        if (tokenCount < 0 || charCount < 0) {
            throw new IllegalArgumentException("tokenCount and charCount must be non-negative");
        }
        if (startSentence < 0 || endSentence < startSentence) {
            throw new IllegalArgumentException(
                    "Invalid sentence range: " + startSentence + ".." + endSentence);
        }
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(fileType, "fileType must not be null");
    }
}
