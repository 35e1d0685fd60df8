package eu.virtualparadox.hybridrag.query.citation;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;

/**
 * A numbered source offered to the answer generator as {@code [Source id]}.
 *
 * @param id                1-based position in the context
 * @param docId             parent document identifier
 * @param chunkId           chunk identifier inside the document
 * @param filename          filename of the parent document
 * @param fileType          format of the parent document
 * @param text              chunk text
 * @param score             retrieval score of the chunk
 * @param mentionedInAnswer whether the generated answer cites this source
 */
public record Citation(int id,
                       String docId,
                       int chunkId,
                       String filename,
                       EFileType fileType,
                       String text,
                       double score,
                       boolean mentionedInAnswer) {

    public Citation {
        if (id < 1) {
            throw new IllegalArgumentException("id must be >= 1");
        }
    }

    public Citation markMentioned() {
        return mentionedInAnswer ? this
                : new Citation(id, docId, chunkId, filename, fileType, text, score, true);
    }

    public String asString() {
        return "[Source " + id + "] " + filename + " (chunk " + chunkId + ")";
    }
}
