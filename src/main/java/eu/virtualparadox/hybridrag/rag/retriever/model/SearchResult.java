package eu.virtualparadox.hybridrag.rag.retriever.model;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;

/**
 * @param chunkId  Identifier of the chunk inside the document.
 * @param docId    Identifier of the parent document.
 * @param text     The chunk text.
 * @param filename Filename of the parent document.
 * @param fileType Format of the parent document.
 * @param score    Ranker-specific score (cosine similarity for semantic, BM25 for keyword; higher = better).
 * @param source   Ranker that produced the result.
 */
public record SearchResult(int chunkId,
                           String docId,
                           String text,
                           String filename,
                           EFileType fileType,
                           double score,
                           ESearchSource source) {

    public ChunkKey key() {
        return new ChunkKey(docId, chunkId);
    }

    public SearchResult withSource(final ESearchSource newSource) {
        return new SearchResult(chunkId, docId, text, filename, fileType, score, newSource);
    }
}
