package eu.virtualparadox.hybridrag.rag.keyword;

import eu.virtualparadox.hybridrag.ingest.model.Chunk;

/**
 * @param docIndex position of the chunk in the keyword index (insertion order)
 * @param chunk    the matching chunk
 * @param score    BM25 score, always {@code > 0}
 */
public record KeywordHit(int docIndex, Chunk chunk, double score) {

}
