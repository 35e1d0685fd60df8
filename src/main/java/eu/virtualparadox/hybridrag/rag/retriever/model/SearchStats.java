package eu.virtualparadox.hybridrag.rag.retriever.model;

/**
 * @param totalChunks    chunks in the keyword index
 * @param totalDocuments distinct documents in the keyword index
 * @param alpha          semantic weight used by fusion
 */
public record SearchStats(int totalChunks, int totalDocuments, double alpha) {

}
