package eu.virtualparadox.hybridrag.rag.index;

/**
 * Outcome of indexing one document.
 *
 * @param docId         document identifier
 * @param chunkCount    number of chunks written to the keyword index
 * @param vectorIndexed {@code false} when embedding failed and the document is searchable by keyword only
 */
public record IndexingSummary(String docId, int chunkCount, boolean vectorIndexed) {

}
