package eu.virtualparadox.hybridrag.rag.retriever.model;

/**
 * Identity of a chunk across rankers.
 *
 * @param docId   parent document identifier
 * @param chunkId chunk identifier inside the document
 */
public record ChunkKey(String docId, int chunkId) {

}
