package eu.virtualparadox.hybridrag.rag.retriever.model;

/**
 * Ranker that produced a search result.
 */
public enum ESearchSource {
    SEMANTIC,
    KEYWORD,
    /**
     * Returned by both rankers and merged during fusion.
     */
    FUSED
}
