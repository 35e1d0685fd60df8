package eu.virtualparadox.hybridrag.rag.retriever.model;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;

/**
 * A search result after Reciprocal Rank Fusion.
 *
 * @param result        payload (semantic result when available, keyword otherwise)
 * @param combinedScore weighted RRF score
 */
public record FusedResult(SearchResult result, double combinedScore) {

    public int chunkId() {
        return result.chunkId();
    }

    public String docId() {
        return result.docId();
    }

    public String text() {
        return result.text();
    }

    public String filename() {
        return result.filename();
    }

    public EFileType fileType() {
        return result.fileType();
    }

    /**
     * @return the original ranker score of the payload
     */
    public double score() {
        return result.score();
    }

    public ESearchSource source() {
        return result.source();
    }
}
