package eu.virtualparadox.hybridrag.ingest.lifecycle;

import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;

/**
 * @param document      the registered document (the existing one for duplicates)
 * @param duplicate     {@code true} if identical content was already ingested and nothing was indexed
 * @param chunkCount    chunks indexed by this call, {@code 0} for duplicates and queued jobs
 * @param vectorIndexed whether vectors were written by this call
 */
public record IngestionResult(DocumentRecord document, boolean duplicate, int chunkCount, boolean vectorIndexed) {

    static IngestionResult duplicateOf(final DocumentRecord existing) {
        return new IngestionResult(existing, true, 0, false);
    }
}
