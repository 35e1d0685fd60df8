package eu.virtualparadox.hybridrag.catalog.model;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import lombok.Builder;

import java.time.Instant;

/**
 * Catalog entry of an ingested document. The extracted text is kept by the
 * {@link eu.virtualparadox.hybridrag.catalog.service.DocumentStore}, not here.
 *
 * @param id         document identifier (32 hex chars)
 * @param filename   original filename
 * @param fileType   document format
 * @param sizeBytes  file size on disk
 * @param hash       MD5 of the file bytes, used for duplicate detection
 * @param wordCount  whitespace-separated words of the extracted text
 * @param charCount  characters of the extracted text
 * @param uploadedAt registration time
 */
@Builder
public record DocumentRecord(String id,
                             String filename,
                             EFileType fileType,
                             long sizeBytes,
                             String hash,
                             int wordCount,
                             int charCount,
                             Instant uploadedAt) {

}
