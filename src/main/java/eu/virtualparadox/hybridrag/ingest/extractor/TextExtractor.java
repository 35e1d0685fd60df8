package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;

import java.io.IOException;
import java.nio.file.Path;

public interface TextExtractor {

    /**
     * Extracts the plain text of a document.
     *
     * @param path     file to read
     * @param fileType format of the file
     * @return extracted text, never blank
     * @throws IOException           if the file cannot be read
     * @throws IllegalStateException if the document contains no extractable text
     */
    String extractText(final Path path, final EFileType fileType) throws IOException;

}
