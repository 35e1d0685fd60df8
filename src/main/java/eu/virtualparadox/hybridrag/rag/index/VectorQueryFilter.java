package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;

/**
 * Optional restriction of a vector query. A {@code null} component matches everything.
 *
 * @param docId    restrict to one document
 * @param fileType restrict to one document format
 */
public record VectorQueryFilter(String docId, EFileType fileType) {

    private static final VectorQueryFilter NONE = new VectorQueryFilter(null, null);

    public static VectorQueryFilter none() {
        return NONE;
    }

    public static VectorQueryFilter forDocument(final String docId) {
        return new VectorQueryFilter(docId, null);
    }

    public static VectorQueryFilter forFileType(final EFileType fileType) {
        return new VectorQueryFilter(null, fileType);
    }

    public boolean isEmpty() {
        return docId == null && fileType == null;
    }
}
