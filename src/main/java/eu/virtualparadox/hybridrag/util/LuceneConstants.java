package eu.virtualparadox.hybridrag.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_FILE_TYPE = "fileType";

    private LuceneConstants() {
        // prevent instantiation
    }
}
