package eu.virtualparadox.hybridrag.ingest.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Document formats accepted for ingestion.
 */
public enum EFileType {
    PDF("pdf"),
    MD("md"),
    TXT("txt");

    private final String extension;

    EFileType(final String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolves the file type from the extension of a filename (case-insensitive).
     *
     * @param filename filename, may be {@code null}
     * @return the matching type, or empty if the extension is missing or unsupported
     */
    public static Optional<EFileType> fromFilename(final String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        final int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }
        final String ext = filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
        for (final EFileType type : values()) {
            if (type.extension.equals(ext)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
