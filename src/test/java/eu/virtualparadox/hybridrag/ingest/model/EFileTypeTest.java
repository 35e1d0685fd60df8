package eu.virtualparadox.hybridrag.ingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EFileTypeTest {

    @Test
    @DisplayName("Extensions are resolved case-insensitively from the last dot")
    void resolvesSupportedExtensions() {
        assertThat(EFileType.fromFilename("handbook.pdf")).contains(EFileType.PDF);
        assertThat(EFileType.fromFilename("README.MD")).contains(EFileType.MD);
        assertThat(EFileType.fromFilename("notes.v2.txt")).contains(EFileType.TXT);
    }

    @Test
    @DisplayName("Missing or unsupported extensions resolve to empty")
    void rejectsUnsupportedExtensions() {
        assertThat(EFileType.fromFilename("report.docx")).isEmpty();
        assertThat(EFileType.fromFilename("Makefile")).isEmpty();
        assertThat(EFileType.fromFilename("trailing.")).isEmpty();
        assertThat(EFileType.fromFilename(null)).isEmpty();
    }
}
