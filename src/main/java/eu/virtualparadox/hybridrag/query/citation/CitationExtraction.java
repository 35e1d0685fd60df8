package eu.virtualparadox.hybridrag.query.citation;

import java.util.List;

/**
 * @param citations citations to show with the answer
 * @param fallback  {@code true} if the answer cited no valid source and all available citations
 *                  are returned unmarked
 */
public record CitationExtraction(List<Citation> citations, boolean fallback) {

    public CitationExtraction {
        citations = List.copyOf(citations);
    }
}
