package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;

import java.io.IOException;
import java.util.List;

/**
 * A single ranker: returns at most {@code k} results for a query, best first.
 */
@FunctionalInterface
public interface RetrieverService {

    List<SearchResult> search(final String query, final int k) throws IOException;

}
