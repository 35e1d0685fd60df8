package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordHit;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndex;
import eu.virtualparadox.hybridrag.rag.retriever.model.ESearchSource;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Lexical ranker backed by the in-memory BM25 {@link KeywordIndex}.
 */
@Service
@RequiredArgsConstructor
public final class KeywordRetrieverService implements RetrieverService {

    private final KeywordIndex keywordIndex;

    @Override
    public List<SearchResult> search(final String query, final int k) {
        return keywordIndex.search(query, k).stream()
                .map(KeywordRetrieverService::toSearchResult)
                .toList();
    }

    private static SearchResult toSearchResult(final KeywordHit hit) {
        final Chunk c = hit.chunk();
        return new SearchResult(c.chunkId(), c.docId(), c.text(), c.filename(), c.fileType(),
                hit.score(), ESearchSource.KEYWORD);
    }
}
