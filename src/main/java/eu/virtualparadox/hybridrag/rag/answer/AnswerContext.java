package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.query.citation.Citation;

import java.util.List;

/**
 * @param context   {@code [Source i] text} blocks separated by blank lines
 * @param citations one citation per block, ids matching the markers
 */
public record AnswerContext(String context, List<Citation> citations) {

    public AnswerContext {
        citations = List.copyOf(citations);
    }

    public boolean isEmpty() {
        return context.isEmpty();
    }
}
