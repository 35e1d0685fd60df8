package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.query.citation.Citation;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns fused search results into the numbered source list of the prompt.
 * <p>
 * Results are taken in order until the next one would exceed the token budget; tokens are
 * estimated as {@code text.length() / 4}. The budget covers chunk texts only, not markers
 * or separators.
 */
@Component
public class ContextBuilder {

    static final String SEPARATOR = "\n\n";

    private final int maxContextTokens;

    public ContextBuilder(@Value("${answer.max-context-tokens:3000}") final int maxContextTokens) {
        if (maxContextTokens <= 0) {
            throw new IllegalArgumentException("maxContextTokens must be positive");
        }
        this.maxContextTokens = maxContextTokens;
    }

    public AnswerContext build(final List<FusedResult> results) {
        final List<String> parts = new ArrayList<>();
        final List<Citation> citations = new ArrayList<>();
        int usedTokens = 0;

        for (final FusedResult result : results) {
            final String text = result.text() == null ? "" : result.text();
            final int estimated = text.length() / 4;
            if (usedTokens + estimated > maxContextTokens) {
                break;
            }

            final int id = citations.size() + 1;
            parts.add("[Source " + id + "] " + text);
            citations.add(new Citation(id, result.docId(), result.chunkId(), result.filename(),
                    result.fileType(), text, result.score(), false));
            usedTokens += estimated;
        }

        return new AnswerContext(String.join(SEPARATOR, parts), citations);
    }
}
