package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.query.citation.Citation;

import java.util.List;

/**
 * @param answer            answer text shown to the user
 * @param confidence        confidence in {@code [0, 1]}
 * @param citations         sources to display with the answer
 * @param contextUsed       number of sources placed in the prompt
 * @param status            outcome of the generation
 * @param followUpQuestions suggested next questions, at most three
 */
public record AnswerRecord(String answer,
                           double confidence,
                           List<Citation> citations,
                           int contextUsed,
                           EAnswerStatus status,
                           List<String> followUpQuestions) {

    public AnswerRecord {
        citations = List.copyOf(citations);
        followUpQuestions = List.copyOf(followUpQuestions);
    }

    static AnswerRecord withoutAnswer(final String message, final EAnswerStatus status) {
        return new AnswerRecord(message, 0.0, List.of(), 0, status, List.of());
    }
}
