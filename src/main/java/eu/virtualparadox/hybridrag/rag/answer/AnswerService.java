package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.query.citation.CitationExtraction;
import eu.virtualparadox.hybridrag.query.citation.CitationProcessor;
import eu.virtualparadox.hybridrag.query.confidence.ConfidenceScore;
import eu.virtualparadox.hybridrag.query.confidence.ConfidenceScorer;
import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes a cited answer from fused search results.
 * <ol>
 *   <li>Build the numbered source context ({@link ContextBuilder})</li>
 *   <li>Ask the {@link CompletionService} with fixed instructions</li>
 *   <li>Score confidence, resolve {@code [Source N]} markers and suggest follow-up questions</li>
 * </ol>
 * Missing context and generation failures produce a user-facing message with confidence 0
 * instead of an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerService {

    static final String NO_RESULTS_MESSAGE =
            "I couldn't find relevant information in the uploaded documents to answer your question.";
    static final String NO_CONTEXT_MESSAGE =
            "I couldn't extract enough relevant information from the documents to answer your question.";
    static final String GENERATION_FAILED_MESSAGE =
            "I encountered an error while processing your question. Please try again.";

    static final String SYSTEM_PROMPT = String.join("\n",
            "You are a helpful AI assistant that answers questions based on provided document excerpts.",
            "",
            "Guidelines:",
            "1. Answer questions accurately based only on the provided sources",
            "2. Include specific citations in your answer using [Source X] format",
            "3. If the sources don't contain enough information, say so clearly",
            "4. Be concise but comprehensive",
            "5. Maintain a professional, helpful tone",
            "6. If asked about something not in the sources, politely explain the limitation",
            "",
            "Always cite your sources when making specific claims.");

    private final ContextBuilder contextBuilder;
    private final CompletionService completionService;
    private final ConfidenceScorer confidenceScorer;
    private final CitationProcessor citationProcessor;
    private final FollowUpQuestionGenerator followUpQuestionGenerator;

    /**
     * @param question user question
     * @param results  fused search results, best first
     * @return the answer, never {@code null}
     */
    public AnswerRecord answer(final String question, final List<FusedResult> results) {
        if (results == null || results.isEmpty()) {
            return AnswerRecord.withoutAnswer(NO_RESULTS_MESSAGE, EAnswerStatus.NO_CONTEXT);
        }

        final AnswerContext context = contextBuilder.build(results);
        if (context.isEmpty()) {
            return AnswerRecord.withoutAnswer(NO_CONTEXT_MESSAGE, EAnswerStatus.NO_CONTEXT);
        }

        final String generated;
        try {
            generated = completionService.complete(SYSTEM_PROMPT, userPrompt(question, context.context()));
        } catch (final RuntimeException e) {
            log.error("Answer generation failed for question: {}", question, e);
            return AnswerRecord.withoutAnswer(GENERATION_FAILED_MESSAGE, EAnswerStatus.GENERATION_FAILED);
        }

        if (generated == null || generated.isBlank()) {
            log.warn("Answer generation returned no text for question: {}", question);
            return AnswerRecord.withoutAnswer(GENERATION_FAILED_MESSAGE, EAnswerStatus.GENERATION_FAILED);
        }

        final ConfidenceScore confidence = confidenceScorer.score(question, generated, results);
        final CitationExtraction extraction = citationProcessor.extract(generated, context.citations());
        final List<String> followUps =
                followUpQuestionGenerator.generate(question, generated, extraction.citations());

        log.info("Generated answer with confidence {} from {} sources", confidence.value(), context.citations().size());
        return new AnswerRecord(generated, confidence.value(), extraction.citations(),
                context.citations().size(), EAnswerStatus.ANSWERED, followUps);
    }

    static String userPrompt(final String question, final String context) {
        return "Question: " + question + "\n\n"
                + "Sources:\n" + context + "\n\n"
                + "Please answer the question based on the provided sources. "
                + "Include citations using [Source X] format when referencing specific information.";
    }
}
