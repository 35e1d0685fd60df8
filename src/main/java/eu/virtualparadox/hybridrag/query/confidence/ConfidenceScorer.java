package eu.virtualparadox.hybridrag.query.confidence;

import eu.virtualparadox.hybridrag.rag.retriever.model.FusedResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic confidence of a generated answer.
 * <p>
 * The score is the mean of four factors in {@code [0, 1]}:
 * <ul>
 *   <li><b>sources</b>: {@code min(results / 3, 1)}</li>
 *   <li><b>quality</b>: average retrieval score of the results, capped at 1 ({@code 0} without results)</li>
 *   <li><b>completeness</b>: {@code min(answerLength / 200, 1)}</li>
 *   <li><b>citations</b>: {@code min([Source N] markers / 2, 1)}</li>
 * </ul>
 * minus {@value #UNCERTAINTY_PENALTY} for every distinct hedging phrase found in the answer
 * (case-insensitive), clamped to {@code [0, 1]}.
 * <p>
 * Invalid input (missing answer or results, non-finite scores) yields
 * {@link ConfidenceScore#fallback()} instead of an exception.
 */
@Slf4j
@Component
public class ConfidenceScorer {

    static final double UNCERTAINTY_PENALTY = 0.2;

    static final List<String> UNCERTAINTY_PHRASES = List.of(
            "i don't know",
            "i'm not sure",
            "unclear",
            "might be",
            "possibly",
            "perhaps",
            "could be",
            "not enough information");

    private static final Pattern SOURCE_MARKER = Pattern.compile("\\[Source \\d+]");

    public ConfidenceScore score(final String question, final String answer, final List<FusedResult> results) {
        if (answer == null || results == null) {
            log.warn("Confidence scoring skipped: answer or results missing");
            return ConfidenceScore.fallback();
        }

        try {
            final double sources = Math.min(results.size() / 3.0, 1.0);

            double quality = 0.0;
            if (!results.isEmpty()) {
                double sum = 0.0;
                for (final FusedResult r : results) {
                    if (!Double.isFinite(r.score())) {
                        log.warn("Confidence scoring skipped: non-finite result score {}", r.score());
                        return ConfidenceScore.fallback();
                    }
                    sum += r.score();
                }
                quality = clamp(sum / results.size());
            }

            final double completeness = Math.min(answer.length() / 200.0, 1.0);
            final double citations = Math.min(countMarkers(answer) / 2.0, 1.0);

            final double base = (sources + quality + completeness + citations) / 4.0;
            final double value = clamp(base - UNCERTAINTY_PENALTY * countUncertaintyPhrases(answer));

            log.debug("Confidence {} (sources={}, quality={}, completeness={}, citations={})",
                    value, sources, quality, completeness, citations);
            return ConfidenceScore.of(value);
        } catch (final RuntimeException e) {
            log.warn("Confidence scoring failed for question: {}", question, e);
            return ConfidenceScore.fallback();
        }
    }

    private static int countMarkers(final String answer) {
        final Matcher matcher = SOURCE_MARKER.matcher(answer);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int countUncertaintyPhrases(final String answer) {
        final String lower = answer.toLowerCase(Locale.ROOT);
        return (int) UNCERTAINTY_PHRASES.stream().filter(lower::contains).count();
    }

    private static double clamp(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
