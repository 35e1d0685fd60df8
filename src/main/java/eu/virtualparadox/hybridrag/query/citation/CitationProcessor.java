package eu.virtualparadox.hybridrag.query.citation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code [Source N]} markers of a generated answer against the citations that were
 * offered in the context.
 * <ul>
 *   <li>Markers are deduplicated and returned by id ascending, marked as mentioned.</li>
 *   <li>Numbers outside {@code 1..citations.size()} are ignored.</li>
 *   <li>If no valid marker remains, every available citation is returned unmarked
 *       and the extraction is flagged as a fallback.</li>
 * </ul>
 */
@Slf4j
@Component
public class CitationProcessor {

    private static final Pattern SOURCE_MARKER = Pattern.compile("\\[Source (\\d+)]");

    public CitationExtraction extract(final String answer, final List<Citation> available) {
        final List<Citation> citations = available == null ? List.of() : available;
        if (answer == null || answer.isEmpty() || citations.isEmpty()) {
            return new CitationExtraction(citations, true);
        }

        try {
            final Set<Integer> mentioned = new TreeSet<>();
            final Matcher matcher = SOURCE_MARKER.matcher(answer);
            while (matcher.find()) {
                final int number = parseOrZero(matcher.group(1));
                if (number >= 1 && number <= citations.size()) {
                    mentioned.add(number);
                }
            }

            if (mentioned.isEmpty()) {
                return new CitationExtraction(citations, true);
            }

            final Map<Integer, Citation> byId = new HashMap<>();
            for (final Citation c : citations) {
                byId.putIfAbsent(c.id(), c);
            }
            final List<Citation> cited = mentioned.stream()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .map(Citation::markMentioned)
                    .toList();
            return cited.isEmpty()
                    ? new CitationExtraction(citations, true)
                    : new CitationExtraction(cited, false);
        } catch (final RuntimeException e) {
            log.warn("Citation extraction failed, returning all sources", e);
            return new CitationExtraction(citations, true);
        }
    }

    /**
     * Numbers too large for an int are out of range anyway.
     */
    private static int parseOrZero(final String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (final NumberFormatException e) {
            return 0;
        }
    }
}
