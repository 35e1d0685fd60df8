package eu.virtualparadox.hybridrag.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class TextCleaner {

    /**
     * Page annotations written by the PDF extractor, e.g. {@code [Page 12]}.
     */
    private static final Pattern PAGE_MARKER = Pattern.compile("\\[Page \\d+\\]\\s*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Cleans extracted text before sentence splitting:
     * <ul>
     *   <li>line breaks, tabs, zero-width and non-breaking spaces become a plain space,</li>
     *   <li>soft hyphens and other control characters are removed,</li>
     *   <li>{@code [Page N]} markers are stripped,</li>
     *   <li>typographic quotes are normalised to ASCII quotes,</li>
     *   <li>whitespace runs collapse to a single space and the result is trimmed.</li>
     * </ul>
     * Diacritics are kept.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, empty for {@code null} or blank input
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        final String normalized = input
                // line breaks and tabs -> space
                .replaceAll("[\\r\\n\\t\\f\\u000B]+", " ")
                // zero-width and similar -> SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> SPACE
                .replace("\u00A0", " ")
                // soft hyphen (0xAD) -> remove
                .replace("\u00AD", "")
                // other format chars -> SPACE
                .replaceAll("\\p{Cf}", " ")
                // control chars -> remove
                .replaceAll("\\p{Cc}", "");

        final String collapsed = WHITESPACE.matcher(normalized).replaceAll(" ");
        final String withoutMarkers = PAGE_MARKER.matcher(collapsed).replaceAll("");

        return withoutMarkers
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .trim();
    }
}
