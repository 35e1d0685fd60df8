package eu.virtualparadox.hybridrag.ingest.chunker;

import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;
import eu.virtualparadox.hybridrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sentence-aware, token-bounded {@code TextChunker} that produces overlapping chunks for the
 * keyword and vector indexes.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Cleaning:</strong> the input goes through {@link TextCleaner} first (whitespace
 *       collapse, {@code [Page N]} marker removal, quote normalisation).</li>
 *   <li><strong>Sentence splitting:</strong> a sentence ends at a run of {@code .}, {@code !} or
 *       {@code ?} followed by whitespace or the end of the text. The terminator is consumed by
 *       the split and does not appear in chunk text; fragments without content are dropped.</li>
 *   <li><strong>Packing:</strong> sentences are added greedily while the running token count
 *       stays within {@code maxTokens}.</li>
 *   <li><strong>Overlap:</strong> when a chunk is closed, the next one is seeded with the longest
 *       tail of whole words of the closed chunk that fits in {@code overlapTokens}. The seed is
 *       skipped when overlap plus the next sentence would already exceed {@code maxTokens}.</li>
 *   <li><strong>Long sentences:</strong> a sentence longer than {@code maxTokens} is emitted whole
 *       in a chunk of its own; sentences are never cut.</li>
 * </ul>
 *
 * <h2>Sentence provenance</h2>
 * Every chunk records the sentence range it covers. The start of a chunk that begins with an
 * overlap is mapped back to the most recent previous sentence sharing at least one word with the
 * overlap text. The mapping is word-set based and can over-count when a word of the overlap also
 * occurs in earlier sentences; citation ranges rely on it as is.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction; the same input and parameters always give the same chunks.
 */
@Slf4j
@Component
public class TextChunker {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?:\\s+|$)");

    private final TextCleaner textCleaner;
    private final TokenCounter tokenCounter;

    /**
     * Default token cap used by {@link #chunkDocument(DocumentRecord, String)}.
     */
    private final int maxTokens;

    /**
     * Default overlap budget used by {@link #chunkDocument(DocumentRecord, String)}.
     */
    private final int overlapTokens;

    /**
     * Constructs a {@code TextChunker}.
     *
     * @param textCleaner   cleaner applied before sentence splitting
     * @param tokenCounter  shared token counter
     * @param maxTokens     default soft cap on tokens per chunk (must be {@code > 0})
     * @param overlapTokens default overlap budget (must be {@code >= 0} and {@code < maxTokens})
     * @throws IllegalArgumentException if constraints are violated
     */
    public TextChunker(final TextCleaner textCleaner,
                       final TokenCounter tokenCounter,
                       @Value("${chunker.max-tokens:1000}") final int maxTokens,
                       @Value("${chunker.overlap-tokens:200}") final int overlapTokens) {
        validateLimits(maxTokens, overlapTokens);
        this.textCleaner = Objects.requireNonNull(textCleaner, "textCleaner must not be null");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
        this.maxTokens = maxTokens;
        this.overlapTokens = overlapTokens;
    }

    /**
     * Chunks the text of a document with the configured limits and attaches the document metadata.
     *
     * @param document parent document
     * @param text     extracted document text (may be blank)
     * @return chunks numbered from 0, empty for blank text
     */
    public List<Chunk> chunkDocument(final DocumentRecord document, final String text) {
        Objects.requireNonNull(document, "document must not be null");

        final List<ChunkSegment> segments = chunk(text, maxTokens, overlapTokens);
        final List<Chunk> chunks = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            final ChunkSegment s = segments.get(i);
            chunks.add(new Chunk(i, document.id(), s.text(), s.tokenCount(), s.charCount(),
                    s.startSentence(), s.endSentence(), document.filename(), document.fileType()));
        }

        if (!chunks.isEmpty()) {
            final int totalTokens = chunks.stream().mapToInt(Chunk::tokenCount).sum();
            log.info("Split document {} into {} chunks (avg {} tokens per chunk)",
                    document.id(), chunks.size(), totalTokens / chunks.size());
        }
        return chunks;
    }

    /**
     * Splits {@code text} into overlapping, sentence-aligned segments.
     *
     * @param text          input text, may be {@code null} or blank
     * @param maxTokens     soft cap on tokens per segment
     * @param overlapTokens overlap budget carried into the next segment
     * @return ordered segments; empty for {@code null} or blank input
     * @throws IllegalArgumentException if the limits are invalid
     */
    public List<ChunkSegment> chunk(final String text, final int maxTokens, final int overlapTokens) {
        validateLimits(maxTokens, overlapTokens);

        final List<ChunkSegment> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }

        final List<Sentence> sentences = splitSentences(textCleaner.cleanText(text));
        if (sentences.isEmpty()) {
            return result;
        }

        String current = "";
        int currentTokens = 0;
        int startSentence = 0;

        for (final Sentence sentence : sentences) {
            final int i = sentence.index;

            if (currentTokens + sentence.tokens > maxTokens && !current.isEmpty()) {
                result.add(segment(current, currentTokens, startSentence, i - 1));

                String overlap = overlapText(current, overlapTokens);
                String seed = overlap.isEmpty() ? sentence.text : overlap + " " + sentence.text;
                int seedTokens = tokenCounter.count(seed);
                if (!overlap.isEmpty() && seedTokens > maxTokens) {
                    // overlap would push a normal sentence over the cap
                    overlap = "";
                    seed = sentence.text;
                    seedTokens = sentence.tokens;
                }

                current = seed;
                currentTokens = seedTokens;
                startSentence = Math.max(0, i - overlapSentenceCount(overlap, sentences.subList(0, i)));
            } else {
                current = current.isEmpty() ? sentence.text : current + " " + sentence.text;
                currentTokens += sentence.tokens;
            }
        }

        if (!current.isBlank()) {
            result.add(segment(current, currentTokens, startSentence, sentences.size() - 1));
        }
        return result;
    }

    private static void validateLimits(final int maxTokens, final int overlapTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException("overlapTokens must be non-negative and less than maxTokens");
        }
    }

    private static ChunkSegment segment(final String text, final int tokens, final int start, final int end) {
        final String trimmed = text.trim();
        return new ChunkSegment(trimmed, tokens, trimmed.length(), start, end);
    }

    /**
     * Splits cleaned text into sentences at runs of terminal punctuation followed by whitespace
     * or end of text. The punctuation itself is dropped.
     *
     * @param text cleaned source text
     * @return sentences in order, numbered from 0
     */
    private List<Sentence> splitSentences(final String text) {
        final List<Sentence> sentences = new ArrayList<>();
        for (final String body : SENTENCE_END.split(text)) {
            addSentence(sentences, body);
        }
        return sentences;
    }

    private void addSentence(final List<Sentence> sentences, final String body) {
        final String sentence = body.trim();
        if (sentence.isEmpty()) {
            return;
        }
        sentences.add(new Sentence(sentences.size(), sentence, tokenCounter.count(sentence)));
    }

    /**
     * Returns the longest tail of whole words of {@code text} whose token count is within
     * {@code budget}.
     *
     * @param text   closed chunk text
     * @param budget overlap token budget
     * @return overlap text, or {@code ""} if no word fits or {@code budget <= 0}
     */
    private String overlapText(final String text, final int budget) {
        if (budget <= 0) {
            return "";
        }

        final String[] words = text.trim().split("\\s+");
        String overlap = "";
        for (int i = words.length - 1; i >= 0; i--) {
            final String candidate = String.join(" ", Arrays.asList(words).subList(i, words.length));
            if (tokenCounter.count(candidate) <= budget) {
                overlap = candidate;
            } else {
                break;
            }
        }
        return overlap;
    }

    /**
     * Counts how many previous sentences the overlap reaches back: scanning backwards, the first
     * sentence whose lower-cased word set intersects the overlap's word set determines the count.
     *
     * @param overlap           overlap text
     * @param previousSentences sentences before the one that triggered the split
     * @return number of sentences covered by the overlap, {@code 0} if none
     */
    private static int overlapSentenceCount(final String overlap, final List<Sentence> previousSentences) {
        if (overlap.isEmpty() || previousSentences.isEmpty()) {
            return 0;
        }

        final Set<String> overlapWords = words(overlap);
        for (int i = previousSentences.size() - 1; i >= 0; i--) {
            final Set<String> sentenceWords = words(previousSentences.get(i).text);
            sentenceWords.retainAll(overlapWords);
            if (!sentenceWords.isEmpty()) {
                return previousSentences.size() - i;
            }
        }
        return 0;
    }

    private static Set<String> words(final String text) {
        return new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).trim().split("\\s+")));
    }
}
