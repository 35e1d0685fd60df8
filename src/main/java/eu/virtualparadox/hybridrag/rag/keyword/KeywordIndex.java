package eu.virtualparadox.hybridrag.rag.keyword;

import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory BM25 keyword index over chunk texts.
 *
 * <h2>Scoring</h2>
 * Okapi BM25 with {@code k1 = 1.5} and {@code b = 0.75}:
 * <pre>
 *   idf(t)   = ln((N - df(t) + 0.5) / (df(t) + 0.5) + 1)
 *   score(d) = sum over query terms t of
 *              idf(t) * f(t,d) * (k1 + 1) / (f(t,d) + k1 * (1 - b + b * |d| / avgdl))
 * </pre>
 * Query terms are iterated with duplicates, so a repeated query word contributes twice.
 * Terms that do not occur in the index contribute nothing.
 *
 * <h2>Search results</h2>
 * {@link #search(String, int)} returns only chunks with a positive score. Unlike a plain BM25
 * ranking over the whole corpus, zero-score chunks are never padded into the list, so a keyword
 * ranking that matched nothing stays empty and cannot push unrelated chunks into the fusion.
 *
 * <h2>Tokenization</h2>
 * Lower-case ({@link Locale#ROOT}) followed by a whitespace split, identical for indexing and
 * querying. No stemming or stop-word removal.
 *
 * <h2>Maintenance</h2>
 * Postings and aggregate statistics (document count, total length, document frequencies) are
 * updated incrementally by {@link #add(Collection)} and {@link #remove(String)}.
 * {@link #fit(Collection)} is a full rebuild and yields the same scores as an equivalent sequence
 * of {@code add} calls.
 *
 * <h2>Thread-safety</h2>
 * Mutations take the write lock, searches take the read lock, so a search never observes a
 * half-applied update.
 */
@Slf4j
@Service
public class KeywordIndex {

    static final double K1 = 1.5;
    static final double B = 0.75;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Indexed chunks in insertion order; {@link IndexedChunk#position} mirrors the list index.
     */
    private final List<IndexedChunk> entries = new ArrayList<>();

    /**
     * term -> (indexed chunk -> term frequency).
     */
    private final Map<String, Map<IndexedChunk, Integer>> postings = new HashMap<>();

    private long totalLength;

    /**
     * Replaces the whole index content with {@code chunks}.
     *
     * @param chunks chunks to index, in order
     */
    public void fit(final Collection<Chunk> chunks) {
        lock.writeLock().lock();
        try {
            entries.clear();
            postings.clear();
            totalLength = 0;
            chunks.forEach(this::addInternal);
            log.info("Keyword index rebuilt with {} chunks", entries.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends {@code chunks} to the index.
     *
     * @param chunks chunks to index, in order
     */
    public void add(final Collection<Chunk> chunks) {
        lock.writeLock().lock();
        try {
            chunks.forEach(this::addInternal);
            log.debug("Keyword index now holds {} chunks", entries.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every chunk of a document.
     *
     * @param docId parent document identifier
     * @return number of removed chunks
     */
    public int remove(final String docId) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            final Iterator<IndexedChunk> it = entries.iterator();
            while (it.hasNext()) {
                final IndexedChunk entry = it.next();
                if (entry.chunk.docId().equals(docId)) {
                    it.remove();
                    unindex(entry);
                    removed++;
                }
            }
            if (removed > 0) {
                for (int i = 0; i < entries.size(); i++) {
                    entries.get(i).position = i;
                }
                log.info("Removed {} chunks of document {} from keyword index", removed, docId);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Computes the BM25 score of a single indexed chunk.
     *
     * @param query    raw query text
     * @param docIndex position of the chunk
     * @return BM25 score, {@code 0} if no query term matches
     * @throws IllegalArgumentException if {@code docIndex} is out of range
     */
    public double score(final String query, final int docIndex) {
        lock.readLock().lock();
        try {
            if (docIndex < 0 || docIndex >= entries.size()) {
                throw new IllegalArgumentException("docIndex out of range: " + docIndex);
            }
            final IndexedChunk entry = entries.get(docIndex);
            final double avgdl = averageLength();

            double score = 0.0;
            for (final String term : tokenize(query)) {
                final Map<IndexedChunk, Integer> posting = postings.get(term);
                if (posting == null) {
                    continue;
                }
                final Integer freq = posting.get(entry);
                if (freq != null) {
                    score += termScore(idf(posting.size()), freq, entry.length, avgdl);
                }
            }
            return score;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the best matching chunks.
     *
     * @param query raw query text
     * @param topK  maximum number of hits
     * @return hits with a positive score, by score descending then insertion order;
     * empty for a blank query, an empty index or {@code topK <= 0}
     */
    public List<KeywordHit> search(final String query, final int topK) {
        final List<String> terms = tokenize(query);
        if (terms.isEmpty() || topK <= 0) {
            return List.of();
        }

        lock.readLock().lock();
        try {
            if (entries.isEmpty()) {
                return List.of();
            }

            final double avgdl = averageLength();
            final double[] scores = new double[entries.size()];
            for (final String term : terms) {
                final Map<IndexedChunk, Integer> posting = postings.get(term);
                if (posting == null) {
                    continue;
                }
                final double idf = idf(posting.size());
                for (final Map.Entry<IndexedChunk, Integer> e : posting.entrySet()) {
                    final IndexedChunk entry = e.getKey();
                    scores[entry.position] += termScore(idf, e.getValue(), entry.length, avgdl);
                }
            }

            final List<KeywordHit> hits = new ArrayList<>();
            for (int i = 0; i < scores.length; i++) {
                if (scores[i] > 0.0) {
                    hits.add(new KeywordHit(i, entries.get(i).chunk, scores[i]));
                }
            }
            hits.sort(Comparator.comparingDouble(KeywordHit::score).reversed()
                    .thenComparingInt(KeywordHit::docIndex));

            return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of indexed chunks
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of distinct documents with at least one indexed chunk
     */
    public int documentCount() {
        lock.readLock().lock();
        try {
            final Set<String> docIds = new HashSet<>();
            for (final IndexedChunk entry : entries) {
                docIds.add(entry.chunk.docId());
            }
            return docIds.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static List<String> tokenize(final String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return List.of(text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }

    private void addInternal(final Chunk chunk) {
        final List<String> tokens = tokenize(chunk.text());
        final Map<String, Integer> frequencies = new HashMap<>();
        for (final String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }

        final IndexedChunk entry = new IndexedChunk(chunk, tokens.size(), frequencies, entries.size());
        entries.add(entry);
        totalLength += entry.length;
        for (final Map.Entry<String, Integer> e : frequencies.entrySet()) {
            postings.computeIfAbsent(e.getKey(), k -> new HashMap<>()).put(entry, e.getValue());
        }
    }

    private void unindex(final IndexedChunk entry) {
        totalLength -= entry.length;
        for (final String term : entry.frequencies.keySet()) {
            final Map<IndexedChunk, Integer> posting = postings.get(term);
            if (posting != null) {
                posting.remove(entry);
                if (posting.isEmpty()) {
                    postings.remove(term);
                }
            }
        }
    }

    private double averageLength() {
        return entries.isEmpty() ? 0.0 : (double) totalLength / entries.size();
    }

    private double idf(final int documentFrequency) {
        final int n = entries.size();
        return Math.log((n - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1.0);
    }

    private static double termScore(final double idf, final int freq, final int length, final double avgdl) {
        if (avgdl == 0.0) {
            return 0.0;
        }
        final double norm = freq + K1 * (1.0 - B + B * length / avgdl);
        return idf * freq * (K1 + 1.0) / norm;
    }

    /**
     * Index entry. Identity-based equality so that two equal chunks remain distinct postings.
     */
    private static final class IndexedChunk {
        private final Chunk chunk;
        private final int length;
        private final Map<String, Integer> frequencies;
        private int position;

        private IndexedChunk(final Chunk chunk,
                             final int length,
                             final Map<String, Integer> frequencies,
                             final int position) {
            this.chunk = chunk;
            this.length = length;
            this.frequencies = frequencies;
            this.position = position;
        }
    }
}
