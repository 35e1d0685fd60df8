package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.ingest.model.Chunk;
import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import eu.virtualparadox.hybridrag.rag.retriever.model.ESearchSource;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.hybridrag.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Chunk text, metadata and dense vectors live in a single Lucene index:
 * <ul>
 *   <li>Each chunk is stored as one Lucene {@link Document}</li>
 *   <li>Text and metadata are stored for answer synthesis and citations</li>
 *   <li>Vectors are written via {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code docId}: {@link StringField}, stored: document identifier for filtering/deletion</li>
 *   <li>{@code chunkId}: {@link StoredField} (int): chunk number inside the document</li>
 *   <li>{@code filename}: {@link StoredField}: original filename</li>
 *   <li>{@code fileType}: {@link StringField}, stored: {@link EFileType} name, filterable</li>
 *   <li>{@code text}: {@link StoredField}: full chunk text</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField}: dense float vector (HNSW indexed)</li>
 * </ul>
 *
 * <p><b>Scores:</b> Lucene maps cosine similarity to {@code (1 + cos) / 2}. Hits are converted back,
 * so returned scores and the {@code minScore} threshold are plain cosine values in {@code [-1, 1]}.</p>
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index.
 * This implementation validates incoming vectors are consistent. If the embedding model changes
 * dimension, reindex into a fresh index directory.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen vector dimension of this index instance.
     */
    private Integer vectorDim;

    /**
     * Adds or replaces all chunks for a given document.
     * <ol>
     *   <li>Delete any existing chunks for the {@code docId}</li>
     *   <li>Insert the provided {@code chunks}+{@code vectors} pairs</li>
     *   <li>Commit and refresh the searcher for near-real-time visibility</li>
     * </ol>
     *
     * @param docId   parent document identifier
     * @param chunks  chunks of the document (size must match {@code vectors})
     * @param vectors dense vectors, one per chunk (all same dimension)
     * @throws IOException              if writing to the Lucene index fails
     * @throws IllegalArgumentException if input lists are null, empty, or size/dimension mismatch
     */
    @Override
    public void upsert(final String docId,
                       final List<Chunk> chunks,
                       final List<float[]> vectors) throws IOException {

        requireNonNullOrEmpty(docId, "docId");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        for (int i = 0; i < chunks.size(); i++) {
            final Chunk c = chunks.get(i);
            if (!docId.equals(c.docId())) {
                throw new IllegalArgumentException("Chunk " + c.chunkId() + " belongs to " + c.docId() + ", not " + docId);
            }
            writer.addDocument(buildLuceneDocument(c, vectors.get(i)));
        }

        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Upserted {} vectors for document {}", chunks.size(), docId);
    }

    /**
     * Deletes all chunks associated with the given {@code docId}.
     *
     * @param docId parent document identifier
     * @throws IOException if index update fails
     */
    @Override
    public void deleteByDocId(final String docId) throws IOException {
        requireNonNullOrEmpty(docId, "docId");
        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    /**
     * Runs an HNSW k-NN search, optionally pre-filtered by document id and/or file type.
     *
     * @param vector   query vector
     * @param k        maximum number of results
     * @param minScore minimum cosine similarity
     * @param filter   metadata restriction, {@code null} for none
     * @return semantic results, best first
     * @throws IOException if the searcher cannot be acquired or executed
     */
    @Override
    public List<SearchResult> query(final float[] vector,
                                    final int k,
                                    final double minScore,
                                    final VectorQueryFilter filter) throws IOException {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
        if (k <= 0) {
            return List.of();
        }

        final Query filterQuery = toFilterQuery(filter);
        final KnnFloatVectorQuery knn = filterQuery == null
                ? new KnnFloatVectorQuery(FIELD_VECTOR, vector, k)
                : new KnnFloatVectorQuery(FIELD_VECTOR, vector, k, filterQuery);

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(knn, k);
            final StoredFields storedFields = searcher.storedFields();

            final List<SearchResult> results = new ArrayList<>();
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final double cosine = toCosine(sd.score);
                if (cosine < minScore) {
                    continue;
                }
                final Document doc = storedFields.document(sd.doc);
                results.add(new SearchResult(
                        doc.getField(FIELD_CHUNK_ID).numericValue().intValue(),
                        doc.get(FIELD_DOC_ID),
                        doc.get(FIELD_TEXT),
                        doc.get(FIELD_FILENAME),
                        EFileType.valueOf(doc.get(FIELD_FILE_TYPE)),
                        cosine,
                        ESearchSource.SEMANTIC));
            }
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Lucene reports COSINE hits as {@code (1 + cos) / 2}; this maps them back to the cosine.
     */
    static double toCosine(final float luceneScore) {
        return 2.0 * luceneScore - 1.0;
    }

    private static Query toFilterQuery(final VectorQueryFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        if (filter.docId() != null) {
            builder.add(new TermQuery(new Term(FIELD_DOC_ID, filter.docId())), BooleanClause.Occur.FILTER);
        }
        if (filter.fileType() != null) {
            builder.add(new TermQuery(new Term(FIELD_FILE_TYPE, filter.fileType().name())), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws IllegalArgumentException if a different dimension has already been established
     */
    private synchronized void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    /**
     * Builds a Lucene {@link Document} for a single chunk+vector pair.
     *
     * @param c   chunk payload
     * @param vec dense float vector
     * @return a fully populated Lucene document
     */
    private Document buildLuceneDocument(final Chunk c, final float[] vec) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_DOC_ID, c.docId(), Field.Store.YES));
        d.add(new StoredField(FIELD_CHUNK_ID, c.chunkId()));

        // Metadata
        d.add(new StoredField(FIELD_FILENAME, c.filename()));
        d.add(new StringField(FIELD_FILE_TYPE, c.fileType().name(), Field.Store.YES));

        // Text content (stored only, keyword search is served by the BM25 index)
        d.add(new StoredField(FIELD_TEXT, c.text()));

        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));
        return d;
    }

    /**
     * Utility to assert a required string or collection is non-null/non-empty.
     *
     * @param value value to check
     * @param name  parameter name for error messaging
     */
    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
