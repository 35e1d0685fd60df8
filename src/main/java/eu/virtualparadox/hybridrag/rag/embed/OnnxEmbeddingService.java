package eu.virtualparadox.hybridrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.hybridrag.application.config.ApplicationConfig;
import eu.virtualparadox.hybridrag.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embedder running a transformer encoder through ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under {@code <models>/retriever}.
 * Token vectors are mean-pooled over the attention mask and L2-normalised. When the model files are
 * missing the service starts anyway and every call fails with {@link IllegalStateException}, so
 * ingestion falls back to keyword-only indexing and retrieval to the keyword ranker.
 */
@Slf4j
@Service
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int batchSize;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config,
                                @Value("${embedding.batch-size:8}") final int batchSize,
                                @Value("${embedding.intra-op-threads:0}") final int intraOpThreads) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        final Path retrieverModelRoot = config.getModels().resolve("retriever");
        this.modelPath = retrieverModelRoot.resolve("model.onnx");
        this.tokenizerPath = retrieverModelRoot.resolve("tokenizer.json");
        this.batchSize = batchSize;
        this.intraOpThreads = intraOpThreads;
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        if (!Files.exists(modelPath) || !Files.exists(tokenizerPath)) {
            log.warn("Embedding model not found at {}; semantic search is disabled", modelPath.getParent());
            return;
        }

        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(intraOpThreads));
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            final int to = Math.min(texts.size(), from + batchSize);
            result.addAll(embedBatch(texts.subList(from, to)));
        }
        log.debug("Embedded {} texts", texts.size());
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    private List<float[]> embedBatch(final List<String> texts) {
        if (session == null) {
            throw new IllegalStateException("Embedding model is not loaded: " + modelPath);
        }

        final EncodedBatch batch = encode(texts);
        final Map<String, OnnxTensor> inputs = new HashMap<>();
        try {
            addInput(inputs, "input_ids", batch.inputIds());
            addInput(inputs, "attention_mask", batch.attentionMask());
            addInput(inputs, "token_type_ids", batch.typeIds());

            try (OrtSession.Result result = session.run(inputs)) {
                // last hidden state: [batch][tokens][hidden]
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                final List<float[]> vectors = new ArrayList<>(hidden.length);
                for (int row = 0; row < hidden.length; row++) {
                    vectors.add(meanPoolNormalized(hidden[row], batch.attentionMask()[row]));
                }
                return vectors;
            }
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to embed batch of " + texts.size() + " texts", e);
        } finally {
            inputs.values().forEach(OnnxTensor::close);
        }
    }

    /**
     * Tokenizes and right-pads a batch to its longest sequence, capped at {@value #MAX_LEN}.
     */
    private EncodedBatch encode(final List<String> texts) {
        final List<Encoding> encodings = texts.stream().map(tokenizer::encode).toList();
        final int width = Math.min(MAX_LEN, encodings.stream().mapToInt(e -> e.getIds().length).max().orElse(0));

        final long[][] ids = new long[encodings.size()][width];
        final long[][] mask = new long[encodings.size()][width];
        final long[][] types = new long[encodings.size()][width];
        for (int row = 0; row < encodings.size(); row++) {
            final Encoding e = encodings.get(row);
            final int len = Math.min(e.getIds().length, width);
            System.arraycopy(e.getIds(), 0, ids[row], 0, len);
            System.arraycopy(e.getAttentionMask(), 0, mask[row], 0, len);
            System.arraycopy(e.getTypeIds(), 0, types[row], 0, len);
        }
        return new EncodedBatch(ids, mask, types);
    }

    /**
     * Only inputs the model declares are passed; some encoders have no {@code token_type_ids}.
     */
    private void addInput(final Map<String, OnnxTensor> inputs, final String name, final long[][] values)
            throws OrtException {
        if (session.getInputNames().contains(name)) {
            inputs.put(name, OnnxTensor.createTensor(env, values));
        }
    }

    static float[] meanPoolNormalized(final float[][] tokenVectors, final long[] attentionMask) {
        final float[] pooled = new float[tokenVectors[0].length];
        int tokens = 0;
        for (int t = 0; t < tokenVectors.length && t < attentionMask.length; t++) {
            if (attentionMask[t] == 0) {
                continue;
            }
            for (int d = 0; d < pooled.length; d++) {
                pooled[d] += tokenVectors[t][d];
            }
            tokens++;
        }

        double sumSquares = 0.0;
        for (int d = 0; d < pooled.length; d++) {
            if (tokens > 0) {
                pooled[d] /= tokens;
            }
            sumSquares += pooled[d] * pooled[d];
        }
        final double norm = Math.sqrt(sumSquares);
        if (norm > 0.0) {
            for (int d = 0; d < pooled.length; d++) {
                pooled[d] /= (float) norm;
            }
        }
        return pooled;
    }

    private record EncodedBatch(long[][] inputIds, long[][] attentionMask, long[][] typeIds) {
    }
}
