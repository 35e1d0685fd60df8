package eu.virtualparadox.hybridrag.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Creates ONNX Runtime session options for the embedding model.
     *
     * @param intraOpThreads intra-op thread count; {@code <= 0} uses all cores but one
     * @return configured session options
     * @throws IllegalStateException if ONNX Runtime rejects the options
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraOpThreads) {
        final int threads = intraOpThreads > 0
                ? intraOpThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setIntraOpNumThreads(threads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            log.debug("ONNX Runtime session options: intra-op threads={}", threads);
            return opts;
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
