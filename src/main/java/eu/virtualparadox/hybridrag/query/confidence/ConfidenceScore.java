package eu.virtualparadox.hybridrag.query.confidence;

/**
 * @param value    confidence in {@code [0, 1]}
 * @param degraded {@code true} if scoring failed and {@link #DEGRADED_VALUE} was substituted
 */
public record ConfidenceScore(double value, boolean degraded) {

    public static final double DEGRADED_VALUE = 0.5;

    public ConfidenceScore {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + value);
        }
    }

    public static ConfidenceScore of(final double value) {
        return new ConfidenceScore(value, false);
    }

    public static ConfidenceScore fallback() {
        return new ConfidenceScore(DEGRADED_VALUE, true);
    }
}
