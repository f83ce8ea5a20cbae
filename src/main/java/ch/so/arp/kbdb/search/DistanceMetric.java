package ch.so.arp.kbdb.search;

/**
 * Distance metrics supported by the embedding column. Every constant knows the
 * pgvector operator that implements it and an equivalent in-JVM function.
 * <p>
 * All metrics share one ordering convention: the operator value is sorted
 * ascending and the smallest value is the best match. pgvector's {@code <#>}
 * yields the <em>negative</em> inner product, so ascending order puts the
 * largest inner product first. {@link #score(double)} converts the operator
 * value back into the metric's natural value for display.
 */
public enum DistanceMetric {

    COSINE("<=>") {
        @Override
        public double distance(float[] a, float[] b) {
            double dot = 0.0d;
            double normA = 0.0d;
            double normB = 0.0d;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
                normA += (double) a[i] * a[i];
                normB += (double) b[i] * b[i];
            }
            if (normA == 0.0d || normB == 0.0d) {
                return 1.0d;
            }
            return 1.0d - dot / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    INNER_PRODUCT("<#>") {
        @Override
        public double distance(float[] a, float[] b) {
            double dot = 0.0d;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
            }
            return -dot;
        }

        @Override
        public double score(double distance) {
            return -distance;
        }
    },

    L2("<->") {
        @Override
        public double distance(float[] a, float[] b) {
            double sum = 0.0d;
            for (int i = 0; i < a.length; i++) {
                double diff = (double) a[i] - b[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    };

    private final String operator;

    DistanceMetric(String operator) {
        this.operator = operator;
    }

    /**
     * The pgvector operator implementing this metric.
     */
    public String operator() {
        return operator;
    }

    /**
     * Computes the same value as {@link #operator()} would in PostgreSQL. Lower
     * is always better.
     *
     * @param a first vector
     * @param b second vector, of the same length
     * @return the ordering key of {@code b} relative to {@code a}
     */
    public abstract double distance(float[] a, float[] b);

    /**
     * Maps an ordering key produced by {@link #distance(float[], float[])} or the
     * SQL operator to the value reported to callers.
     */
    public double score(double distance) {
        return distance;
    }
}
