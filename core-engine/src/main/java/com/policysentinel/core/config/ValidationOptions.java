package com.policysentinel.core.config;

import java.util.Map;

/**
 * Typed, immutable settings for a validation run.
 *
 * <p>
 * The coefficient limits default to the documented rule thresholds:
 * hard limit {@value #DEFAULT_HARD_LIMIT}, soft limit
 * {@value #DEFAULT_SOFT_LIMIT}, per-channel sum warning
 * {@value #DEFAULT_SUM_WARN_LIMIT} and per-channel sum error
 * {@value #DEFAULT_SUM_ERROR_LIMIT}. All comparisons are strict
 * ({@code value > limit}).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()}, {@link #fromEnvironment()}, or the {@link Builder};
 * the builder validates ranges at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationOptions {

    /** Environment variable holding the worker thread count. */
    public static final String ENV_PARALLELISM = "POLICY_SENTINEL_PARALLELISM";

    public static final double DEFAULT_HARD_LIMIT = 4.0;
    public static final double DEFAULT_SOFT_LIMIT = 2.0;
    public static final double DEFAULT_SUM_WARN_LIMIT = 2.5;
    public static final double DEFAULT_SUM_ERROR_LIMIT = 4.0;

    private static final ValidationOptions DEFAULTS = new Builder().build();

    private final int parallelism;
    private final double hardLimit;
    private final double softLimit;
    private final double sumWarnLimit;
    private final double sumErrorLimit;

    private ValidationOptions(Builder b) {
        this.parallelism = b.parallelism;
        this.hardLimit = b.hardLimit;
        this.softLimit = b.softLimit;
        this.sumWarnLimit = b.sumWarnLimit;
        this.sumErrorLimit = b.sumErrorLimit;
    }

    /**
     * @return sequential run with the documented limits
     */
    public static ValidationOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Build options from environment variables, falling back to defaults.
     *
     * @return validated options
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ValidationOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @param env environment variables to read
     * @return validated options
     * @see #fromEnvironment()
     */
    public static ValidationOptions fromEnvironment(Map<String, String> env) {
        String raw = env.get(ENV_PARALLELISM);
        if (raw == null || raw.isBlank()) {
            return DEFAULTS;
        }
        try {
            return new Builder().parallelism(Integer.parseInt(raw.trim())).build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable " + ENV_PARALLELISM + ": " + raw, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isParallel() {
        return parallelism > 1;
    }

    public double getHardLimit() {
        return hardLimit;
    }

    public double getSoftLimit() {
        return softLimit;
    }

    public double getSumWarnLimit() {
        return sumWarnLimit;
    }

    public double getSumErrorLimit() {
        return sumErrorLimit;
    }

    /**
     * Fluent builder for {@link ValidationOptions}.
     */
    public static class Builder {
        private int parallelism = 1;
        private double hardLimit = DEFAULT_HARD_LIMIT;
        private double softLimit = DEFAULT_SOFT_LIMIT;
        private double sumWarnLimit = DEFAULT_SUM_WARN_LIMIT;
        private double sumErrorLimit = DEFAULT_SUM_ERROR_LIMIT;

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder hardLimit(double v) {
            this.hardLimit = v;
            return this;
        }

        public Builder softLimit(double v) {
            this.softLimit = v;
            return this;
        }

        public Builder sumWarnLimit(double v) {
            this.sumWarnLimit = v;
            return this;
        }

        public Builder sumErrorLimit(double v) {
            this.sumErrorLimit = v;
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated options
         * @throws IllegalArgumentException if any value is invalid
         */
        public ValidationOptions build() {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (!(softLimit > 0) || !(softLimit <= hardLimit) || !Double.isFinite(hardLimit)) {
                throw new IllegalArgumentException(
                        "coefficient limits must satisfy 0 < soft <= hard, got soft=" + softLimit
                                + ", hard=" + hardLimit);
            }
            if (!(sumWarnLimit > 0) || !(sumWarnLimit <= sumErrorLimit) || !Double.isFinite(sumErrorLimit)) {
                throw new IllegalArgumentException(
                        "sum limits must satisfy 0 < warn <= error, got warn=" + sumWarnLimit
                                + ", error=" + sumErrorLimit);
            }
            return new ValidationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ValidationOptions{" +
                "parallelism=" + parallelism +
                ", hardLimit=" + hardLimit +
                ", softLimit=" + softLimit +
                ", sumWarnLimit=" + sumWarnLimit +
                ", sumErrorLimit=" + sumErrorLimit +
                '}';
    }
}
