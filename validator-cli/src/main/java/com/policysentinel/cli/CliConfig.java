package com.policysentinel.cli;

import com.policysentinel.core.catalog.CatalogLoader;
import com.policysentinel.core.config.ValidationOptions;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration for one CLI invocation.
 *
 * <p>
 * Command-line arguments win over environment variables:
 * </p>
 *
 * <pre>
 *   policy-sentinel [--catalog DIR] [--parallelism N] REGISTRY
 *   policy-sentinel [--catalog DIR] [--parallelism N] --fixture FILE
 * </pre>
 *
 * <table>
 * <caption>Environment</caption>
 * <tr><td>{@value #ENV_REGISTRY}</td><td>registry path when no positional argument is given</td></tr>
 * <tr><td>{@value CatalogLoader#ENV_CATALOG_DIR}</td><td>catalog directory when {@code --catalog} is not given</td></tr>
 * <tr><td>{@value ValidationOptions#ENV_PARALLELISM}</td><td>worker threads</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class CliConfig {

    public static final String ENV_REGISTRY = "POLICY_SENTINEL_REGISTRY";

    static final String OPT_FIXTURE = "--fixture";
    static final String OPT_CATALOG = "--catalog";
    static final String OPT_PARALLELISM = "--parallelism";

    static final String USAGE = "Usage: policy-sentinel [--catalog DIR] [--parallelism N] (REGISTRY | --fixture FILE)";

    private final String registryPath;
    private final String fixturePath;
    private final String catalogDir;
    private final int parallelism;

    private CliConfig(Builder b) {
        this.registryPath = b.registryPath;
        this.fixturePath = b.fixturePath;
        this.catalogDir = b.catalogDir;
        this.parallelism = b.parallelism;
    }

    /**
     * Resolve configuration from arguments and the process environment.
     *
     * @throws IllegalArgumentException on unknown options or missing values
     */
    public static CliConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv());
    }

    static CliConfig fromArgs(String[] args, Map<String, String> env) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(env, "env must not be null");
        Builder builder = new Builder().registryPath(env(env, ENV_REGISTRY));
        String parallelism = null;

        String positional = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case OPT_FIXTURE -> builder.fixturePath(value(args, ++i, arg));
                case OPT_CATALOG -> builder.catalogDir(value(args, ++i, arg));
                case OPT_PARALLELISM -> parallelism = value(args, ++i, arg);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (positional != null) {
                        throw new IllegalArgumentException("Only one registry may be given, got: "
                                + positional + " and " + arg);
                    }
                    positional = arg;
                }
            }
        }
        if (positional != null) {
            builder.registryPath(positional);
        }
        if (parallelism != null) {
            try {
                builder.parallelism(Integer.parseInt(parallelism.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("parallelism must be an integer, got: " + parallelism, e);
            }
        } else {
            try {
                builder.parallelism(ValidationOptions.fromEnvironment(env).getParallelism());
            } catch (IllegalStateException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Optional<String> getRegistryPath() {
        return Optional.ofNullable(registryPath);
    }

    public Optional<String> getFixturePath() {
        return Optional.ofNullable(fixturePath);
    }

    public Optional<String> getCatalogDir() {
        return Optional.ofNullable(catalogDir);
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isFixtureMode() {
        return fixturePath != null;
    }

    public ValidationOptions toValidationOptions() {
        return ValidationOptions.builder().parallelism(parallelism).build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CliConfig}. {@link #build()} requires either a
     * registry or a fixture and a parallelism of at least 1.
     */
    public static class Builder {
        private String registryPath;
        private String fixturePath;
        private String catalogDir;
        private int parallelism = 1;

        public Builder registryPath(String v) {
            this.registryPath = blankToNull(v);
            return this;
        }

        public Builder fixturePath(String v) {
            this.fixturePath = blankToNull(v);
            return this;
        }

        public Builder catalogDir(String v) {
            this.catalogDir = blankToNull(v);
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public CliConfig build() {
            if (registryPath == null && fixturePath == null) {
                throw new IllegalArgumentException("A registry path or " + OPT_FIXTURE + " is required");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new CliConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static String env(Map<String, String> env, String name) {
        return blankToNull(env.get(name));
    }

    private static String blankToNull(String value) {
        return (value != null && !value.isBlank()) ? value : null;
    }

    @Override
    public String toString() {
        return "CliConfig{" +
                "registryPath='" + registryPath + '\'' +
                ", fixturePath='" + fixturePath + '\'' +
                ", catalogDir='" + catalogDir + '\'' +
                ", parallelism=" + parallelism +
                '}';
    }
}
