package com.policysentinel.cli;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.catalog.CatalogLoader;
import com.policysentinel.core.fixture.FixtureResult;
import com.policysentinel.core.fixture.PolicyFixtureRunner;
import com.policysentinel.core.validation.PolicyValidationEngine;
import com.policysentinel.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Main entry point for the policy registry validator.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   args / env → CliConfig
 *     → Catalog (directory or bundled)
 *     → PolicyValidationEngine (registry) or PolicyFixtureRunner (fixture)
 *     → JSON report on stdout
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_PASS}: no error issues (fixture: all expectations met)</li>
 * <li>{@value #EXIT_FAIL}: at least one error issue (fixture: a mismatch)</li>
 * <li>{@value #EXIT_USAGE}: bad arguments, catalog failure or malformed fixture</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PolicySentinelCli {

    private static final Logger LOG = LoggerFactory.getLogger(PolicySentinelCli.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_USAGE = 2;

    private PolicySentinelCli() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        CliConfig config;
        try {
            config = CliConfig.fromArgs(args, env);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliConfig.USAGE);
            return EXIT_USAGE;
        }
        LOG.debug("Starting with config: {}", config);

        Catalog catalog;
        try {
            catalog = loadCatalog(config, env);
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Catalog could not be loaded: " + e.getMessage());
            return EXIT_USAGE;
        }

        PolicyValidationEngine engine = new PolicyValidationEngine(catalog, config.toValidationOptions());
        ReportJsonWriter writer = new ReportJsonWriter();

        if (config.isFixtureMode()) {
            FixtureResult result;
            try {
                result = new PolicyFixtureRunner(engine).run(Path.of(config.getFixturePath().orElseThrow()));
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
            out.println(writer.write(result));
            return result.isPassed() ? EXIT_PASS : EXIT_FAIL;
        }

        ValidationReport report = engine.validate(Path.of(config.getRegistryPath().orElseThrow()));
        out.println(writer.write(report));
        return report.isPassing() ? EXIT_PASS : EXIT_FAIL;
    }

    private static Catalog loadCatalog(CliConfig config, Map<String, String> env) {
        if (config.getCatalogDir().isPresent()) {
            return CatalogLoader.fromDirectory(Path.of(config.getCatalogDir().get()));
        }
        return CatalogLoader.load(env);
    }
}
