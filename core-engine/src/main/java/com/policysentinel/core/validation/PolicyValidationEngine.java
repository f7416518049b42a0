package com.policysentinel.core.validation;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.config.PackLoadResult;
import com.policysentinel.core.config.PolicyPackLoader;
import com.policysentinel.core.config.RegistryLoadResult;
import com.policysentinel.core.config.RegistryLoader;
import com.policysentinel.core.config.ValidationOptions;
import com.policysentinel.core.model.PolicyEntry;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for validating a downmix policy registry.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Load the registry. A fatal load issue ends the run with that single
 * issue.</li>
 * <li>Load every referenced policy pack, relative to the registry's
 * directory. A broken pack is reported and only its dependent checks are
 * skipped.</li>
 * <li>Plan and run the structural, reference, matrix and composition
 * stages.</li>
 * <li>Sort and de-duplicate the collected issues.</li>
 * </ol>
 *
 * <h3>Parallelism</h3>
 * <p>
 * With {@link ValidationOptions#isParallel()} pack loads and stage tasks run
 * on a fixed pool of daemon threads created per run. The report is identical
 * to a sequential run because ordering happens once, after every task has
 * finished.
 * </p>
 *
 * <p>
 * The engine holds no per-run state and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyValidationEngine.class);

    private final Catalog catalog;
    private final ValidationOptions options;
    private final List<ValidationStage> stages;

    public PolicyValidationEngine(Catalog catalog) {
        this(catalog, ValidationOptions.defaults());
    }

    public PolicyValidationEngine(Catalog catalog, ValidationOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.stages = List.of(
                new StructuralValidator(),
                new ReferenceValidator(),
                new MatrixValidator(new CoefficientSanityChecker(options)),
                new CompositionPathValidator());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Validate a registry and return only the report.
     *
     * @param registryFile path to the registry document
     * @return ordered report
     */
    public ValidationReport validate(Path registryFile) {
        return run(registryFile).getReport();
    }

    /**
     * Validate a registry, keeping the loaded documents alongside the report.
     *
     * @param registryFile path to the registry document
     * @return the run outcome
     */
    public ValidationRun run(Path registryFile) {
        Objects.requireNonNull(registryFile, "registryFile must not be null");
        IssueCollector issues = new IssueCollector();

        RegistryLoadResult loaded = RegistryLoader.load(registryFile);
        if (!loaded.isLoaded()) {
            loaded.getFatalIssue().ifPresent(issues::add);
            return new ValidationRun(issues.toReport(), null, Map.of());
        }
        Registry registry = loaded.getRegistry().orElseThrow();

        ExecutorService executor = options.isParallel() ? newWorkerPool(options.getParallelism()) : null;
        try {
            Map<String, PolicyPack> packs = new TreeMap<>();
            Set<String> unavailable = new TreeSet<>();
            for (PackLoadResult result : loadPacks(registry, executor)) {
                issues.addAll(result.getIssues());
                if (result.getPack().isPresent()) {
                    packs.put(result.getPolicyKey(), result.getPack().get());
                } else {
                    unavailable.add(result.getPolicyKey());
                }
            }

            ValidationContext context = new ValidationContext(catalog, options, registry, packs, unavailable);
            List<ValidationTask> tasks = new ArrayList<>();
            for (ValidationStage stage : stages) {
                List<ValidationTask> planned = stage.plan(context);
                LOG.debug("Stage '{}' planned {} task(s)", stage.getName(), planned.size());
                tasks.addAll(planned);
            }
            execute(tasks, issues, executor);

            ValidationReport report = issues.toReport();
            LOG.info("Validated {}: {} error(s), {} warning(s)",
                    registry.getFile(), report.getErrorCount(), report.getWarnCount());
            return new ValidationRun(report, registry, packs);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public ValidationOptions getOptions() {
        return options;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<PackLoadResult> loadPacks(Registry registry, ExecutorService executor) {
        Path baseDirectory = registry.getBaseDirectory();
        List<PackLoadResult> results = new ArrayList<>();
        List<Callable<PackLoadResult>> loads = new ArrayList<>();
        for (PolicyEntry entry : registry.getPolicies().values()) {
            Optional<Path> file;
            try {
                file = entry.resolveFile(baseDirectory);
            } catch (InvalidPathException e) {
                results.add(PolicyPackLoader.unresolvable(entry.getPolicyKey(), e.getInput(), e.getReason()));
                continue;
            }
            file.ifPresent(f -> loads.add(() -> PolicyPackLoader.load(entry.getPolicyKey(), f)));
        }
        if (executor == null) {
            for (Callable<PackLoadResult> load : loads) {
                results.add(call(load));
            }
            return results;
        }
        results.addAll(await(submitAll(executor, loads)));
        return results;
    }

    private static void execute(List<ValidationTask> tasks, IssueCollector issues, ExecutorService executor) {
        if (executor == null) {
            tasks.forEach(task -> task.run(issues));
            return;
        }
        List<Callable<Void>> calls = new ArrayList<>(tasks.size());
        for (ValidationTask task : tasks) {
            calls.add(() -> {
                task.run(issues);
                return null;
            });
        }
        await(submitAll(executor, calls));
    }

    private static <T> List<Future<T>> submitAll(ExecutorService executor, List<Callable<T>> calls) {
        List<Future<T>> futures = new ArrayList<>(calls.size());
        for (Callable<T> call : calls) {
            futures.add(executor.submit(call));
        }
        return futures;
    }

    /**
     * Collect results in submission order.
     */
    private static <T> List<T> await(List<Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Validation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Validation task failed", e.getCause());
        }
        return results;
    }

    private static <T> T call(Callable<T> callable) {
        try {
            return callable.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Validation task failed", e);
        }
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "policy-sentinel-worker-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(size, factory);
    }
}
