package com.policysentinel.core.resolve;

import com.policysentinel.core.model.CompositionPath;
import com.policysentinel.core.model.CompositionStep;
import com.policysentinel.core.model.Conversion;
import com.policysentinel.core.model.Registry;
import com.policysentinel.core.validation.ValidationRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Answers "which matrix (or chain of matrices) folds layout A down to layout
 * B" for a registry that has already passed validation.
 *
 * <h3>Selection</h3>
 * <ol>
 * <li>The effective policy is the requested one, else the default for the
 * source layout.</li>
 * <li>Direct conversions for the layout pair are filtered by the effective
 * policy (when there is one) and the first by policy ID then matrix ID
 * wins. A conversion without {@code policy_id} belongs to the default
 * policy of its source layout.</li>
 * <li>Otherwise composition paths for the pair are considered, ordered by
 * their sorted step matrix IDs.</li>
 * </ol>
 *
 * <p>
 * Failures throw {@link IllegalArgumentException} with a message that lists
 * the known source layouts in sorted order, so it is stable across runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class DownmixResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DownmixResolver.class);

    private static final Comparator<DirectCandidate> DIRECT_ORDER = Comparator
            .comparing((DirectCandidate c) -> c.policyId == null ? "" : c.policyId)
            .thenComparing(c -> c.matrixId);

    private final Registry registry;

    public DownmixResolver(Registry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Build a resolver from a run whose report holds no errors.
     *
     * @param run a completed validation run
     * @return resolver over the run's registry
     * @throws IllegalStateException if the registry failed to load or the
     *                               report has errors
     */
    public static DownmixResolver from(ValidationRun run) {
        Objects.requireNonNull(run, "run must not be null");
        if (!run.getReport().isPassing()) {
            throw new IllegalStateException("Cannot resolve against a registry with "
                    + run.getReport().getErrorCount() + " validation error(s)");
        }
        Registry registry = run.getRegistry()
                .orElseThrow(() -> new IllegalStateException("Registry was not loaded"));
        return new DownmixResolver(registry);
    }

    /**
     * @return policy IDs in sorted order
     */
    public List<String> listPolicyIds() {
        return List.copyOf(registry.getPolicies().keySet());
    }

    public Optional<String> defaultPolicyForSource(String sourceLayoutId) {
        return registry.defaultPolicyFor(sourceLayoutId);
    }

    /**
     * Resolve a fold-down route.
     *
     * @param policyId       requested policy, or {@code null} for the source
     *                       layout's default
     * @param sourceLayoutId layout to fold down from
     * @param targetLayoutId layout to fold down to
     * @return the chosen route
     * @throws IllegalArgumentException if no conversion or composition path
     *                                  matches
     */
    public Resolution resolve(String policyId, String sourceLayoutId, String targetLayoutId) {
        Objects.requireNonNull(sourceLayoutId, "sourceLayoutId must not be null");
        Objects.requireNonNull(targetLayoutId, "targetLayoutId must not be null");
        String effectivePolicy = policyId != null ? policyId : registry.defaultPolicyFor(sourceLayoutId).orElse(null);

        List<DirectCandidate> direct = new ArrayList<>();
        for (Conversion conversion : registry.getConversions()) {
            if (!matches(conversion.getSourceLayoutId(), conversion.getTargetLayoutId(),
                    sourceLayoutId, targetLayoutId)) {
                continue;
            }
            Optional<String> matrixId = conversion.getMatrixId();
            if (matrixId.isEmpty()) {
                continue;
            }
            String conversionPolicy = conversion.getPolicyId()
                    .or(() -> registry.defaultPolicyFor(sourceLayoutId))
                    .orElse(null);
            if (effectivePolicy != null && !effectivePolicy.equals(conversionPolicy)) {
                continue;
            }
            direct.add(new DirectCandidate(conversionPolicy, matrixId.get()));
        }
        if (!direct.isEmpty()) {
            direct.sort(DIRECT_ORDER);
            DirectCandidate winner = direct.get(0);
            String chosenPolicy = winner.policyId != null ? winner.policyId : effectivePolicy;
            LOG.debug("Resolved {} -> {} directly via {} ({})", sourceLayoutId, targetLayoutId,
                    winner.matrixId, chosenPolicy);
            return Resolution.direct(sourceLayoutId, targetLayoutId, chosenPolicy, winner.matrixId);
        }

        Optional<CompositionPath> path = registry.getCompositionPaths().stream()
                .filter(p -> matches(p.getSourceLayoutId(), p.getTargetLayoutId(), sourceLayoutId, targetLayoutId))
                .min(Comparator.comparing(DownmixResolver::sortedStepKey));
        if (path.isPresent()) {
            List<String> steps = stepMatrixIds(path.get());
            LOG.debug("Resolved {} -> {} via composition {}", sourceLayoutId, targetLayoutId, steps);
            return Resolution.composed(sourceLayoutId, targetLayoutId, effectivePolicy, steps);
        }

        throw new IllegalArgumentException("No conversion found: " + sourceLayoutId + " -> " + targetLayoutId
                + ". Known source layouts: " + String.join(", ", knownSourceLayouts()));
    }

    private SortedSet<String> knownSourceLayouts() {
        SortedSet<String> sources = new TreeSet<>();
        registry.getConversions().forEach(c -> c.getSourceLayoutId().ifPresent(sources::add));
        registry.getCompositionPaths().forEach(p -> p.getSourceLayoutId().ifPresent(sources::add));
        return sources;
    }

    private static boolean matches(Optional<String> source, Optional<String> target,
            String wantedSource, String wantedTarget) {
        return source.filter(wantedSource::equals).isPresent()
                && target.filter(wantedTarget::equals).isPresent();
    }

    private static List<String> stepMatrixIds(CompositionPath path) {
        List<String> ids = new ArrayList<>();
        for (CompositionStep step : path.getSteps()) {
            ids.add(step.getMatrixId().orElse(""));
        }
        return ids;
    }

    private static String sortedStepKey(CompositionPath path) {
        List<String> ids = new ArrayList<>(stepMatrixIds(path));
        ids.sort(Comparator.naturalOrder());
        return String.join("\u0000", ids);
    }

    private static final class DirectCandidate {
        private final String policyId;
        private final String matrixId;

        private DirectCandidate(String policyId, String matrixId) {
            this.policyId = policyId;
            this.matrixId = matrixId;
        }
    }
}
