package com.policysentinel.core.fixture;

import com.policysentinel.core.config.DocumentParseException;
import com.policysentinel.core.config.DocumentReader;
import com.policysentinel.core.model.DocumentNode;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads {@link PolicyFixture}s.
 *
 * <h3>Format</h3>
 *
 * <pre>{@code
 * fixture_id: FIXTURE.POLICY.CLEAN
 * fixture_type: policy_validation
 * inputs:
 *   registry_file: registries/clean.yaml
 * expected:
 *   issue_counts: { error: 0, warn: 0 }
 *   must_include:
 *     - { issue_id: ISSUE.VALIDATION.POLICY_FILE_MISSING, severity: error, count_min: 1 }
 * }</pre>
 *
 * <p>
 * A malformed fixture is a broken test, not a validation finding, so every
 * problem is collected and thrown together as an
 * {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyFixtureLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyFixtureLoader.class);

    public static final String FIXTURE_TYPE = "policy_validation";

    private PolicyFixtureLoader() {
        // utility class
    }

    /**
     * @param fixtureFile fixture document; must not be {@code null}
     * @return parsed fixture
     * @throws IllegalArgumentException if the fixture cannot be parsed or is
     *                                  malformed
     */
    public static PolicyFixture load(Path fixtureFile) {
        Objects.requireNonNull(fixtureFile, "fixtureFile must not be null");
        Path file = fixtureFile.toAbsolutePath().normalize();
        Object root;
        try {
            root = DocumentReader.read(file);
        } catch (DocumentParseException e) {
            throw new IllegalArgumentException("Fixture could not be parsed: " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("Fixture root must be a mapping: " + file);
        }
        Map<String, Object> fields = DocumentNode.copyOf(rawMap);
        List<String> errors = new ArrayList<>();

        String fixtureId = string(fields.get("fixture_id")).orElse(null);
        if (fixtureId == null) {
            errors.add("fixture_id is required");
        }
        Object type = fields.get("fixture_type");
        if (!FIXTURE_TYPE.equals(type)) {
            errors.add("fixture_type must be '" + FIXTURE_TYPE + "', got: " + type);
        }

        Path registryFile = null;
        Optional<String> registry = mapping(fields.get("inputs"))
                .flatMap(inputs -> string(inputs.get("registry_file")));
        if (registry.isEmpty()) {
            errors.add("inputs.registry_file is required");
        } else {
            registryFile = file.getParent().resolve(registry.get()).normalize();
        }

        Map<String, Object> expected = mapping(fields.get("expected")).orElse(Map.of());
        Map<String, Object> counts = mapping(expected.get("issue_counts")).orElse(Map.of());
        Long errorsExpected = count(counts, "error", "expected.issue_counts.error", errors);
        Long warnsExpected = count(counts, "warn", "expected.issue_counts.warn", errors);
        List<PolicyFixture.ExpectedIssue> mustInclude = mustInclude(expected.get("must_include"), errors);

        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Fixture validation failed: " + file + "\n  - "
                    + String.join("\n  - ", errors));
        }
        LOG.debug("Loaded fixture {} from {}", fixtureId, file);
        return new PolicyFixture(fixtureId, file, registryFile, errorsExpected, warnsExpected, mustInclude);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<PolicyFixture.ExpectedIssue> mustInclude(Object raw, List<String> errors) {
        List<PolicyFixture.ExpectedIssue> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        if (!(raw instanceof List<?> entries)) {
            errors.add("expected.must_include must be a list");
            return result;
        }
        for (int i = 0; i < entries.size(); i++) {
            String where = "expected.must_include[" + i + "]";
            Optional<Map<String, Object>> entry = mapping(entries.get(i));
            if (entry.isEmpty()) {
                errors.add(where + " must be a mapping");
                continue;
            }
            Optional<IssueId> issueId = string(entry.get().get("issue_id")).flatMap(IssueId::fromCode);
            Optional<Severity> severity = string(entry.get().get("severity")).flatMap(Severity::fromCode);
            Object countMin = entry.get().getOrDefault("count_min", 1);
            if (issueId.isEmpty()) {
                errors.add(where + ".issue_id is not a known issue: " + entry.get().get("issue_id"));
            }
            if (severity.isEmpty()) {
                errors.add(where + ".severity must be 'error' or 'warn': " + entry.get().get("severity"));
            }
            if (!(countMin instanceof Integer || countMin instanceof Long) || ((Number) countMin).longValue() < 1) {
                errors.add(where + ".count_min must be a positive integer: " + countMin);
                continue;
            }
            if (issueId.isPresent() && severity.isPresent()) {
                result.add(new PolicyFixture.ExpectedIssue(issueId.get(), severity.get(),
                        ((Number) countMin).longValue()));
            }
        }
        return result;
    }

    private static Long count(Map<String, Object> counts, String key, String where, List<String> errors) {
        Object value = counts.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer || value instanceof Long) || ((Number) value).longValue() < 0) {
            errors.add(where + " must be a non-negative integer: " + value);
            return null;
        }
        return ((Number) value).longValue();
    }

    private static Optional<String> string(Object value) {
        return value instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    private static Optional<Map<String, Object>> mapping(Object value) {
        return value instanceof Map<?, ?> m ? Optional.of(DocumentNode.copyOf(m)) : Optional.empty();
    }
}
