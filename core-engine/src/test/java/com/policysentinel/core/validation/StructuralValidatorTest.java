package com.policysentinel.core.validation;

import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.RuleId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.policysentinel.core.validation.TestRegistries.context;
import static com.policysentinel.core.validation.TestRegistries.map;
import static com.policysentinel.core.validation.TestRegistries.policy;
import static com.policysentinel.core.validation.TestRegistries.registry;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StructuralValidator}.
 */
class StructuralValidatorTest {

    private final StructuralValidator validator = new StructuralValidator();

    @Test
    @DisplayName("Should accept well-formed policy entries")
    void shouldAcceptValidEntries() {
        List<Issue> issues = validate(map("POLICY.DOWNMIX.STANDARD_V0", policy("packs/standard.yaml")));

        assertThat(issues).isEmpty();
    }

    @Test
    @DisplayName("Should reject policy keys without the downmix prefix")
    void shouldRejectBadPrefix() {
        List<Issue> issues = validate(map("LEGACY_FOLDOWN", policy("packs/legacy.yaml")));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_SCHEMA_INVALID);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_010);
            assertThat(issue.getEvidence().getLocation()).isEqualTo("policies.LEGACY_FOLDOWN");
            assertThat(issue.getEvidence().getPolicyId()).isEqualTo("LEGACY_FOLDOWN");
        });
    }

    @Test
    @DisplayName("Should reject a bare prefix as a policy key")
    void shouldRejectBarePrefix() {
        assertThat(validate(map("POLICY.DOWNMIX.", policy("packs/x.yaml"))))
                .extracting(Issue::getRuleId)
                .containsExactly(RuleId.REG_010);
    }

    @Test
    @DisplayName("Should reject entries that are not mappings")
    void shouldRejectNonMappingEntry() {
        List<Issue> issues = validate(map("POLICY.DOWNMIX.STANDARD_V0", "packs/standard.yaml"));

        assertThat(issues).singleElement()
                .satisfies(issue -> assertThat(issue.getMessage()).contains("must be a mapping"));
    }

    @Test
    @DisplayName("Should reject entries without a file")
    void shouldRejectMissingFile() {
        List<Issue> issues = validate(map("POLICY.DOWNMIX.STANDARD_V0", map("file", " ")));

        assertThat(issues).singleElement().satisfies(issue ->
                assertThat(issue.getEvidence().getLocation()).isEqualTo("policies.POLICY.DOWNMIX.STANDARD_V0.file"));
    }

    @Test
    @DisplayName("Should report every malformed entry")
    void shouldReportAllEntries() {
        List<Issue> issues = validate(map(
                "BAD_ONE", policy("a.yaml"),
                "POLICY.DOWNMIX.NO_FILE", map(),
                "POLICY.DOWNMIX.OK", policy("b.yaml")));

        assertThat(issues).extracting(i -> i.getEvidence().getPolicyId())
                .containsExactly("BAD_ONE", "POLICY.DOWNMIX.NO_FILE");
    }

    private List<Issue> validate(Map<String, Object> policies) {
        return TestRegistries.run(validator, context(registry(policies, Map.of(), List.of(), null)));
    }
}
