package com.policysentinel.core.validation;

import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.PolicyEntry;
import com.policysentinel.core.model.PolicyId;
import com.policysentinel.core.model.RuleId;

import java.util.List;

/**
 * Shape checks on the registry's {@code policies} entries ({@code DMX.REG.010}).
 *
 * <p>
 * Every key must be a {@code POLICY.DOWNMIX.*} ID and every entry a mapping
 * with a {@code file}. The top-level sections themselves are checked by the
 * registry loader; pack structure by the pack loader.
 * </p>
 *
 * @since 1.0.0
 */
public final class StructuralValidator implements ValidationStage {

    @Override
    public List<ValidationTask> plan(ValidationContext context) {
        return List.of(issues -> context.getRegistry().getPolicies().values()
                .forEach(entry -> checkEntry(context, entry, issues)));
    }

    private void checkEntry(ValidationContext context, PolicyEntry entry, IssueCollector issues) {
        String key = entry.getPolicyKey();
        if (PolicyId.parse(key).isEmpty()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_010)
                    .message("Policy ID must start with " + PolicyId.PREFIX + ": " + key)
                    .evidence(context.registryEvidence().location(entry.getLocation()).policyId(key).build())
                    .build());
        }
        if (!entry.isMapping()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_010)
                    .message("Policy entry must be a mapping: " + key)
                    .evidence(context.registryEvidence().location(entry.getLocation()).policyId(key).build())
                    .build());
        } else if (entry.getFile().isEmpty()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_010)
                    .message("Policy entry missing 'file': " + key)
                    .evidence(context.registryEvidence()
                            .location(entry.getLocation() + "." + PolicyEntry.FIELD_FILE)
                            .policyId(key)
                            .build())
                    .build());
        }
    }

    @Override
    public String getName() {
        return "structural";
    }
}
