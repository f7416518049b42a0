package com.policysentinel.core.config;

import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.PolicyPack;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of loading one policy pack: the pack when it could be built, and
 * every issue raised while loading it. A pack with a mismatched
 * {@code policy_id} is still returned; a pack that is missing, unparseable or
 * lacks its {@code matrices} mapping is not. The file is absent when the
 * declared {@code file} could not be turned into a path.
 *
 * @since 1.0.0
 */
public final class PackLoadResult {

    private final String policyKey;
    private final Path file;
    private final PolicyPack pack;
    private final List<Issue> issues;

    PackLoadResult(String policyKey, Path file, PolicyPack pack, List<Issue> issues) {
        this.policyKey = Objects.requireNonNull(policyKey, "policyKey must not be null");
        this.file = file;
        this.pack = pack;
        this.issues = List.copyOf(issues);
    }

    public String getPolicyKey() {
        return policyKey;
    }

    public Optional<Path> getFile() {
        return Optional.ofNullable(file);
    }

    public Optional<PolicyPack> getPack() {
        return Optional.ofNullable(pack);
    }

    public List<Issue> getIssues() {
        return issues;
    }

    @Override
    public String toString() {
        return "PackLoadResult{" + policyKey + ", loaded=" + (pack != null) + ", issues=" + issues.size() + '}';
    }
}
