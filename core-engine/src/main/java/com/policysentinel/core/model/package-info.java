/**
 * Domain model of the downmix policy validator.
 *
 * <p>
 * Documents ({@link com.policysentinel.core.model.Registry},
 * {@link com.policysentinel.core.model.PolicyPack} and the nodes below them)
 * are tolerant views over parsed YAML/JSON. Findings are
 * {@link com.policysentinel.core.model.Issue} values tagged with an
 * {@link com.policysentinel.core.model.IssueId}, a
 * {@link com.policysentinel.core.model.RuleId} and a
 * {@link com.policysentinel.core.model.Severity}.
 * </p>
 *
 * @since 1.0.0
 */
package com.policysentinel.core.model;
