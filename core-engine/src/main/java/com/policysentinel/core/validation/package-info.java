/**
 * Validation stages and the engine that runs them.
 *
 * <p>
 * {@link com.policysentinel.core.validation.PolicyValidationEngine} loads a
 * registry and its packs, asks each
 * {@link com.policysentinel.core.validation.ValidationStage} for independent
 * {@link com.policysentinel.core.validation.ValidationTask}s, and gathers the
 * resulting issues into an ordered
 * {@link com.policysentinel.core.validation.ValidationReport}.
 * </p>
 */
package com.policysentinel.core.validation;
