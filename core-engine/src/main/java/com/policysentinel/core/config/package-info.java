/**
 * Document loading and run configuration.
 *
 * <p>
 * {@link com.policysentinel.core.config.RegistryLoader} and
 * {@link com.policysentinel.core.config.PolicyPackLoader} turn registry and
 * pack files into model objects, reporting parse and top-level schema
 * failures as issues rather than exceptions.
 * {@link com.policysentinel.core.config.ValidationOptions} carries the
 * worker count and coefficient limits.
 * </p>
 *
 * @since 1.0.0
 */
package com.policysentinel.core.config;
