/**
 * {@code policy_validation} fixtures: declarative expectations about the
 * report a registry should produce.
 */
package com.policysentinel.core.fixture;
