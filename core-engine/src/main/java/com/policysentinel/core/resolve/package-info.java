/**
 * Conversion lookup over a validated registry.
 */
package com.policysentinel.core.resolve;
