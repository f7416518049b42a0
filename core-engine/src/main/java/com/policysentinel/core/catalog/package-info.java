/**
 * Reference catalog of known layouts and speakers.
 *
 * <p>
 * {@link com.policysentinel.core.catalog.CatalogLoader} reads the catalog
 * from YAML into an immutable {@link com.policysentinel.core.catalog.Catalog}.
 * Typed {@link com.policysentinel.core.catalog.LayoutId} and
 * {@link com.policysentinel.core.catalog.SpeakerId} handles can only be
 * obtained through catalog lookups.
 * </p>
 *
 * @since 1.0.0
 */
package com.policysentinel.core.catalog;
