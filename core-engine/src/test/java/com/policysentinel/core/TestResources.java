package com.policysentinel.core;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.catalog.CatalogLoader;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Locates test documents under {@code src/test/resources}.
 */
public final class TestResources {

    private static Catalog catalog;

    private TestResources() {
    }

    /**
     * @param resource classpath resource, e.g. {@code registries/clean/registry.yaml}
     * @return the resource as a file path
     */
    public static Path path(String resource) {
        URL url = TestResources.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalArgumentException("Test resource not found: " + resource);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad resource URL: " + url, e);
        }
    }

    /**
     * @return the bundled catalog, loaded once per test JVM
     */
    public static synchronized Catalog catalog() {
        if (catalog == null) {
            catalog = CatalogLoader.fromClasspath(CatalogLoader.CLASSPATH_PREFIX);
        }
        return catalog;
    }
}
