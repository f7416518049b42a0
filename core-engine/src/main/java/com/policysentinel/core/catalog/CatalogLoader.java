package com.policysentinel.core.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the reference {@link Catalog} from {@value #LAYOUTS_FILE} and
 * {@value #SPEAKERS_FILE}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit directory passed to {@link #fromDirectory(Path)}</li>
 * <li>Environment variable {@value #ENV_CATALOG_DIR} (directory holding both
 * files), read by {@link #load(Map)}</li>
 * <li>The bundled catalog under {@value #CLASSPATH_PREFIX} on the classpath</li>
 * </ol>
 *
 * <p>
 * The catalog is trusted reference data, so loading <strong>fails fast</strong>:
 * a malformed catalog throws instead of producing issues.
 * </p>
 *
 * @since 1.0.0
 */
public final class CatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);

    /** Environment variable that can override the bundled catalog. */
    public static final String ENV_CATALOG_DIR = "POLICY_SENTINEL_CATALOG_DIR";

    public static final String LAYOUTS_FILE = "layouts.yaml";
    public static final String SPEAKERS_FILE = "speakers.yaml";
    public static final String CLASSPATH_PREFIX = "catalog/";

    private static final String META_KEY = "_meta";

    private CatalogLoader() {
        // utility class
    }

    /**
     * Load the catalog using automatic resolution.
     *
     * @return validated catalog
     * @throws IllegalStateException if the catalog is malformed
     */
    public static Catalog load() {
        return load(System.getenv());
    }

    /**
     * Load the catalog from {@value #ENV_CATALOG_DIR} in the given
     * environment, or the bundled copy when it is unset or not a directory.
     *
     * @param env environment variables to read
     * @return validated catalog
     * @throws IllegalStateException if the catalog is malformed
     */
    public static Catalog load(Map<String, String> env) {
        String envDir = env.get(ENV_CATALOG_DIR);
        if (envDir != null && !envDir.isBlank() && Files.isDirectory(Path.of(envDir))) {
            LOG.info("Loading catalog from environment path: {}", envDir);
            return fromDirectory(Path.of(envDir));
        }
        LOG.info("Loading bundled catalog from classpath: {}", CLASSPATH_PREFIX);
        return fromClasspath(CLASSPATH_PREFIX);
    }

    /**
     * Load the catalog from a directory containing {@value #LAYOUTS_FILE} and
     * {@value #SPEAKERS_FILE}.
     *
     * @param directory catalog directory; must not be {@code null}
     * @return validated catalog
     * @throws IllegalArgumentException if either file does not exist
     * @throws IllegalStateException    if reading fails or the catalog is malformed
     */
    public static Catalog fromDirectory(Path directory) {
        Objects.requireNonNull(directory, "Catalog directory must not be null");
        Path layouts = directory.resolve(LAYOUTS_FILE);
        Path speakers = directory.resolve(SPEAKERS_FILE);
        try (InputStream layoutStream = Files.newInputStream(layouts);
                InputStream speakerStream = Files.newInputStream(speakers)) {
            return parse(layoutStream, speakerStream, directory.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Catalog file not found: " + e.getFile(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog from: " + directory, e);
        }
    }

    /**
     * Load the catalog from classpath resources.
     *
     * @param prefix resource prefix ending in {@code /}, e.g. {@code catalog/}
     * @return validated catalog
     * @throws IllegalArgumentException if either resource does not exist
     * @throws IllegalStateException    if reading fails or the catalog is malformed
     */
    public static Catalog fromClasspath(String prefix) {
        Objects.requireNonNull(prefix, "Classpath prefix must not be null");
        ClassLoader loader = CatalogLoader.class.getClassLoader();
        try (InputStream layoutStream = open(loader, prefix + LAYOUTS_FILE);
                InputStream speakerStream = open(loader, prefix + SPEAKERS_FILE)) {
            return parse(layoutStream, speakerStream, "classpath:" + prefix);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath catalog: " + prefix, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static InputStream open(ClassLoader loader, String resource) throws FileNotFoundException {
        InputStream is = loader.getResourceAsStream(resource);
        if (is == null) {
            throw new FileNotFoundException("Classpath resource not found: " + resource);
        }
        return is;
    }

    private static Catalog parse(InputStream layoutStream, InputStream speakerStream, String origin) {
        Map<?, ?> layoutsSection = section(layoutStream, "layouts", origin);
        Map<?, ?> speakersSection = section(speakerStream, "speakers", origin);

        List<String> errors = new ArrayList<>();
        Catalog.Builder builder = Catalog.builder();

        for (Object key : speakersSection.keySet()) {
            if (!META_KEY.equals(key)) {
                builder.speaker(String.valueOf(key));
            }
        }

        for (Map.Entry<?, ?> entry : layoutsSection.entrySet()) {
            String layoutId = String.valueOf(entry.getKey());
            if (META_KEY.equals(layoutId)) {
                continue;
            }
            if (!(entry.getValue() instanceof Map<?, ?> layout)) {
                errors.add("Layout entry must be a mapping: " + layoutId);
                continue;
            }
            if (!(layout.get("channel_order") instanceof List<?> order)) {
                errors.add("Layout " + layoutId + " missing channel_order list");
                continue;
            }
            List<String> channels = new ArrayList<>();
            for (Object channel : order) {
                if (channel instanceof String s) {
                    channels.add(s);
                } else {
                    errors.add("Layout " + layoutId + " has non-string channel: " + channel);
                }
            }
            builder.layout(layoutId, channels);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Catalog validation failed (" + origin + "):\n  - "
                    + String.join("\n  - ", errors));
        }

        Catalog catalog = builder.build();
        LOG.info("Loaded catalog with {} layout(s) and {} speaker(s)",
                catalog.layoutIds().size(), catalog.speakerIds().size());
        return catalog;
    }

    private static Map<?, ?> section(InputStream is, String rootKey, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object document;
        try {
            document = new Yaml(new SafeConstructor(options)).load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Catalog YAML is not valid (" + origin + "): " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?> root) || !(root.get(rootKey) instanceof Map<?, ?> section)) {
            throw new IllegalStateException("Catalog missing '" + rootKey + "' mapping (" + origin + ")");
        }
        return section;
    }
}
