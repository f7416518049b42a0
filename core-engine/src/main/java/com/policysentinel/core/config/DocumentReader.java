package com.policysentinel.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses registry, pack and fixture documents into plain Java structures
 * ({@code Map}, {@code List}, {@code String}, {@code Number},
 * {@code Boolean}).
 *
 * <p>
 * {@code .json} files go through Jackson, everything else through SnakeYAML.
 * Both reject duplicate keys. JSON accepts {@code NaN} and {@code Infinity}
 * literals and YAML accepts {@code .nan} / {@code .inf}, so that non-finite
 * coefficients reach the coefficient rules instead of failing the parse.
 * </p>
 *
 * @since 1.0.0
 */
public final class DocumentReader {

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

    private DocumentReader() {
        // utility class
    }

    /**
     * Read and parse a document.
     *
     * @param file document path; must not be {@code null}
     * @return the parsed root value, possibly {@code null} for an empty document
     * @throws DocumentParseException if the file cannot be read or parsed
     */
    public static Object read(Path file) throws DocumentParseException {
        Objects.requireNonNull(file, "file must not be null");
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        try (InputStream is = Files.newInputStream(file)) {
            if (name.endsWith(".json")) {
                return JSON.readValue(is, Object.class);
            }
            LoaderOptions options = new LoaderOptions();
            options.setAllowDuplicateKeys(false);
            return new Yaml(new SafeConstructor(options)).load(is);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException("JSON is not valid: " + file + ": " + e.getOriginalMessage(), e);
        } catch (YAMLException e) {
            throw new DocumentParseException("YAML is not valid: " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
