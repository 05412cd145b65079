package com.filesetloader.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses YAML and JSON text into insertion-ordered maps with string keys.
 *
 * <p>
 * YAML is loaded with SnakeYAML's safe constructor and duplicate keys are
 * rejected. JSON is read with Jackson. In both cases the top level must be
 * a mapping; an empty document yields an empty map.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigDocuments {

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private ConfigDocuments() {
        // utility class: not instantiable
    }

    /**
     * @param text YAML document
     * @return the document as a map with string keys
     * @throws YAMLException            if the text is not valid YAML
     * @throws IllegalArgumentException if the top level is not a mapping
     */
    public static Map<String, Object> parseYaml(String text) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object loaded = new Yaml(new SafeConstructor(options)).load(text);
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(
                    "expected a mapping at the top level, got " + loaded.getClass().getSimpleName());
        }
        return ConfigMerger.normalize(map);
    }

    /**
     * @param text JSON document
     * @return the document as a map
     * @throws JsonProcessingException  if the text is not valid JSON or not
     *                                  an object
     * @throws IllegalArgumentException if the document is {@code null}
     */
    public static Map<String, Object> parseJson(String text) throws JsonProcessingException {
        if (text.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> document = JSON.readValue(text, MAP_TYPE);
        if (document == null) {
            throw new IllegalArgumentException("expected a mapping at the top level, got null");
        }
        return document;
    }
}
