package com.filesetloader.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.filesetloader.core.model.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point: loads the configured modules and prints their
 * prospector configurations and ingest pipelines as one JSON document.
 *
 * <pre>
 * {
 *   "prospectors" : [ { ... }, ... ],
 *   "pipelines" : { "nginx-access-default" : { ... }, ... }
 * }
 * </pre>
 *
 * <p>
 * All settings come from the environment, see {@link RegistryConfig}.
 * Logging goes to stderr, the document to stdout.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilesetLoaderApp {

    private static final Logger LOG = LoggerFactory.getLogger(FilesetLoaderApp.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private FilesetLoaderApp() {
        // entry-point class: not instantiable
    }

    public static void main(String[] args) throws Exception {
        RegistryConfig config = RegistryConfig.fromEnvironment();
        LOG.info("Starting fileset loader with config: {}", config);

        ModuleRegistry registry = ModuleRegistry.load(config);
        System.out.println(toJson(registry));
    }

    /**
     * @param registry a loaded registry
     * @return the {@code prospectors} / {@code pipelines} document
     * @throws JsonProcessingException if a document cannot be serialized
     */
    static String toJson(ModuleRegistry registry) throws JsonProcessingException {
        Map<String, Object> pipelines = new LinkedHashMap<>();
        for (PipelineDefinition pipeline : registry.getPipelines()) {
            pipelines.put(pipeline.getId(), pipeline.getBody());
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("prospectors", registry.getProspectorConfigs());
        document.put("pipelines", pipelines);
        return MAPPER.writeValueAsString(document);
    }
}
