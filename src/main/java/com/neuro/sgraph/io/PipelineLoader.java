package com.neuro.sgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neuro.sgraph.api.NodeValidationException;

/**
 * Reads {@link PipelineDefinition}s from JSON.
 */
public final class PipelineLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PipelineLoader() {
        // Utility class
    }

    /** Parses a JSON file into a PipelineDefinition. */
    public static PipelineDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON document on the classpath.
     *
     * @throws IOException if the resource is missing or unreadable.
     */
    public static PipelineDefinition parseResource(String resource) throws IOException {
        try (InputStream in = PipelineLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Pipeline resource not found on classpath: " + resource);
            return checkRoot(MAPPER.readValue(in, PipelineDefinition.class));
        }
    }

    /** Parses a JSON string into a PipelineDefinition. */
    public static PipelineDefinition parse(String json) {
        try {
            return checkRoot(MAPPER.readValue(json, PipelineDefinition.class));
        } catch (JsonProcessingException e) {
            throw new NodeValidationException("Malformed pipeline definition: " + e.getOriginalMessage(), e);
        }
    }

    private static PipelineDefinition checkRoot(PipelineDefinition def) {
        if (def == null || def.getPipeline() == null)
            throw new NodeValidationException("Missing 'pipeline' key");
        return def;
    }
}
