package com.neuro.sgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a pipeline definition file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineDefinition {
    private PipelineInfo pipeline;

    /** Meta-information and node lists of the pipeline. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class PipelineInfo {
        private String name, version;
        private NodeDef source;
        private List<NodeDef> processors;
        private List<NodeDef> outputs;
    }

    /**
     * Definition of a single node. {@code parent} is only read for outputs;
     * when absent the output follows the end of the processor chain.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description, parent;
        private boolean enabled = true;
        private Map<String, Object> properties;
    }
}
