package com.neuro.sgraph.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.ChannelType;
import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.engine.Pipeline;
import com.neuro.sgraph.node.AbstractNode;
import com.neuro.sgraph.node.OutputNode;
import com.neuro.sgraph.node.ProcessorNode;
import com.neuro.sgraph.node.SourceNode;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link PipelineDefinition} into a wired {@link Pipeline}.
 *
 * Every node definition is checked against its section: the source must be a
 * source type, processors processor types, outputs output types. Names must
 * be unique and an output's {@code parent} must name the source or one of the
 * processors. The pipeline is returned wired but not initialized.
 */
@Log4j2
public final class PipelineCompiler {

    /**
     * Compiles the definition into a pipeline.
     *
     * @param def The pipeline definition.
     * @return A container holding the pipeline and name lookup map.
     * @throws NodeValidationException if the definition is inconsistent.
     */
    public CompiledPipeline compile(PipelineDefinition def) {
        PipelineDefinition.PipelineInfo info = def.getPipeline();
        if (info == null)
            throw new NodeValidationException("Missing 'pipeline' key");
        if (info.getSource() == null)
            throw new NodeValidationException("Pipeline " + info.getName() + " has no source");

        Map<String, Node> nodesByName = new LinkedHashMap<>();
        Map<String, String> logicalTypes = new HashMap<>();
        Map<String, String> descriptions = new HashMap<>();
        Pipeline pipeline = new Pipeline();

        SourceNode source = (SourceNode) create(info.getSource(), "source", nodesByName, logicalTypes, descriptions);
        pipeline.setSource(source);

        for (PipelineDefinition.NodeDef nd : orEmpty(info.getProcessors())) {
            ProcessorNode processor = (ProcessorNode) create(nd, "processor", nodesByName, logicalTypes,
                    descriptions);
            pipeline.addProcessor(processor);
        }

        for (PipelineDefinition.NodeDef nd : orEmpty(info.getOutputs())) {
            Node parent = null;
            if (nd.getParent() != null) {
                parent = nodesByName.get(nd.getParent());
                if (parent == null)
                    throw new NodeValidationException("Output " + nd.getName() + " reads from unknown node "
                            + nd.getParent());
                if (parent instanceof OutputNode)
                    throw new NodeValidationException("Output " + nd.getName() + " cannot read from output "
                            + nd.getParent());
            }
            OutputNode output = (OutputNode) create(nd, "output", nodesByName, logicalTypes, descriptions);
            pipeline.addOutput(output, parent);
        }

        log.info("Compiled pipeline {} (version {}) with {} nodes", info.getName(), info.getVersion(),
                nodesByName.size());
        return new CompiledPipeline(info.getName(), info.getVersion(), pipeline,
                Collections.unmodifiableMap(nodesByName),
                Collections.unmodifiableMap(logicalTypes),
                Collections.unmodifiableMap(descriptions));
    }

    private static AbstractNode create(PipelineDefinition.NodeDef nd, String section, Map<String, Node> nodesByName,
            Map<String, String> logicalTypes, Map<String, String> descriptions) {
        String name = nd.getName();
        if (name == null || name.isBlank())
            throw new NodeValidationException("A " + section + " definition has no name");
        if (nodesByName.containsKey(name))
            throw new NodeValidationException("Duplicate node name: " + name);
        if (nd.getType() == null)
            throw new NodeValidationException("Node " + name + " has no type");

        NodeType type = NodeType.fromString(nd.getType());
        boolean fits = switch (section) {
            case "source" -> type.isSource();
            case "processor" -> type.isProcessor();
            default -> type.isOutput();
        };
        if (!fits)
            throw new NodeValidationException("Node " + name + " of type " + nd.getType() + " cannot be used as a "
                    + section);

        Map<String, Object> props = nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap();
        AbstractNode node;
        try {
            node = type.getFactory().create(name, props);
        } catch (NodeValidationException e) {
            throw new NodeValidationException("Invalid properties for node " + name + ": " + e.getMessage(), e);
        }

        if (!nd.isEnabled()) {
            if (!(node instanceof ProcessorNode p))
                throw new NodeValidationException("Only processors can be disabled, but " + name + " is a "
                        + section);
            p.setDisabled(true);
        }

        nodesByName.put(name, node);
        logicalTypes.put(name, type.name());
        if (nd.getDescription() != null)
            descriptions.put(name, nd.getDescription());
        return node;
    }

    /**
     * Builds a channel descriptor from source properties:
     * {@code samplingRate}, {@code channels} (names), either {@code channelType}
     * (one type for all) or {@code channelTypes} (one per channel), and optional
     * {@code bads}.
     */
    static ChannelInfo parseChannelInfo(Map<String, Object> props) {
        List<String> names = getStringList(props, "channels");
        if (names.isEmpty())
            throw new NodeValidationException("Source needs a non-empty 'channels' list");
        List<String> types = getStringList(props, "channelTypes");
        if (!types.isEmpty() && types.size() != names.size())
            throw new NodeValidationException("'channelTypes' has " + types.size() + " entries for "
                    + names.size() + " channels");
        ChannelType common = ChannelType.fromString(getString(props, "channelType", "EEG"));

        ChannelInfo.Builder b = ChannelInfo.builder().samplingRate(getDouble(props, "samplingRate", Double.NaN));
        for (int i = 0; i < names.size(); i++)
            b.channel(names.get(i), types.isEmpty() ? common : ChannelType.fromString(types.get(i)));
        for (String bad : getStringList(props, "bads"))
            b.bad(bad);

        ChannelInfo info = b.build();
        info.checkConsistency();
        return info;
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        try {
            return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new NodeValidationException("Property " + key + " is not a number: " + v, e);
        }
    }

    static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        try {
            return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
        } catch (NumberFormatException e) {
            throw new NodeValidationException("Property " + key + " is not an integer: " + v, e);
        }
    }

    static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }

    static List<String> getStringList(Map<String, Object> props, String key) {
        Object v = props.get(key);
        if (v == null)
            return List.of();
        if (!(v instanceof List<?> list))
            throw new NodeValidationException("Property " + key + " must be a list, got " + v);
        List<String> out = new ArrayList<>(list.size());
        for (Object o : list)
            out.add(String.valueOf(o));
        return out;
    }

    private static List<PipelineDefinition.NodeDef> orEmpty(List<PipelineDefinition.NodeDef> defs) {
        return defs == null ? List.of() : defs;
    }

    /** Factory for creating node instances from JSON definitions. */
    @FunctionalInterface
    public interface NodeFactory {
        AbstractNode create(String name, Map<String, Object> properties);
    }

    /** The result of compilation: a pipeline ready to initialize. */
    public record CompiledPipeline(
            String name, String version, Pipeline pipeline,
            Map<String, Node> nodesByName, Map<String, String> logicalTypes,
            Map<String, String> descriptions) {
    }
}
