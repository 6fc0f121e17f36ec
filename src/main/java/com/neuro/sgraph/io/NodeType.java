package com.neuro.sgraph.io;

import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.node.AbstractNode;
import com.neuro.sgraph.node.EnvelopeExtractor;
import com.neuro.sgraph.node.OutputNode;
import com.neuro.sgraph.node.Preprocessing;
import com.neuro.sgraph.node.ProcessorNode;
import com.neuro.sgraph.node.RecordingOutput;
import com.neuro.sgraph.node.SourceNode;
import com.neuro.sgraph.node.StreamSource;

public enum NodeType {
    STREAM_SOURCE(StreamSource.class, (name, props) -> new StreamSource(name, PipelineCompiler.parseChannelInfo(props))),
    PREPROCESSING(Preprocessing.class, (name, props) -> new Preprocessing(name,
            PipelineCompiler.getDouble(props, Preprocessing.COLLECT_FOR_SECONDS, 60.0))),
    ENVELOPE_EXTRACTOR(EnvelopeExtractor.class, (name, props) -> {
        var node = new EnvelopeExtractor(name, PipelineCompiler.getDouble(props, EnvelopeExtractor.FACTOR, 0.9));
        String method = PipelineCompiler.getString(props, EnvelopeExtractor.METHOD, null);
        if (method != null)
            node.setMethod(method);
        return node;
    }),
    RECORDING_OUTPUT(RecordingOutput.class, (name, props) -> new RecordingOutput(name,
            PipelineCompiler.getInt(props, RecordingOutput.CAPACITY, 1024)));

    private final Class<? extends AbstractNode> nodeClass;
    private final PipelineCompiler.NodeFactory factory;

    NodeType(Class<? extends AbstractNode> nodeClass, PipelineCompiler.NodeFactory factory) {
        this.nodeClass = nodeClass;
        this.factory = factory;
    }

    public Class<? extends AbstractNode> getNodeClass() {
        return nodeClass;
    }

    public PipelineCompiler.NodeFactory getFactory() {
        return factory;
    }

    public boolean isSource() {
        return SourceNode.class.isAssignableFrom(nodeClass);
    }

    public boolean isProcessor() {
        return ProcessorNode.class.isAssignableFrom(nodeClass);
    }

    public boolean isOutput() {
        return OutputNode.class.isAssignableFrom(nodeClass);
    }

    public static NodeType fromString(String text) {
        for (NodeType b : NodeType.values()) {
            if (b.name().equalsIgnoreCase(text)) {
                return b;
            }
        }
        throw new NodeValidationException("Unknown NodeType: " + text);
    }
}
