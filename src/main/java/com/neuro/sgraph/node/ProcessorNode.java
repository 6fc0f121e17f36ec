package com.neuro.sgraph.node;

import com.neuro.sgraph.api.Node;
import com.neuro.sgraph.api.SignalBlock;

/**
 * A node that transforms its upstream output.
 *
 * Handles the two cases no concrete processor should have to think about:
 * - Disabled: the upstream output is passed through unchanged and no hook
 * runs. Toggling it schedules nothing; a re-enabled processor resumes from
 * the state it had.
 * - Empty input (or no upstream at all): the output is empty and no hook
 * runs, so onUpdate() never sees an empty block.
 */
public abstract non-sealed class ProcessorNode extends AbstractNode {
    private boolean disabled;

    protected ProcessorNode(String name) {
        super(name);
    }

    public final boolean isDisabled() {
        return disabled;
    }

    public final void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    @Override
    public final void update() {
        Node up = upstream();
        if (disabled) {
            setOutput(up == null ? SignalBlock.EMPTY : up.output());
            return;
        }
        if (up == null || up.output().isEmpty()) {
            setOutput(SignalBlock.EMPTY);
            return;
        }
        super.update();
    }
}
