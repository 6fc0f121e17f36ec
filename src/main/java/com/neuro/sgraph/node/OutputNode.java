package com.neuro.sgraph.node;

import com.neuro.sgraph.api.Node;

/**
 * A terminal node that hands data to something outside the pipeline
 * (a recorder, a renderer).
 *
 * Outputs never emit data themselves; their own output stays empty. With no
 * upstream data this tick, update() does nothing at all.
 */
public abstract non-sealed class OutputNode extends AbstractNode {

    protected OutputNode(String name) {
        super(name);
    }

    @Override
    public final void update() {
        Node up = upstream();
        if (up == null || up.output().isEmpty())
            return;
        super.update();
    }
}
