package com.github.salilvnair.convflow.engine.flow.tree.definition;

/**
 * An item of a dialog branch definition: a node or a reference to a subtree.
 */
public interface DialogItemDefinition {
}
