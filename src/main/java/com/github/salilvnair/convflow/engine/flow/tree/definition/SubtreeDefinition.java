package com.github.salilvnair.convflow.engine.flow.tree.definition;

import com.github.salilvnair.convflow.engine.expression.Expression;

import java.util.List;

/**
 * Named reusable list of nodes.
 *
 * @param name  unique subtree name
 * @param guard gates the whole subtree, {@code null} means always enabled
 * @param nodes nodes and nested subtree references
 */
public record SubtreeDefinition(
        String name,
        Expression guard,
        List<DialogItemDefinition> nodes
) {

    public SubtreeDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
