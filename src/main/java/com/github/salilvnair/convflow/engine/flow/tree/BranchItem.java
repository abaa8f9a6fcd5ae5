package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.context.TurnContext;

import java.util.stream.Stream;

/**
 * An item of a {@link Branch}: a {@link Node} or a {@link Subtree}.
 */
public interface BranchItem {

    /**
     * Nodes this item contributes to the branch for the given turn.
     */
    Stream<Node> nodes(TurnContext ctx);
}
