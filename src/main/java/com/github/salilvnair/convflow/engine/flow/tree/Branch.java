package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.context.TurnContext;

import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered sequence of nodes and subtrees.
 */
public class Branch {

    private final List<BranchItem> items;

    public Branch(List<BranchItem> items) {
        this.items = List.copyOf(items);
    }

    public List<BranchItem> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Nodes of the branch in declaration order. Subtrees are expanded in place when their
     * guard holds; guards are evaluated lazily as the stream is consumed.
     */
    public Stream<Node> nodes(TurnContext ctx) {
        return items.stream().flatMap(item -> item.nodes(ctx));
    }
}
