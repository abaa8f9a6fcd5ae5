package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.expression.Expression;
import lombok.Getter;

import java.util.stream.Stream;

@Getter
public class Subtree implements BranchItem {

    private final String name;
    private final Expression guard;
    private final Branch nodes;

    Subtree(String name, Expression guard, Branch nodes) {
        this.name = name;
        this.guard = guard;
        this.nodes = nodes;
    }

    @Override
    public Stream<Node> nodes(TurnContext ctx) {
        if (guard != null && !guard.test(ctx)) {
            return Stream.empty();
        }
        return nodes.nodes(ctx);
    }

    @Override
    public String toString() {
        return "Subtree(" + name + ")";
    }
}
