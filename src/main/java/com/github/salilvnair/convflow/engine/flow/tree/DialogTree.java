package com.github.salilvnair.convflow.engine.flow.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.flow.DigressionResult;
import com.github.salilvnair.convflow.engine.flow.Flow;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import com.github.salilvnair.convflow.engine.flow.tree.definition.DialogItemDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeDefinition;
import lombok.Getter;

import java.util.List;

/**
 * Dialog tree conversation flow. Its state holds the {@link NodeStack} under {@code node_stack}.
 */
@Getter
public class DialogTree implements Flow {

    public static final String NODE_STACK = "node_stack";

    private final Tree tree;

    public DialogTree(List<DialogItemDefinition> dialog) {
        this(dialog, List.of());
    }

    public DialogTree(List<DialogItemDefinition> dialog, List<SubtreeDefinition> subtrees) {
        this.tree = new Tree(dialog, subtrees);
    }

    @Override
    public FlowResult turn(TurnContext ctx, ObjectNode state, DigressionResult digressionResult) {
        JsonNode stored = state.get(NODE_STACK);
        ArrayNode stack = stored instanceof ArrayNode array ? array : state.putArray(NODE_STACK);
        NodeStack nodeStack = new NodeStack(stack, tree);
        nodeStack.gc();
        return new DialogTreeTurn(tree, nodeStack, ctx).run();
    }
}
