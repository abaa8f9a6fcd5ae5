package com.github.salilvnair.convflow.engine.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Provides persisted state to a flow under a component name of the dialog state.
 */
@Getter
@RequiredArgsConstructor
public class FlowComponent {

    private final String name;
    private final Flow flow;

    public FlowResult turn(TurnContext ctx) {
        return turn(ctx, null);
    }

    public FlowResult turn(TurnContext ctx, DigressionResult digressionResult) {
        JsonNode stored = ctx.getStateVariable(name);
        ObjectNode state = stored instanceof ObjectNode object ? object : JsonUtil.object();
        FlowResult result = flow.turn(ctx, state, digressionResult);
        if (result == FlowResult.DONE) {
            ctx.removeStateVariable(name);
        } else {
            ctx.setStateVariable(name, state);
        }
        return result;
    }
}
