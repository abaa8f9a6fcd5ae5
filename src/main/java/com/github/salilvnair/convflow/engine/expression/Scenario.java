package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;

import java.util.List;
import java.util.Map;

/**
 * Imperative logic applied to the turn context that yields an ordered list of commands.
 * Every command is a single-key object; control commands are recognized by key, everything
 * else is output for the user.
 */
public interface Scenario {

    List<ObjectNode> execute(TurnContext ctx, Map<String, Object> params);

    default List<ObjectNode> execute(TurnContext ctx) {
        return execute(ctx, Map.of());
    }
}
