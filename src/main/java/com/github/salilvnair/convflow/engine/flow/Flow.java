package com.github.salilvnair.convflow.engine.flow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;

/**
 * A conversation flow model. The flow keeps whatever it needs between turns in {@code state};
 * the caller is responsible for persisting it.
 */
public interface Flow {

    /**
     * @param ctx              context of the turn
     * @param state            state of the flow, mutated in place
     * @param digressionResult result of the digression we return from, or {@code null}
     */
    FlowResult turn(TurnContext ctx, ObjectNode state, DigressionResult digressionResult);
}
