package com.github.salilvnair.convflow.engine.flow;

import com.github.salilvnair.convflow.engine.exception.DialogFlowException;

/**
 * Outcome of one dialog turn.
 *
 * @param result {@link FlowResult#LISTEN} or {@link FlowResult#DONE}
 * @param error  the failure that forced the turn to end, or {@code null}
 */
public record DialogTurnResult(
        FlowResult result,
        DialogFlowException error
) {

    public boolean isListening() {
        return result == FlowResult.LISTEN;
    }

    public boolean isFailed() {
        return error != null;
    }
}
