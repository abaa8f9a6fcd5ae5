package com.github.salilvnair.convflow.engine.hook;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;

/**
 * Callbacks around every dialog turn. Hook failures are logged and never change the turn.
 */
public interface DialogTurnHook {

    default boolean supports(TurnContext ctx) {
        return true;
    }

    default void beforeTurn(TurnContext ctx) {
    }

    /**
     * @param listening whether the dialog waits for the next user input
     */
    default void afterTurn(TurnContext ctx, boolean listening) {
    }

    default void onTurnError(TurnContext ctx, DialogFlowException error) {
    }
}
