package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;

/**
 * How the target of a {@code jump_to} command is processed.
 */
public enum JumpTransition {

    /** Check the condition of the target, then its right siblings, and trigger the first match. */
    CONDITION("condition"),
    /** Trigger the target without checking its condition. */
    RESPONSE("response"),
    /** Wait for the next input and process it starting from the target. */
    LISTEN("listen");

    private final String value;

    JumpTransition(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static JumpTransition fromValue(String value) {
        for (JumpTransition transition : values()) {
            if (transition.value.equals(value)) {
                return transition;
            }
        }
        throw new DialogFlowException(
                DialogFlowErrorCode.UNKNOWN_JUMP_TO_TRANSITION,
                "Unknown jump_to transition '" + value + "'"
        );
    }
}
