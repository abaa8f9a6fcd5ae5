package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;

/**
 * Why a node is remembered on the {@link NodeStack}.
 */
public enum NodeTransition {

    /** Evaluate the node and its right siblings against the next input. */
    CONDITION("condition"),
    /** Evaluate the followup children of the node against the next input. */
    FOLLOWUP("followup"),
    /** Continue the slot filling of the node with the next input. */
    SLOT_FILLING("slot_filling");

    private final String value;

    NodeTransition(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves the wire value persisted in the node stack. {@link JumpTransition} and
     * {@link AfterDigressionFollowup} resolve their values the same way, each failing with
     * its own error code.
     *
     * @throws DialogFlowException for a value no constant carries
     */
    public static NodeTransition fromValue(String value) {
        for (NodeTransition transition : values()) {
            if (transition.value.equals(value)) {
                return transition;
            }
        }
        throw new DialogFlowException(
                DialogFlowErrorCode.UNKNOWN_FOCUS_TRANSITION,
                "Unknown focus transition '" + value + "'"
        );
    }
}
