package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;

/**
 * What happens to the followup of a node when a digression is triggered after its response.
 */
public enum AfterDigressionFollowup {

    /** Return from the digression and continue with the followup nodes. */
    ALLOW_RETURN("allow_return"),
    /** Never return to the node. */
    NEVER_RETURN("never_return");

    private final String value;

    AfterDigressionFollowup(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AfterDigressionFollowup fromValue(String value) {
        for (AfterDigressionFollowup policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new DialogFlowException(
                DialogFlowErrorCode.INVALID_DEFINITION,
                "Unknown returning policy '" + value + "', must be one of allow_return, never_return"
        );
    }
}
