package com.github.salilvnair.convflow.engine.exception;

public enum DialogFlowErrorCode {

    // =========================
    // Definition / tree build errors
    // =========================
    INVALID_DEFINITION(
            "Dialog definition is invalid",
            false
    ),

    UNKNOWN_SUBTREE(
            "Sub-tree not found",
            false
    ),

    DUPLICATE_SUBTREE(
            "Duplicate sub-tree name",
            false
    ),

    SUBTREE_ALREADY_USED(
            "Sub-tree already used",
            false
    ),

    STATEFUL_NODE_WITHOUT_LABEL(
            "Stateful node must have a label",
            false
    ),

    DUPLICATE_NODE_LABEL(
            "Duplicate node label",
            false
    ),

    // =========================
    // Evaluation errors
    // =========================
    EXPRESSION_EVALUATION_FAILED(
            "Failed to evaluate expression",
            true
    ),

    SCENARIO_EVALUATION_FAILED(
            "Failed to execute scenario",
            true
    ),

    AMBIGUOUS_CONTROL_COMMAND(
            "Command contains more than one control command",
            false
    ),

    // =========================
    // Turn errors
    // =========================
    UNKNOWN_JUMP_TO_NODE(
            "Unknown jump_to node",
            false
    ),

    UNKNOWN_JUMP_TO_TRANSITION(
            "Unknown jump_to transition",
            false
    ),

    UNKNOWN_FOCUS_TRANSITION(
            "Unknown focus transition",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal dialog flow error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    DialogFlowErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
