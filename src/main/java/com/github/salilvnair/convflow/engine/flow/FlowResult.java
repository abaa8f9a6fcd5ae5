package com.github.salilvnair.convflow.engine.flow;

/**
 * Result of the turn of a flow.
 */
public enum FlowResult {
    /** The flow could not handle the input and lets the enclosing flow look elsewhere. */
    DIGRESS,
    /** The flow waits for the next user input. */
    LISTEN,
    /** The flow is finished. */
    DONE
}
