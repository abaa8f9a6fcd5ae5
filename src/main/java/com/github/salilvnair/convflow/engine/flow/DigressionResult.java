package com.github.salilvnair.convflow.engine.flow;

/**
 * Result of a digression, passed to the interrupted flow when the dialog returns to it.
 */
public enum DigressionResult {
    FOUND,
    NOT_FOUND
}
