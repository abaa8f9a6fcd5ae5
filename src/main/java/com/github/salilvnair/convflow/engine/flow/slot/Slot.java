package com.github.salilvnair.convflow.engine.flow.slot;

import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import lombok.Builder;
import lombok.Getter;

/**
 * Gathers a piece of information from the user input.
 */
@Getter
@Builder
public class Slot {

    /** Name of the slot variable the value is stored in. */
    private final String name;

    /** Extracts the information from the user input; a truthy result fills the slot. */
    private final Expression checkFor;

    /** When present, its result is stored instead of the {@code check_for} result. */
    private final Expression value;

    /** Enables the slot only under this condition. */
    private final Expression condition;

    /** Asks for the information. A slot without a prompt is optional. */
    private final Scenario prompt;

    /** Executed after the user provides the information, e.g. to validate it. */
    private final Scenario found;

    /** Executed when nothing in the user input was understood while the slot is in focus. */
    private final Scenario notFound;

    @Override
    public String toString() {
        return "Slot(" + name + ")";
    }
}
