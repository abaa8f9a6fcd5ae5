package com.github.salilvnair.convflow.engine.flow.slot;

import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.Scenario;

/**
 * Responds to questions tangential to the slot filling; the prompt of the focused slot follows.
 */
public record SlotHandler(
        Expression condition,
        Scenario response
) {
}
