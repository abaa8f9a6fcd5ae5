package com.github.salilvnair.convflow.engine.flow.slot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.flow.DigressionResult;
import com.github.salilvnair.convflow.engine.flow.Flow;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import lombok.Getter;

import java.util.List;

/**
 * Slot filling conversation flow: collects several values before the final response of a node.
 * <p>
 * The state keeps the name of the slot the user was last prompted for under {@code slot_in_focus}.
 */
@Getter
public class SlotFilling implements Flow {

    public static final String SLOT_IN_FOCUS = "slot_in_focus";

    private final List<Slot> slots;
    private final List<SlotHandler> handlers;

    public SlotFilling(List<Slot> slots, List<SlotHandler> handlers) {
        this.slots = slots == null ? List.of() : List.copyOf(slots);
        this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
    }

    @Override
    public FlowResult turn(TurnContext ctx, ObjectNode state, DigressionResult digressionResult) {
        return new SlotFillingTurn(this, ctx, state, digressionResult).run();
    }
}
