package com.github.salilvnair.convflow.engine.flow.tree.definition;

import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import com.github.salilvnair.convflow.engine.flow.slot.Slot;
import com.github.salilvnair.convflow.engine.flow.slot.SlotHandler;
import com.github.salilvnair.convflow.engine.flow.tree.AfterDigressionFollowup;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Builder
@Getter
public class NodeDefinition implements DialogItemDefinition {

    /**
     * Unique node label. Required for nodes with followup children or slot filling,
     * and for nodes targeted by {@code jump_to}.
     */
    private final String label;

    private final Expression condition;

    private final Scenario response;

    private final List<DialogItemDefinition> followup;

    /**
     * {@code null} when the node has no slot filling.
     */
    private final List<Slot> slotFilling;

    @Singular
    private final List<SlotHandler> slotHandlers;

    @Builder.Default
    private final AfterDigressionFollowup afterDigressionFollowup = AfterDigressionFollowup.ALLOW_RETURN;

    public List<DialogItemDefinition> getFollowup() {
        return followup == null ? List.of() : followup;
    }

    public boolean hasFollowup() {
        return followup != null && !followup.isEmpty();
    }

    public boolean hasSlotFilling() {
        return slotFilling != null;
    }
}
