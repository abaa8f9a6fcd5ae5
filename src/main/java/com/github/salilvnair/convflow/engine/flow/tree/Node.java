package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import com.github.salilvnair.convflow.engine.flow.FlowComponent;
import lombok.Getter;

import java.util.List;
import java.util.stream.Stream;

/**
 * Node of the dialog tree. Immutable once the {@link Tree} is built.
 */
@Getter
public class Node implements BranchItem {

    private final String label;
    private final Expression condition;
    private final Scenario response;
    private final Node parent;
    private final AfterDigressionFollowup afterDigressionFollowup;

    /**
     * Slot filling flow persisted under the node label, {@code null} when the node has no slots.
     */
    private final FlowComponent slotFilling;

    private Branch followup = new Branch(List.of());
    private List<BranchItem> siblings = List.of();

    Node(String label,
         Expression condition,
         Scenario response,
         Node parent,
         AfterDigressionFollowup afterDigressionFollowup,
         FlowComponent slotFilling) {
        this.label = label;
        this.condition = condition;
        this.response = response;
        this.parent = parent;
        this.afterDigressionFollowup = afterDigressionFollowup == null
                ? AfterDigressionFollowup.ALLOW_RETURN
                : afterDigressionFollowup;
        this.slotFilling = slotFilling;
    }

    void attachFollowup(Branch followup) {
        this.followup = followup;
    }

    void attachSiblings(List<BranchItem> siblings) {
        this.siblings = siblings;
    }

    @Override
    public Stream<Node> nodes(TurnContext ctx) {
        return Stream.of(this);
    }

    public boolean hasFollowup() {
        return !followup.isEmpty();
    }

    public boolean hasSlotFilling() {
        return slotFilling != null;
    }

    /**
     * Whether the dialog may return to the followup of this node after a digression.
     */
    public boolean allowsReturn() {
        return afterDigressionFollowup == AfterDigressionFollowup.ALLOW_RETURN;
    }

    /**
     * The node itself and the items following it in its branch.
     */
    public Branch meAndRightSiblings() {
        int index = siblings.indexOf(this);
        return new Branch(siblings.subList(Math.max(index, 0), siblings.size()));
    }

    /**
     * Human readable unique title of the node.
     */
    public String title() {
        if (label != null) {
            return "'" + label + "'";
        }
        if (parent != null) {
            return parent.title() + " -> '" + condition.source() + "'";
        }
        return "'" + condition.source() + "'";
    }

    @Override
    public String toString() {
        return title();
    }
}
