package com.github.salilvnair.convflow.engine.flow.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.ControlCommands;
import com.github.salilvnair.convflow.engine.flow.DigressionResult;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import com.github.salilvnair.convflow.engine.journal.JournalEventType;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One turn of the dialog tree flow.
 */
@Slf4j
class DialogTreeTurn {

    private final Tree tree;
    private final NodeStack stack;
    private final TurnContext ctx;

    DialogTreeTurn(Tree tree, NodeStack stack, TurnContext ctx) {
        this.tree = tree;
        this.stack = stack;
        this.ctx = ctx;
    }

    FlowResult run() {
        Optional<NodeStack.StackEntry> focus = stack.peek();
        if (focus.isEmpty()) {
            return rootNodes();
        }
        Node node = focus.get().node();
        NodeTransition transition = focus.get().transition();
        log.debug("peek {} transition={}", node, transition.value());
        return switch (transition) {
            case FOLLOWUP -> focusFollowup(node);
            case SLOT_FILLING -> trigger(node, null);
            case CONDITION -> focusCondition(node);
        };
    }

    private FlowResult rootNodes() {
        Optional<Node> matched = firstMatch(tree.getRootNodes());
        return matched.map(node -> trigger(node, null)).orElse(FlowResult.DONE);
    }

    /**
     * Traverse the focused node and its right siblings after receiving user input.
     */
    private FlowResult focusCondition(Node focusedNode) {
        Optional<Node> matched = firstMatch(focusedNode.meAndRightSiblings());
        if (matched.isPresent()) {
            stack.remove(focusedNode);
            return trigger(matched.get(), null);
        }
        if (focusedNode.getParent() != null) {
            return digression(focusedNode);
        }
        ctx.warning("No node matched " + focusedNode);
        return returnAfterDigression(DigressionResult.FOUND).orElseGet(this::commandEnd);
    }

    /**
     * Traverse followup nodes after receiving user input.
     */
    private FlowResult focusFollowup(Node parentNode) {
        Optional<Node> matched = firstMatch(parentNode.getFollowup());
        if (matched.isPresent()) {
            stack.remove(parentNode);
            return trigger(matched.get(), null);
        }
        return digression(parentNode);
    }

    /**
     * Traverse followup nodes without waiting for user input.
     */
    private FlowResult commandFollowup(Node parentNode) {
        log.debug("followup {}", parentNode);
        Optional<Node> matched = firstMatch(parentNode.getFollowup());
        if (matched.isPresent()) {
            return triggerMaybeDigressed(matched.get());
        }
        ctx.warning("Nothing matched from followup nodes of " + parentNode + ".");
        return FlowResult.LISTEN;
    }

    private FlowResult commandListen(Node node) {
        if (node.hasFollowup()) {
            stack.push(node, NodeTransition.FOLLOWUP);
            return FlowResult.LISTEN;
        }
        return returnAfterDigression(DigressionResult.FOUND).orElse(FlowResult.LISTEN);
    }

    private FlowResult commandEnd() {
        stack.clear();
        return FlowResult.DONE;
    }

    private FlowResult commandJumpTo(JsonNode payload) {
        log.debug("jump_to {}", payload);
        String label = payload.path("node").asText(null);
        Node target = tree.find(label).orElseThrow(() -> new DialogFlowException(
                DialogFlowErrorCode.UNKNOWN_JUMP_TO_NODE,
                "Unknown jump_to node '" + label + "'"
        ));
        JumpTransition transition = JumpTransition.fromValue(payload.path("transition").asText(null));
        return switch (transition) {
            case RESPONSE -> triggerMaybeDigressed(target);
            case CONDITION -> jumpToCondition(target);
            case LISTEN -> {
                stack.push(target, NodeTransition.CONDITION);
                yield FlowResult.LISTEN;
            }
        };
    }

    private FlowResult jumpToCondition(Node target) {
        Optional<Node> matched = firstMatch(target.meAndRightSiblings());
        if (matched.isPresent()) {
            return triggerMaybeDigressed(matched.get());
        }
        ctx.warning("Nothing matched when jumping to " + target + " and its siblings.");
        return returnAfterDigression(DigressionResult.FOUND).orElseGet(this::commandEnd);
    }

    /**
     * Switch to a completely different user-initiated node.
     */
    private FlowResult digression(Node digressedNode) {
        log.debug("digression from {}", digressedNode);
        ctx.journalEvent(JournalEventType.DIGRESSION_FROM, nodePayload(digressedNode));
        Optional<Node> matched = tree.getRootNodes().nodes(ctx)
                .filter(node -> node != digressedNode)
                .filter(node -> node.getCondition().test(ctx, Map.of("digressing", true)))
                .findFirst();
        if (matched.isPresent()) {
            return triggerMaybeDigressed(matched.get());
        }
        if (ctx.isRpc()) {
            return FlowResult.LISTEN;
        }
        if (digressedNode.allowsReturn()) {
            return returnAfterDigression(DigressionResult.NOT_FOUND).orElseGet(this::commandEnd);
        }
        ctx.warning("Nothing matched after " + digressedNode + ", which never returns from digression.");
        return commandEnd();
    }

    /**
     * Return to the node that was interrupted when the digression occurred.
     *
     * @return empty when there is nowhere to return
     */
    private Optional<FlowResult> returnAfterDigression(DigressionResult result) {
        Optional<NodeStack.StackEntry> popped = stack.pop();
        if (popped.isEmpty()) {
            return Optional.empty();
        }
        Node node = popped.get().node();
        NodeTransition transition = popped.get().transition();
        log.debug("return_after_digression {} {}", node, transition.value());
        return switch (transition) {
            case SLOT_FILLING -> Optional.of(trigger(node, result));
            case FOLLOWUP -> node.allowsReturn()
                    ? Optional.of(trigger(node, result))
                    : returnAfterDigression(result);
            case CONDITION -> returnAfterDigression(result);
        };
    }

    /**
     * Trigger the node, or return to it if it was digressed from.
     */
    private FlowResult triggerMaybeDigressed(Node node) {
        if (stack.remove(node)) {
            return trigger(node, DigressionResult.FOUND);
        }
        return trigger(node, null);
    }

    /**
     * Go through the slot filling of the node (if any) and execute its response.
     */
    private FlowResult trigger(Node node, DigressionResult digressionResult) {
        ctx.journalEvent(JournalEventType.NODE_TRIGGERED, nodePayload(node));
        if (!node.hasSlotFilling()) {
            return response(node, digressionResult);
        }
        FlowResult result = node.getSlotFilling().turn(ctx, digressionResult);
        return switch (result) {
            case DONE -> {
                stack.remove(node);
                yield response(node, digressionResult);
            }
            case LISTEN -> {
                stack.push(node, NodeTransition.SLOT_FILLING);
                yield FlowResult.LISTEN;
            }
            case DIGRESS -> digression(node);
        };
    }

    private FlowResult response(Node node, DigressionResult digressionResult) {
        Map<String, Object> payload = ctx.journalEvent(JournalEventType.RESPONSE, nodePayload(node));
        List<ObjectNode> commands = node.getResponse().execute(ctx, Map.of("returning", digressionResult != null));
        for (ObjectNode command : commands) {
            Optional<String> control = ControlCommands.find(command, ControlCommands.NODE_RESPONSE);
            if (control.isEmpty()) {
                ctx.getCommands().add(command);
                continue;
            }
            payload.put("control_command", control.get());
            switch (control.get()) {
                case ControlCommands.JUMP_TO:
                    return commandJumpTo(command.get(ControlCommands.JUMP_TO));
                case ControlCommands.LISTEN:
                    return commandListen(node);
                case ControlCommands.END:
                    return commandEnd();
                default:
                    return commandFollowup(node);
            }
        }
        if (node.hasFollowup()) {
            payload.put("followup", Map.of());
            return commandListen(node);
        }
        Optional<FlowResult> returned = returnAfterDigression(DigressionResult.FOUND);
        if (returned.isPresent()) {
            payload.put("return_after_digression", Map.of());
            return returned.get();
        }
        payload.put("end", Map.of());
        return commandEnd();
    }

    private Optional<Node> firstMatch(Branch branch) {
        return branch.nodes(ctx)
                .filter(node -> node.getCondition().test(ctx, Map.of("digressing", false)))
                .findFirst();
    }

    private Map<String, Object> nodePayload(Node node) {
        Map<String, Object> described = new LinkedHashMap<>();
        described.put("condition", node.getCondition().source());
        if (node.getLabel() != null) {
            described.put("label", node.getLabel());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", described);
        return payload;
    }
}
