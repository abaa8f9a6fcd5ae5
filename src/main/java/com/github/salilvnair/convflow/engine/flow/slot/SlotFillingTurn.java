package com.github.salilvnair.convflow.engine.flow.slot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.expression.ControlCommands;
import com.github.salilvnair.convflow.engine.expression.SlotValues;
import com.github.salilvnair.convflow.engine.expression.Truthiness;
import com.github.salilvnair.convflow.engine.flow.DigressionResult;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import com.github.salilvnair.convflow.engine.journal.JournalEventType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One turn of the slot filling flow.
 */
@Slf4j
class SlotFillingTurn {

    private final SlotFilling flow;
    private final TurnContext ctx;
    private final ObjectNode state;
    private final DigressionResult digressionResult;

    private final List<FoundSlot> foundSlots = new ArrayList<>();
    private final List<Slot> skipPrompt = new ArrayList<>();
    private boolean wantResponse;

    SlotFillingTurn(SlotFilling flow, TurnContext ctx, ObjectNode state, DigressionResult digressionResult) {
        this.flow = flow;
        this.ctx = ctx;
        this.state = state;
        this.digressionResult = digressionResult;
    }

    FlowResult run() {
        for (Slot slot : flow.getSlots()) {
            if (isEnabled(slot)) {
                elicit(slot);
            }
        }
        for (FoundSlot found : foundSlots) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("slot", found.slot().getName());
            payload.put("value", found.currentValue());
            ctx.journalEvent(JournalEventType.SLOT_FILLING, payload);
            if (found.slot().getFound() != null) {
                found(found);
            }
        }
        if (slotInFocus() != null && foundSlots.isEmpty()) {
            // slot handlers, then digression, then the not_found response
            if (digressionResult == null) {
                Optional<SlotHandler> handler = flow.getHandlers().stream()
                        .filter(h -> h.condition().test(ctx))
                        .findFirst();
                if (handler.isEmpty()) {
                    return FlowResult.DIGRESS;
                }
                handler(handler.get());
            }
            if (digressionResult == DigressionResult.NOT_FOUND) {
                String focused = slotInFocus();
                flow.getSlots().stream()
                        .filter(s -> s.getName().equals(focused))
                        .filter(this::isEnabled)
                        .findFirst()
                        .filter(s -> s.getNotFound() != null)
                        .ifPresent(this::notFound);
            }
        }
        if (!wantResponse) {
            prompt();
        }
        if (wantResponse) {
            state.putNull(SlotFilling.SLOT_IN_FOCUS);
        }
        return slotInFocus() == null ? FlowResult.DONE : FlowResult.LISTEN;
    }

    /**
     * Slot conditions are checked right before each slot is used, so they see slots filled earlier in the turn.
     */
    private boolean isEnabled(Slot slot) {
        return slot.getCondition() == null || slot.getCondition().test(ctx);
    }

    private String slotInFocus() {
        JsonNode focus = state.get(SlotFilling.SLOT_IN_FOCUS);
        return focus == null || focus.isNull() ? null : focus.asText();
    }

    private void elicit(Slot slot) {
        Map<String, Object> params = new HashMap<>();
        params.put("slot_in_focus", slot.getName().equals(slotInFocus()));
        Object value = slot.getCheckFor().evaluate(ctx, params);
        if (!Truthiness.isTruthy(value)) {
            return;
        }
        if (slot.getValue() != null) {
            value = slot.getValue().evaluate(ctx);
        }
        value = SlotValues.unwrap(value);
        log.debug("elicit slot {} value {}", slot.getName(), value);
        Object previousValue = ctx.getSlot(slot.getName());
        ctx.setSlot(slot.getName(), value);
        foundSlots.add(new FoundSlot(slot, previousValue, value));
    }

    private void found(FoundSlot found) {
        Slot slot = found.slot();
        Map<String, Object> params = new HashMap<>();
        params.put("previous_value", found.previousValue());
        params.put("current_value", found.currentValue());
        Map<String, Object> payload = slotEvent(JournalEventType.FOUND, slot);
        String command = execute(slot.getFound().execute(ctx, params), ControlCommands.SLOT_FOUND, payload);
        if (command == null) {
            return;
        }
        switch (command) {
            case ControlCommands.RESPONSE -> wantResponse = true;
            case ControlCommands.PROMPT_AGAIN -> ctx.removeSlot(slot.getName());
            case ControlCommands.LISTEN_AGAIN -> {
                ctx.removeSlot(slot.getName());
                skipPrompt.add(slot);
            }
            default -> {
                // move_on
            }
        }
    }

    private void notFound(Slot slot) {
        Map<String, Object> payload = slotEvent(JournalEventType.NOT_FOUND, slot);
        String command = execute(slot.getNotFound().execute(ctx), ControlCommands.SLOT_NOT_FOUND, payload);
        if (ControlCommands.RESPONSE.equals(command)) {
            wantResponse = true;
        } else if (!ControlCommands.PROMPT_AGAIN.equals(command)) {
            // listen_again, or no command at all
            skipPrompt.add(slot);
        }
    }

    private void handler(SlotHandler handler) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("condition", handler.condition().source());
        ctx.journalEvent(JournalEventType.SLOT_HANDLER, payload);
        String command = execute(handler.response().execute(ctx), ControlCommands.SLOT_HANDLER, payload);
        if (ControlCommands.RESPONSE.equals(command)) {
            wantResponse = true;
        }
    }

    private void prompt() {
        for (Slot slot : flow.getSlots()) {
            if (isEnabled(slot) && slot.getPrompt() != null && ctx.getSlot(slot.getName()) == null) {
                state.put(SlotFilling.SLOT_IN_FOCUS, slot.getName());
                if (!skipPrompt.contains(slot)) {
                    prompt(slot);
                }
                return;
            }
        }
        state.putNull(SlotFilling.SLOT_IN_FOCUS);
    }

    private void prompt(Slot slot) {
        Map<String, Object> payload = slotEvent(JournalEventType.PROMPT, slot);
        String command = execute(slot.getPrompt().execute(ctx), ControlCommands.SLOT_PROMPT, payload);
        if (ControlCommands.RESPONSE.equals(command)) {
            wantResponse = true;
        } else {
            skipPrompt.add(slot);
        }
    }

    private Map<String, Object> slotEvent(JournalEventType type, Slot slot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("slot", slot.getName());
        return ctx.journalEvent(type, payload);
    }

    /**
     * Appends commands to the output up to the first control command, which is returned
     * and recorded in the journal payload.
     */
    private String execute(List<ObjectNode> commands, Set<String> vocabulary, Map<String, Object> payload) {
        for (ObjectNode command : commands) {
            Optional<String> control = ControlCommands.find(command, vocabulary);
            if (control.isPresent()) {
                payload.put("control_command", control.get());
                return control.get();
            }
            ctx.getCommands().add(command);
        }
        return null;
    }

    private record FoundSlot(Slot slot, Object previousValue, Object currentValue) {
    }
}
