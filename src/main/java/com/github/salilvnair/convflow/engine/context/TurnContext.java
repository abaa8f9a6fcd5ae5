package com.github.salilvnair.convflow.engine.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.journal.JournalEvent;
import com.github.salilvnair.convflow.engine.journal.JournalEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The context of one dialog turn: the incoming message or RPC request, the dialog state and
 * whatever the turn produces (commands, journal events, error).
 */
@Getter
@Slf4j
public class TurnContext {

    private final Map<String, Object> dialog;
    private final DialogState state;
    private final OffsetDateTime utcTime;
    private final Map<String, Object> message;
    private final RpcContext rpc;
    private final IntentsResult intents;
    private final EntitiesResult entities;
    private final Map<String, Object> scenarioVariables;

    private final List<JournalEvent> journalEvents = new ArrayList<>();
    private final List<ObjectNode> commands = new ArrayList<>();

    private DialogFlowException error;

    @Builder
    public TurnContext(Map<String, Object> dialog,
                       DialogState state,
                       OffsetDateTime utcTime,
                       Map<String, Object> message,
                       RpcRequest rpc,
                       IntentsResult intents,
                       EntitiesResult entities,
                       Map<String, Object> scenarioVariables) {
        boolean hasMessage = message != null && !message.isEmpty();
        if (hasMessage == (rpc != null)) {
            throw new IllegalArgumentException("A turn processes either a message or an RPC request");
        }
        this.dialog = dialog == null ? Map.of() : dialog;
        this.state = state == null ? DialogState.empty() : state;
        this.utcTime = utcTime == null ? OffsetDateTime.now(ZoneOffset.UTC) : utcTime;
        this.message = hasMessage ? message : Map.of();
        this.rpc = RpcContext.of(rpc);
        this.intents = intents == null ? IntentsResult.empty() : intents;
        this.entities = entities == null ? EntitiesResult.empty() : entities;
        this.scenarioVariables = scenarioVariables == null ? new LinkedHashMap<>() : scenarioVariables;
    }

    public boolean isRpc() {
        return rpc.isPresent();
    }

    // ---------------------------------------------------------------------
    // Component state
    // ---------------------------------------------------------------------
    public JsonNode getStateVariable(String key) {
        return state.getComponent(key);
    }

    public void setStateVariable(String key, JsonNode value) {
        state.putComponent(key, value);
    }

    public void removeStateVariable(String key) {
        state.removeComponent(key);
    }

    /**
     * Clear state variables of all components together with slots.
     */
    public void clearStateVariables() {
        state.clearComponents();
        state.getSlots().clear();
    }

    // ---------------------------------------------------------------------
    // Slots
    // ---------------------------------------------------------------------
    public Object getSlot(String name) {
        return state.getSlots().get(name);
    }

    public void setSlot(String name, Object value) {
        state.getSlots().put(name, value);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("slots", name);
        payload.put("value", value);
        journalEvent(JournalEventType.ASSIGN, payload);
    }

    public void removeSlot(String name) {
        if (state.getSlots().containsKey(name)) {
            state.getSlots().remove(name);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("slots", name);
            journalEvent(JournalEventType.DELETE, payload);
        }
    }

    // ---------------------------------------------------------------------
    // Journal
    // ---------------------------------------------------------------------
    /**
     * Add a journal event.
     *
     * @return the payload of the inserted event, still open for updates
     */
    public Map<String, Object> journalEvent(JournalEventType type, Map<String, Object> payload) {
        return journalEvent(type.value(), payload);
    }

    public Map<String, Object> journalEvent(String type, Map<String, Object> payload) {
        Map<String, Object> body = payload == null ? new LinkedHashMap<>() : payload;
        log.debug("{} {}", type, body);
        journalEvents.add(new JournalEvent(type, body));
        return body;
    }

    public void log(String level, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", level);
        payload.put("message", text);
        journalEvent(JournalEventType.LOG, payload);
    }

    public void debug(String text) {
        log("DEBUG", text);
    }

    public void warning(String text) {
        log.warn(text);
        log("WARNING", text);
    }

    public void setError(DialogFlowException error) {
        this.error = error;
    }

    // ---------------------------------------------------------------------
    // Evaluation variables
    // ---------------------------------------------------------------------
    /**
     * Variables visible to expressions and scenarios. Later entries win: scenario variables,
     * then call params, then built-ins.
     */
    public Map<String, Object> variables(Map<String, Object> params) {
        Map<String, Object> variables = new LinkedHashMap<>(scenarioVariables);
        if (params != null) {
            variables.putAll(params);
        }
        variables.put("message", message);
        variables.put("dialog", dialog);
        variables.put("intents", intents);
        variables.put("entities", entities);
        variables.put("user", state.getUser());
        variables.put("slots", state.getSlots());
        variables.put("rpc", rpc);
        variables.put("params", rpc.getParams());
        variables.put("utc_time", utcTime);
        variables.put("utc_today", utcTime.toLocalDate());
        return variables;
    }
}
