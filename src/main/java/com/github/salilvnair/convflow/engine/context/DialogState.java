package com.github.salilvnair.convflow.engine.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State variables of one dialog, restored before a turn and persisted by the caller after it.
 * <ul>
 *     <li>{@code user} - variables that live forever;</li>
 *     <li>{@code slots} - variables that live while a topic is discussed;</li>
 *     <li>{@code components} - private state of flow components, keyed by component name.</li>
 * </ul>
 */
@Getter
public class DialogState {

    private final Map<String, Object> user;
    private final Map<String, Object> slots;
    private final ObjectNode components;

    public DialogState() {
        this(null, null, null);
    }

    @JsonCreator
    public DialogState(@JsonProperty("user") Map<String, Object> user,
                       @JsonProperty("slots") Map<String, Object> slots,
                       @JsonProperty("components") ObjectNode components) {
        this.user = user == null ? new LinkedHashMap<>() : new LinkedHashMap<>(user);
        this.slots = slots == null ? new LinkedHashMap<>() : new LinkedHashMap<>(slots);
        this.components = components == null ? JsonUtil.object() : components.deepCopy();
    }

    public static DialogState empty() {
        return new DialogState();
    }

    public JsonNode getComponent(String name) {
        return components.get(name);
    }

    public void putComponent(String name, JsonNode value) {
        components.set(name, value);
    }

    public void removeComponent(String name) {
        components.remove(name);
    }

    public void clearComponents() {
        components.removeAll();
    }
}
