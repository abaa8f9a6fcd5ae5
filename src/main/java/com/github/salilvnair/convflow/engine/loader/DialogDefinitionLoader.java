package com.github.salilvnair.convflow.engine.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.ExpressionFactory;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import com.github.salilvnair.convflow.engine.expression.ScenarioFactory;
import com.github.salilvnair.convflow.engine.flow.slot.Slot;
import com.github.salilvnair.convflow.engine.flow.slot.SlotHandler;
import com.github.salilvnair.convflow.engine.flow.tree.AfterDigressionFollowup;
import com.github.salilvnair.convflow.engine.flow.tree.DialogTree;
import com.github.salilvnair.convflow.engine.flow.tree.definition.DialogItemDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.NodeDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dialog resources written in JSON:
 * <pre>
 * {
 *   "dialog": [
 *     {"label": "greeting", "condition": "intents.greeting", "response": "Hello!",
 *      "followup": [...], "slot_filling": [...], "slot_handlers": [...],
 *      "settings": {"after_digression_followup": "never_return"}},
 *     {"subtree": "faq"}
 *   ],
 *   "subtrees": [
 *     {"name": "faq", "guard": "slots.topic == null", "nodes": [...]}
 *   ]
 * }
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class DialogDefinitionLoader {

    private final ObjectMapper mapper;
    private final ExpressionFactory expressionFactory;
    private final ScenarioFactory scenarioFactory;

    public DialogTree loadTree(Resource resource) {
        return load(resource).toDialogTree();
    }

    public DialogDefinition load(Resource resource) {
        log.debug("loading dialog from {}", resource.getDescription());
        try (InputStream in = resource.getInputStream()) {
            return load(mapper.readTree(in));
        } catch (IOException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.INVALID_DEFINITION,
                    "Cannot read dialog from " + resource.getDescription() + ": " + e.getMessage(),
                    e
            );
        }
    }

    public DialogDefinition load(Path path) {
        log.debug("loading dialog from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(mapper.readTree(in));
        } catch (IOException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.INVALID_DEFINITION,
                    "Cannot read dialog from " + path + ": " + e.getMessage(),
                    e
            );
        }
    }

    public DialogDefinition load(String json) {
        try {
            return load(mapper.readTree(json));
        } catch (IOException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.INVALID_DEFINITION,
                    "Cannot parse dialog: " + e.getMessage(),
                    e
            );
        }
    }

    public DialogDefinition load(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw invalid("Dialog resources are empty", root);
        }
        // a bare array is the list of root nodes
        if (root.isArray()) {
            return new DialogDefinition(items(root), List.of());
        }
        if (!root.isObject()) {
            throw invalid("Dialog resources must be an object", root);
        }
        List<SubtreeDefinition> subtrees = new ArrayList<>();
        for (JsonNode subtree : optionalArray(root, "subtrees")) {
            subtrees.add(subtree(subtree));
        }
        return new DialogDefinition(items(requiredArray(root, "dialog")), subtrees);
    }

    private List<DialogItemDefinition> items(JsonNode array) {
        List<DialogItemDefinition> items = new ArrayList<>();
        for (JsonNode item : array) {
            items.add(item(item));
        }
        return items;
    }

    private DialogItemDefinition item(JsonNode data) {
        if (!data.isObject()) {
            throw invalid("Invalid input type", data);
        }
        if (data.has("condition") && data.has("response")) {
            return node(data);
        }
        if (data.has("subtree")) {
            return new SubtreeRef(requiredText(data, "subtree"));
        }
        throw invalid("Unknown node type", data);
    }

    private NodeDefinition node(JsonNode data) {
        NodeDefinition.NodeDefinitionBuilder builder = NodeDefinition.builder()
                .label(optionalText(data, "label"))
                .condition(expression(data.get("condition")))
                .response(scenario(data.get("response")))
                .followup(items(optionalArray(data, "followup")));
        if (data.has("slot_filling")) {
            List<Slot> slots = new ArrayList<>();
            for (JsonNode slot : requiredArray(data, "slot_filling")) {
                slots.add(slot(slot));
            }
            builder.slotFilling(slots);
        }
        for (JsonNode handler : optionalArray(data, "slot_handlers")) {
            builder.slotHandler(handler(handler));
        }
        JsonNode settings = data.get("settings");
        if (settings != null && !settings.isNull()) {
            if (!settings.isObject()) {
                throw invalid("Node settings must be an object", settings);
            }
            String policy = optionalText(settings, "after_digression_followup");
            if (policy != null) {
                builder.afterDigressionFollowup(AfterDigressionFollowup.fromValue(policy));
            }
        }
        return builder.build();
    }

    private SubtreeDefinition subtree(JsonNode data) {
        if (!data.isObject()) {
            throw invalid("Invalid subtree", data);
        }
        Expression guard = data.has("guard") ? expression(data.get("guard")) : null;
        return new SubtreeDefinition(requiredText(data, "name"), guard, items(requiredArray(data, "nodes")));
    }

    private Slot slot(JsonNode data) {
        if (!data.isObject()) {
            throw invalid("Invalid slot", data);
        }
        if (!data.has("check_for")) {
            throw invalid("Missing data for required field 'check_for'", data);
        }
        return Slot.builder()
                .name(requiredText(data, "name"))
                .checkFor(expression(data.get("check_for")))
                .value(data.has("value") ? expression(data.get("value")) : null)
                .condition(data.has("condition") ? expression(data.get("condition")) : null)
                .prompt(data.has("prompt") ? scenario(data.get("prompt")) : null)
                .found(data.has("found") ? scenario(data.get("found")) : null)
                .notFound(data.has("not_found") ? scenario(data.get("not_found")) : null)
                .build();
    }

    private SlotHandler handler(JsonNode data) {
        if (!data.isObject() || !data.has("condition") || !data.has("response")) {
            throw invalid("Slot handler must have a condition and a response", data);
        }
        return new SlotHandler(expression(data.get("condition")), scenario(data.get("response")));
    }

    private Expression expression(JsonNode data) {
        return expressionFactory.create(data);
    }

    private Scenario scenario(JsonNode data) {
        return scenarioFactory.create(data);
    }

    private JsonNode requiredArray(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value == null || !value.isArray()) {
            throw invalid("Field '" + field + "' must be a list", data);
        }
        return value;
    }

    private JsonNode optionalArray(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return mapper.createArrayNode();
        }
        if (!value.isArray()) {
            throw invalid("Field '" + field + "' must be a list", data);
        }
        return value;
    }

    private String requiredText(JsonNode data, String field) {
        String value = optionalText(data, field);
        if (value == null) {
            throw invalid("Missing data for required field '" + field + "'", data);
        }
        return value;
    }

    private String optionalText(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw invalid("Field '" + field + "' must be a string", data);
        }
        return value.textValue();
    }

    private DialogFlowException invalid(String message, JsonNode data) {
        return new DialogFlowException(
                DialogFlowErrorCode.INVALID_DEFINITION,
                data == null ? message : message + ": " + data
        );
    }
}
