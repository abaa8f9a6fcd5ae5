package com.github.salilvnair.convflow.engine.expression.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import com.github.salilvnair.convflow.engine.expression.ScenarioFactory;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Scenarios written as data.
 * <ul>
 *     <li>a string is a single {@code text} command;</li>
 *     <li>an object is a single command, e.g. {@code {"jump_to": {"node": "x", "transition": "response"}}};</li>
 *     <li>an array mixes both, in order.</li>
 * </ul>
 * String values are rendered by {@link ScenarioTemplateRenderer} at execution time.
 */
@RequiredArgsConstructor
public class TemplateScenarioFactory implements ScenarioFactory {

    private final ScenarioTemplateRenderer renderer;

    public TemplateScenarioFactory() {
        this(new ScenarioTemplateRenderer());
    }

    @Override
    public Scenario create(JsonNode definition) {
        if (definition == null || definition.isNull() || definition.isMissingNode()) {
            throw new DialogFlowException(DialogFlowErrorCode.INVALID_DEFINITION, "Scenario is missing");
        }
        List<JsonNode> items = new ArrayList<>();
        if (definition.isArray()) {
            definition.forEach(items::add);
        } else {
            items.add(definition);
        }
        for (JsonNode item : items) {
            if (!item.isTextual() && !item.isObject()) {
                throw new DialogFlowException(
                        DialogFlowErrorCode.INVALID_DEFINITION,
                        "Invalid scenario item " + item + ", must be a string or a command object"
                );
            }
        }
        return new TemplateScenario(List.copyOf(items), renderer);
    }
}
