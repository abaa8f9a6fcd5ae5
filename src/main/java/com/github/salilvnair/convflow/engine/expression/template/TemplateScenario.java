package com.github.salilvnair.convflow.engine.expression.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.Scenario;
import com.github.salilvnair.convflow.util.JsonUtil;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class TemplateScenario implements Scenario {

    private final List<JsonNode> items;
    private final ScenarioTemplateRenderer renderer;

    TemplateScenario(List<JsonNode> items, ScenarioTemplateRenderer renderer) {
        this.items = items;
        this.renderer = renderer;
    }

    @Override
    public List<ObjectNode> execute(TurnContext ctx, Map<String, Object> params) {
        try {
            return render(ctx.variables(params));
        } catch (DialogFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.SCENARIO_EVALUATION_FAILED,
                    "Failed to execute scenario " + items + ": " + e.getMessage(),
                    e
            );
        }
    }

    private List<ObjectNode> render(Map<String, Object> variables) {
        List<ObjectNode> commands = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                // blank text is not a command
                String text = renderer.render(item.textValue(), variables).trim();
                if (!text.isEmpty()) {
                    commands.add(JsonUtil.command("text", text));
                }
            } else {
                ObjectNode command = item.deepCopy();
                renderLeaves(command, variables);
                commands.add(command);
            }
        }
        return commands;
    }

    private void renderLeaves(JsonNode node, Map<String, Object> variables) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isTextual() && ScenarioTemplateRenderer.isTemplate(value.textValue())) {
                    field.setValue(TextNode.valueOf(renderer.render(value.textValue(), variables)));
                } else {
                    renderLeaves(value, variables);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode value = array.get(i);
                if (value.isTextual() && ScenarioTemplateRenderer.isTemplate(value.textValue())) {
                    array.set(i, TextNode.valueOf(renderer.render(value.textValue(), variables)));
                } else {
                    renderLeaves(value, variables);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "TemplateScenario" + items;
    }
}
