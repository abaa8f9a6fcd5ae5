package com.github.salilvnair.convflow.engine.expression.spel;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.ConstantExpression;
import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.expression.ExpressionFactory;
import com.github.salilvnair.convflow.util.JsonUtil;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;

/**
 * Parses conditions and values written in Spring Expression Language.
 * <p>
 * The root object is the map of turn variables ({@code message}, {@code intents}, {@code entities},
 * {@code slots}, {@code user}, {@code rpc}, {@code params}, {@code utc_time}, {@code utc_today}),
 * so {@code slots.city == 'Paris'} and {@code intents.greeting} read naturally. Per-call parameters
 * such as {@code digressing} are both root properties and {@code #variables}.
 * Boolean and number literals become constants.
 */
public class SpelExpressionFactory implements ExpressionFactory {

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public Expression create(JsonNode definition) {
        if (definition == null || definition.isNull() || definition.isMissingNode()) {
            throw new DialogFlowException(DialogFlowErrorCode.INVALID_DEFINITION, "Expression is missing");
        }
        if (definition.isBoolean() || definition.isNumber()) {
            return new ConstantExpression(JsonUtil.toPlain(definition), definition.asText());
        }
        if (definition.isTextual()) {
            return create(definition.textValue());
        }
        throw new DialogFlowException(
                DialogFlowErrorCode.INVALID_DEFINITION,
                "Invalid expression " + definition + ", must be a string, boolean or number"
        );
    }

    public Expression create(String source) {
        if (source == null || source.isBlank()) {
            throw new DialogFlowException(DialogFlowErrorCode.INVALID_DEFINITION, "Expression is blank");
        }
        try {
            return new SpelExpression(source, parser.parseExpression(source));
        } catch (ParseException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.INVALID_DEFINITION,
                    "Cannot parse expression '" + source + "': " + e.getMessage(),
                    e
            );
        }
    }
}
