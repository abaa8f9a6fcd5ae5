package com.github.salilvnair.convflow.engine.expression;

import com.github.salilvnair.convflow.engine.context.TurnContext;

import java.util.Map;

public record ConstantExpression(
        Object value,
        String source
) implements Expression {

    @Override
    public Object evaluate(TurnContext ctx, Map<String, Object> params) {
        return value;
    }
}
