package com.github.salilvnair.convflow.engine.expression;

import com.github.salilvnair.convflow.engine.context.TurnContext;

import java.util.Map;

/**
 * A condition or value computed against the turn context.
 */
public interface Expression {

    /**
     * @param ctx    context of the turn
     * @param params extra variables for this evaluation, e.g. {@code digressing} or {@code slot_in_focus}
     */
    Object evaluate(TurnContext ctx, Map<String, Object> params);

    /**
     * Source text, used in journal events and log messages.
     */
    String source();

    default Object evaluate(TurnContext ctx) {
        return evaluate(ctx, Map.of());
    }

    default boolean test(TurnContext ctx, Map<String, Object> params) {
        return Truthiness.isTruthy(evaluate(ctx, params));
    }

    default boolean test(TurnContext ctx) {
        return test(ctx, Map.of());
    }

    static Expression constant(Object value) {
        return new ConstantExpression(value, String.valueOf(value));
    }
}
