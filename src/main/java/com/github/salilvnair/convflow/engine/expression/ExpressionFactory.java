package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds {@link Expression}s from dialog definition values.
 */
public interface ExpressionFactory {

    Expression create(JsonNode definition);
}
