package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds {@link Scenario}s from dialog definition values.
 */
public interface ScenarioFactory {

    Scenario create(JsonNode definition);
}
