package com.github.salilvnair.convflow.engine.context;

/**
 * An entity recognized from the user utterance.
 *
 * @param name      the name of the entity
 * @param value     the normalized value of the entity
 * @param literal   how exactly the entity was present in the utterance
 * @param startChar index of the first char of the literal in the utterance
 * @param endChar   index after the last char of the literal in the utterance
 */
public record RecognizedEntity(
        String name,
        Object value,
        String literal,
        int startChar,
        int endChar
) {}
