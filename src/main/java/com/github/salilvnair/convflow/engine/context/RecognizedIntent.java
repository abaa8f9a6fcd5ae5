package com.github.salilvnair.convflow.engine.context;

/**
 * An intent recognized from the user utterance.
 *
 * @param name       the name of the intent
 * @param confidence how confident the recognizer is, in the range {@code 0.0 < confidence <= 1.0}
 */
public record RecognizedIntent(
        String name,
        double confidence
) {}
