package com.github.salilvnair.convflow.engine.context;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The result of intent recognition in the user utterance.
 */
@Slf4j
public final class IntentsResult {

    public static final double DEFAULT_TOP_THRESHOLD = 0.5d;

    private static final IntentsResult EMPTY = new IntentsResult(null, List.of(), null);

    private final RecognizedIntent top;
    private final List<RecognizedIntent> ranking;
    private final Set<String> definitions;

    private IntentsResult(RecognizedIntent top, List<RecognizedIntent> ranking, Set<String> definitions) {
        this.top = top;
        this.ranking = ranking;
        this.definitions = definitions;
    }

    public static IntentsResult empty() {
        return EMPTY;
    }

    public static IntentsResult resolve(List<RecognizedIntent> intents) {
        return resolve(intents, DEFAULT_TOP_THRESHOLD, null);
    }

    /**
     * @param intents      intents recognized from the utterance, in any order
     * @param topThreshold minimum confidence for the top intent
     * @param definitions  names of all known intents, or {@code null} when unknown
     */
    public static IntentsResult resolve(List<RecognizedIntent> intents, double topThreshold, Set<String> definitions) {
        List<RecognizedIntent> ranking = new ArrayList<>(intents == null ? List.of() : intents);
        ranking.sort(Comparator.comparingDouble(RecognizedIntent::confidence).reversed());
        for (RecognizedIntent intent : ranking) {
            log.debug("{}", intent);
        }
        RecognizedIntent top = ranking.isEmpty() ? null : ranking.get(0);
        if (top != null && top.confidence() < topThreshold) {
            top = null;
        }
        return new IntentsResult(top, List.copyOf(ranking), definitions == null ? null : Set.copyOf(definitions));
    }

    public RecognizedIntent getTop() {
        return top;
    }

    public List<RecognizedIntent> getRanking() {
        return ranking;
    }

    public boolean isIrrelevant() {
        return top == null;
    }

    /**
     * The top intent if it has the given name.
     *
     * @throws IllegalArgumentException the intent definitions are known and do not contain the name
     */
    public Optional<RecognizedIntent> get(String name) {
        if (definitions != null && !definitions.contains(name)) {
            throw new IllegalArgumentException("No such intent: '" + name + "'.");
        }
        if (top != null && top.name().equals(name)) {
            return Optional.of(top);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "IntentsResult(top=" + top + ", ranking=" + ranking + ")";
    }
}
