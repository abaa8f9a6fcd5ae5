package com.github.salilvnair.convflow.engine.context;

import java.util.List;
import java.util.Set;

/**
 * All entities with the same name recognized from the user utterance.
 * Empty (falsy) when the entity is defined but was not recognized.
 */
public final class EntityValues {

    private final String name;
    private final List<RecognizedEntity> allObjects;
    private final Set<String> definedValues;

    public EntityValues(String name, List<RecognizedEntity> allObjects, Set<String> definedValues) {
        this.name = name;
        this.allObjects = allObjects == null ? List.of() : List.copyOf(allObjects);
        this.definedValues = definedValues == null ? Set.of() : Set.copyOf(definedValues);
    }

    public String getName() {
        return name;
    }

    public List<RecognizedEntity> getAllObjects() {
        return allObjects;
    }

    public List<Object> getAllValues() {
        return allObjects.stream().map(RecognizedEntity::value).toList();
    }

    public RecognizedEntity getFirst() {
        return allObjects.isEmpty() ? null : allObjects.get(0);
    }

    /**
     * Value of the first recognized entity, or {@code null}.
     */
    public Object getValue() {
        RecognizedEntity first = getFirst();
        return first == null ? null : first.value();
    }

    public boolean isEmpty() {
        return allObjects.isEmpty();
    }

    /**
     * Convenience lookup used by expressions.
     * <ul>
     *     <li>an attribute of the first entity ({@code value}, {@code literal}, {@code startChar}, {@code endChar});</li>
     *     <li>{@code true} when the name is one of the recognized values;</li>
     *     <li>{@code false} when the name is a defined but unrecognized value.</li>
     * </ul>
     *
     * @throws IllegalArgumentException none of the above applies
     */
    public Object get(String attribute) {
        RecognizedEntity first = getFirst();
        if (first != null) {
            switch (attribute) {
                case "name":
                    return first.name();
                case "value":
                    return first.value();
                case "literal":
                    return first.literal();
                case "startChar":
                    return first.startChar();
                case "endChar":
                    return first.endChar();
                default:
                    break;
            }
        }
        if (getAllValues().contains(attribute)) {
            return true;
        }
        if (definedValues.contains(attribute)) {
            return false;
        }
        throw new IllegalArgumentException("No such attribute or value '" + attribute + "' for entity '" + name + "'.");
    }

    @Override
    public String toString() {
        return "EntityValues(name=" + name + ", all_values=" + getAllValues() + ")";
    }
}
