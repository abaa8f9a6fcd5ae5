package com.github.salilvnair.convflow.engine.context;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The result of entity recognition in the user utterance.
 */
@Slf4j
public final class EntitiesResult {

    private static final EntitiesResult EMPTY = new EntitiesResult(Map.of(), List.of());

    private final Map<String, EntityValues> proxies;
    private final List<RecognizedEntity> allObjects;

    private EntitiesResult(Map<String, EntityValues> proxies, List<RecognizedEntity> allObjects) {
        this.proxies = proxies;
        this.allObjects = allObjects;
    }

    public static EntitiesResult empty() {
        return EMPTY;
    }

    public static EntitiesResult resolve(List<RecognizedEntity> entities) {
        return resolve(entities, null);
    }

    /**
     * @param entities    recognized entities in the order they appear in the utterance
     * @param definitions entity name to its defined values, or {@code null} when unknown
     */
    public static EntitiesResult resolve(List<RecognizedEntity> entities, Map<String, Set<String>> definitions) {
        List<RecognizedEntity> all = entities == null ? List.of() : List.copyOf(entities);
        Map<String, List<RecognizedEntity>> grouped = new LinkedHashMap<>();
        for (RecognizedEntity entity : all) {
            log.debug("{}", entity);
            grouped.computeIfAbsent(entity.name(), k -> new ArrayList<>()).add(entity);
        }
        Map<String, EntityValues> proxies = new LinkedHashMap<>();
        grouped.forEach((name, objects) ->
                proxies.put(name, new EntityValues(name, objects, definitions == null ? null : definitions.get(name))));
        if (definitions != null) {
            definitions.forEach((name, values) ->
                    proxies.putIfAbsent(name, new EntityValues(name, List.of(), values)));
        }
        return new EntitiesResult(Map.copyOf(proxies), all);
    }

    public List<RecognizedEntity> getAllObjects() {
        return allObjects;
    }

    /**
     * Entities with the given name; empty when the entity is defined but not recognized.
     *
     * @throws IllegalArgumentException the entity is neither recognized nor defined
     */
    public EntityValues get(String name) {
        EntityValues values = proxies.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No such entity: '" + name + "'.");
        }
        return values;
    }

    public boolean contains(String name) {
        return proxies.containsKey(name);
    }

    @Override
    public String toString() {
        return "EntitiesResult(all_objects=" + allObjects + ")";
    }
}
