package com.github.salilvnair.convflow.engine.expression.spel;

import com.github.salilvnair.convflow.engine.context.EntitiesResult;
import com.github.salilvnair.convflow.engine.context.EntityValues;
import com.github.salilvnair.convflow.engine.context.IntentsResult;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

import java.util.Set;

/**
 * Exposes recognition results by name: {@code intents.greeting}, {@code entities.city},
 * {@code entities.city.value}, {@code entities.menu.vegan}.
 */
class RecognitionPropertyAccessor implements PropertyAccessor {

    private static final Set<String> ENTITY_ATTRIBUTES = Set.of("name", "value", "literal", "startChar", "endChar");

    @Override
    public Class<?>[] getSpecificTargetClasses() {
        return new Class<?>[]{IntentsResult.class, EntitiesResult.class, EntityValues.class};
    }

    @Override
    public boolean canRead(EvaluationContext context, Object target, String name) {
        return target instanceof IntentsResult || target instanceof EntitiesResult || target instanceof EntityValues;
    }

    @Override
    public TypedValue read(EvaluationContext context, Object target, String name) throws AccessException {
        try {
            return typed(readValue(target, name));
        } catch (IllegalArgumentException e) {
            throw new AccessException(e.getMessage(), e);
        }
    }

    private Object readValue(Object target, String name) {
        if (target instanceof IntentsResult intents) {
            return switch (name) {
                case "top" -> intents.getTop();
                case "ranking" -> intents.getRanking();
                case "irrelevant" -> intents.isIrrelevant();
                default -> intents.get(name).orElse(null);
            };
        }
        if (target instanceof EntitiesResult entities) {
            if ("all_objects".equals(name) || "allObjects".equals(name)) {
                return entities.getAllObjects();
            }
            return entities.get(name);
        }
        EntityValues values = (EntityValues) target;
        switch (name) {
            case "all_values":
            case "allValues":
                return values.getAllValues();
            case "all_objects":
            case "allObjects":
                return values.getAllObjects();
            case "first":
                return values.getFirst();
            default:
                if (values.isEmpty() && ENTITY_ATTRIBUTES.contains(name)) {
                    return null;
                }
                return values.get(name);
        }
    }

    private TypedValue typed(Object value) {
        return value == null ? TypedValue.NULL : new TypedValue(value);
    }

    @Override
    public boolean canWrite(EvaluationContext context, Object target, String name) {
        return false;
    }

    @Override
    public void write(EvaluationContext context, Object target, String name, Object newValue) throws AccessException {
        throw new AccessException("Recognition results are read-only");
    }
}
