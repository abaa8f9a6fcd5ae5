package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.convflow.engine.context.EntityValues;
import com.github.salilvnair.convflow.engine.context.RecognizedEntity;
import com.github.salilvnair.convflow.engine.context.RecognizedIntent;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Turns recognition results found by {@code check_for} into plain values stored in slots.
 */
@UtilityClass
public class SlotValues {

    public static Object unwrap(Object value) {
        Object plain = value;
        if (plain instanceof Optional<?> o) {
            plain = o.orElse(null);
        }
        if (plain instanceof EntityValues entities) {
            return entities.getValue();
        }
        if (plain instanceof RecognizedEntity entity) {
            return entity.value();
        }
        if (plain instanceof RecognizedIntent) {
            return true;
        }
        if (plain instanceof JsonNode node) {
            return JsonUtil.toPlain(node);
        }
        return plain;
    }
}
