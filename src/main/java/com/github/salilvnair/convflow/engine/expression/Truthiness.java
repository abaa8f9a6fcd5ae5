package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.convflow.engine.context.EntityValues;
import com.github.salilvnair.convflow.engine.context.RpcContext;
import lombok.experimental.UtilityClass;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

@UtilityClass
public class Truthiness {

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0d;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Optional<?> o) {
            return o.map(Truthiness::isTruthy).orElse(false);
        }
        if (value instanceof EntityValues e) {
            return !e.isEmpty();
        }
        if (value instanceof RpcContext r) {
            return r.isPresent();
        }
        if (value instanceof JsonNode node) {
            return isTruthy(node);
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0d;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }
}
