package com.github.salilvnair.convflow.engine.flow.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The current and digressed nodes, kept in the persisted flow state as a list of
 * {@code [label, transition]} pairs. The top of the stack is the last element.
 */
@Slf4j
public class NodeStack {

    private final ArrayNode stack;
    private final Tree tree;

    /**
     * @param stack reference to the underlying state variable, mutated in place
     * @param tree  tree used to resolve labels
     */
    public NodeStack(ArrayNode stack, Tree tree) {
        this.stack = stack;
        this.tree = tree;
    }

    /**
     * Get rid of entries whose node was removed from the tree, and of malformed entries.
     */
    public void gc() {
        for (int i = stack.size() - 1; i >= 0; i--) {
            JsonNode entry = stack.get(i);
            if (!isWellFormed(entry) || !tree.contains(entry.get(0).asText())) {
                log.debug("gc stale stack entry {}", entry);
                stack.remove(i);
            }
        }
    }

    /**
     * Push the node onto the stack, removing its other occurrences.
     */
    public void push(Node node, NodeTransition transition) {
        remove(node);
        ArrayNode entry = stack.addArray();
        entry.add(node.getLabel());
        entry.add(transition.value());
    }

    public Optional<StackEntry> pop() {
        if (stack.isEmpty()) {
            return Optional.empty();
        }
        JsonNode entry = stack.remove(stack.size() - 1);
        return Optional.of(resolve(entry));
    }

    public Optional<StackEntry> peek() {
        if (stack.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resolve(stack.get(stack.size() - 1)));
    }

    /**
     * Remove every entry of the node.
     *
     * @return whether the node was found on the stack
     */
    public boolean remove(Node node) {
        if (node.getLabel() == null) {
            return false;
        }
        boolean found = false;
        for (int i = stack.size() - 1; i >= 0; i--) {
            JsonNode entry = stack.get(i);
            if (entry.isArray() && node.getLabel().equals(entry.path(0).asText(null))) {
                stack.remove(i);
                found = true;
            }
        }
        return found;
    }

    public void clear() {
        stack.removeAll();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int size() {
        return stack.size();
    }

    /**
     * Snapshot of the entries, bottom first.
     */
    public List<List<String>> entries() {
        List<List<String>> entries = new ArrayList<>();
        for (JsonNode entry : stack) {
            entries.add(List.of(entry.get(0).asText(), entry.get(1).asText()));
        }
        return entries;
    }

    private StackEntry resolve(JsonNode entry) {
        String label = entry.get(0).asText();
        Node node = tree.find(label).orElseThrow(() -> new DialogFlowException(
                DialogFlowErrorCode.INTERNAL_ERROR,
                "Node '" + label + "' is not in the tree"
        ));
        return new StackEntry(node, NodeTransition.fromValue(entry.get(1).asText()));
    }

    private static boolean isWellFormed(JsonNode entry) {
        return entry != null
                && entry.isArray()
                && entry.size() == 2
                && entry.get(0).isTextual()
                && entry.get(1).isTextual();
    }

    public record StackEntry(Node node, NodeTransition transition) {
    }
}
