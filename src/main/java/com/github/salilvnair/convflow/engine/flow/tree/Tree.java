package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.flow.FlowComponent;
import com.github.salilvnair.convflow.engine.flow.slot.SlotFilling;
import com.github.salilvnair.convflow.engine.flow.tree.definition.DialogItemDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.NodeDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A tree of nodes built once from definitions. Read-only afterwards and shared by all dialogs.
 */
@Slf4j
public class Tree {

    private final Map<String, Node> catalog = new LinkedHashMap<>();
    private final Branch rootNodes;

    // build-time only
    private final Map<String, SubtreeDefinition> subtreeDefinitions = new LinkedHashMap<>();
    private final Set<String> usedSubtrees = new HashSet<>();

    public Tree(List<DialogItemDefinition> dialog, List<SubtreeDefinition> subtrees) {
        for (SubtreeDefinition subtree : subtrees == null ? List.<SubtreeDefinition>of() : subtrees) {
            if (subtreeDefinitions.containsKey(subtree.name())) {
                throw new DialogFlowException(
                        DialogFlowErrorCode.DUPLICATE_SUBTREE,
                        "Duplicate subtree name '" + subtree.name() + "'"
                );
            }
            subtreeDefinitions.put(subtree.name(), subtree);
        }

        this.rootNodes = createBranch(dialog == null ? List.of() : dialog, null);

        List<String> unused = subtreeDefinitions.keySet().stream()
                .filter(name -> !usedSubtrees.contains(name))
                .toList();
        if (!unused.isEmpty()) {
            log.warn("Unused sub-trees: {}", String.join(", ", unused));
        }
        subtreeDefinitions.clear();
        usedSubtrees.clear();
    }

    public Branch getRootNodes() {
        return rootNodes;
    }

    public Map<String, Node> getCatalog() {
        return Collections.unmodifiableMap(catalog);
    }

    public Optional<Node> find(String label) {
        return Optional.ofNullable(label == null ? null : catalog.get(label));
    }

    public boolean contains(String label) {
        return label != null && catalog.containsKey(label);
    }

    private Branch createBranch(List<DialogItemDefinition> definitions, Node parent) {
        List<BranchItem> items = new ArrayList<>();
        for (DialogItemDefinition definition : definitions) {
            if (definition instanceof SubtreeRef ref) {
                items.add(createSubtree(ref, parent));
            } else if (definition instanceof NodeDefinition node) {
                items.add(createNode(node, parent));
            } else {
                throw new DialogFlowException(
                        DialogFlowErrorCode.INVALID_DEFINITION,
                        "Unknown node type " + definition
                );
            }
        }
        List<BranchItem> siblings = List.copyOf(items);
        for (BranchItem item : siblings) {
            if (item instanceof Node node) {
                node.attachSiblings(siblings);
            }
        }
        return new Branch(siblings);
    }

    private Subtree createSubtree(SubtreeRef ref, Node parent) {
        SubtreeDefinition definition = subtreeDefinitions.get(ref.subtree());
        if (definition == null) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.UNKNOWN_SUBTREE,
                    "Sub-tree '" + ref.subtree() + "' not found"
            );
        }
        if (!usedSubtrees.add(ref.subtree())) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.SUBTREE_ALREADY_USED,
                    "Sub-tree '" + ref.subtree() + "' already used"
            );
        }
        return new Subtree(definition.name(), definition.guard(), createBranch(definition.nodes(), parent));
    }

    private Node createNode(NodeDefinition definition, Node parent) {
        String label = definition.getLabel();
        if (label == null && (definition.hasFollowup() || definition.hasSlotFilling())) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.STATEFUL_NODE_WITHOUT_LABEL,
                    "Stateful node must have a label (condition '" + source(definition) + "')"
            );
        }
        if (definition.getCondition() == null || definition.getResponse() == null) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.INVALID_DEFINITION,
                    "Node " + (label == null ? "'" + source(definition) + "'" : "'" + label + "'")
                            + " must have a condition and a response"
            );
        }
        FlowComponent slotFilling = definition.hasSlotFilling()
                ? new FlowComponent(label, new SlotFilling(definition.getSlotFilling(), definition.getSlotHandlers()))
                : null;
        Node node = new Node(
                label,
                definition.getCondition(),
                definition.getResponse(),
                parent,
                definition.getAfterDigressionFollowup(),
                slotFilling
        );
        node.attachFollowup(createBranch(definition.getFollowup(), node));
        if (label != null) {
            if (catalog.containsKey(label)) {
                throw new DialogFlowException(
                        DialogFlowErrorCode.DUPLICATE_NODE_LABEL,
                        "Duplicate node label '" + label + "'"
                );
            }
            catalog.put(label, node);
        }
        return node;
    }

    private String source(NodeDefinition definition) {
        return definition.getCondition() == null ? "?" : definition.getCondition().source();
    }
}
