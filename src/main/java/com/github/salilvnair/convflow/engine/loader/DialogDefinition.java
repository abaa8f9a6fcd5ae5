package com.github.salilvnair.convflow.engine.loader;

import com.github.salilvnair.convflow.engine.flow.tree.DialogTree;
import com.github.salilvnair.convflow.engine.flow.tree.definition.DialogItemDefinition;
import com.github.salilvnair.convflow.engine.flow.tree.definition.SubtreeDefinition;

import java.util.List;

/**
 * Parsed dialog resources: the root nodes and the subtrees they reference.
 */
public record DialogDefinition(
        List<DialogItemDefinition> dialog,
        List<SubtreeDefinition> subtrees
) {

    public DialogDefinition {
        dialog = dialog == null ? List.of() : List.copyOf(dialog);
        subtrees = subtrees == null ? List.of() : List.copyOf(subtrees);
    }

    public DialogTree toDialogTree() {
        return new DialogTree(dialog, subtrees);
    }
}
