package com.github.salilvnair.convflow.engine.flow.tree.definition;

public record SubtreeRef(String subtree) implements DialogItemDefinition {
}
