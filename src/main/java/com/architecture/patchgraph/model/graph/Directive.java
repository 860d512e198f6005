package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.PatchElement;

/**
 * Non-node statement carried through a graph unchanged (declare, coords, unmodelled
 * statements). {@code anchor} is the number of nodes that precede it.
 */
public record Directive(int anchor, PatchElement element) {
}
