package com.architecture.patchgraph.model.tree;

import lombok.Value;

/**
 * Patch cord ({@code #X connect}). Indices count addressable elements of the enclosing canvas.
 */
@Value
public class Connect implements PatchElement {

    int source;
    int outlet;
    int sink;
    int inlet;

    @Override
    public ElementKind getKind() {
        return ElementKind.CONNECT;
    }
}
