package com.architecture.patchgraph.model.graph;

import lombok.Value;

/**
 * Reference to one outlet of a node, used as the source of {@link PatchGraph#link}.
 * Obtained from {@link GraphNode#outlet(int)}.
 */
@Value
public class Outlet {

    GraphNode owner;
    int index;

    @Override
    public String toString() {
        return "Outlet(" + owner + ", " + index + ")";
    }
}
