package com.architecture.patchgraph.model.graph.layout;

import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.Placement;
import com.architecture.patchgraph.model.tree.Position;

/**
 * Positions nodes as they are added to a graph. Implementations keep per-graph state
 * (the anchors of the current row), so every graph needs its own instance.
 */
public interface LayoutStrategy {

    /**
     * Position for the next node. Absolute placements are returned unchanged.
     */
    Position compute(Placement placement);

    /**
     * Records a node placed with {@code placement}, updating the anchors used by {@link #compute}.
     */
    void register(GraphNode node, Placement placement);

    /**
     * Forgets all anchors, e.g. after nodes were removed.
     */
    void reset();

    /**
     * Copies spacing settings (not anchors) from another strategy where they are compatible.
     */
    default void inheritSpacing(LayoutStrategy parent) {
    }
}
