package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.exception.PatchConnectionException;
import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;
import lombok.Setter;

/**
 * A node of a {@link PatchGraph}. Port counts are nullable: null means the count is unknown or
 * depends on creation arguments, and such ports are never bounds-checked.
 *
 * <p>Nodes compare by identity; a graph only accepts links between nodes it holds.</p>
 */
@Getter
@Setter
public abstract class GraphNode {

    protected static final int ROW_HEIGHT = 25;

    private Position position;
    private Integer numInlets;
    private Integer numOutlets;

    protected GraphNode(Position position, Integer numInlets, Integer numOutlets) {
        this.position = position;
        this.numInlets = numInlets;
        this.numOutlets = numOutlets;
    }

    /**
     * Hidden nodes have no place on the canvas and are skipped by layout.
     */
    public boolean isHidden() {
        return false;
    }

    /**
     * Whether the node routes messages wirelessly through a non-default send or receive name.
     */
    public boolean hasActiveSendReceive() {
        return false;
    }

    /**
     * Approximate on-canvas width, used to place the next node on the same row.
     */
    public int getWidth() {
        return 0;
    }

    /**
     * Approximate on-canvas height, used to place the next row.
     */
    public int getHeight() {
        return 0;
    }

    public Outlet outlet(int index) {
        if (index < 0) {
            throw new PatchConnectionException("Outlet index must be non-negative, got " + index);
        }
        if (numOutlets != null && index >= numOutlets) {
            throw new PatchConnectionException("Outlet index " + index + " out of range for " + this
                    + " (has " + numOutlets + " outlet" + (numOutlets == 1 ? "" : "s") + ")");
        }
        return new Outlet(this, index);
    }
}
