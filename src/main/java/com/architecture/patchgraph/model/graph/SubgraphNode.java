package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

/**
 * Sub-patch box. Owns an inner graph with its own coordinate system and layout state;
 * the node's position is in the parent's coordinates.
 */
@Getter
public class SubgraphNode extends GraphNode {

    private final String name;
    private final PatchGraph graph;
    private final int canvasWidth;
    private final int canvasHeight;
    private final boolean graphOnParent;
    private final boolean hideName;
    private final int gopWidth;
    private final int gopHeight;
    private final String restoreKind;

    public SubgraphNode(Position position, String name, PatchGraph graph, Integer numInlets,
                        Integer numOutlets, SubgraphSettings settings) {
        super(position, numInlets, numOutlets);
        this.name = name;
        this.graph = graph;
        this.canvasWidth = settings.getCanvasWidth();
        this.canvasHeight = settings.getCanvasHeight();
        this.graphOnParent = settings.isGraphOnParent();
        this.hideName = settings.isHideName();
        this.gopWidth = settings.getGopWidth();
        this.gopHeight = settings.getGopHeight();
        this.restoreKind = settings.getRestoreKind();
    }

    @Override
    public int getWidth() {
        if (graphOnParent) {
            return gopWidth;
        }
        return Math.max(TextBoxes.MIN_WIDTH, TextBoxes.PADDING + (restoreKind + " " + name).length() * TextBoxes.CHAR_WIDTH);
    }

    @Override
    public int getHeight() {
        return graphOnParent ? gopHeight : ROW_HEIGHT;
    }

    @Override
    public String toString() {
        return "Subpatch(" + getPosition().getX() + ", " + getPosition().getY() + ", '" + name + "')";
    }
}
