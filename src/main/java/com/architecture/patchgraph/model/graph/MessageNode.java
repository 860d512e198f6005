package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

/**
 * Message box; two inlets (trigger and set) and one outlet unless told otherwise.
 */
@Getter
public class MessageNode extends GraphNode {

    private final String text;

    public MessageNode(Position position, String text) {
        this(position, text, 2, 1);
    }

    public MessageNode(Position position, String text, Integer numInlets, Integer numOutlets) {
        super(position, numInlets, numOutlets);
        this.text = text == null ? "" : text;
    }

    @Override
    public int getWidth() {
        return TextBoxes.width(text);
    }

    @Override
    public int getHeight() {
        return TextBoxes.height(text);
    }

    @Override
    public String toString() {
        return "Msg(" + getPosition().getX() + ", " + getPosition().getY() + ", '" + text + "')";
    }
}
