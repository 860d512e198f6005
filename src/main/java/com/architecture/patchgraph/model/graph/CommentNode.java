package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

@Getter
public class CommentNode extends GraphNode {

    private final String content;

    public CommentNode(Position position, String content) {
        super(position, 0, 0);
        this.content = content == null ? "" : content;
    }

    @Override
    public int getWidth() {
        return TextBoxes.width(content);
    }

    @Override
    public int getHeight() {
        return TextBoxes.height(content);
    }

    @Override
    public String toString() {
        return "Comment(" + getPosition().getX() + ", " + getPosition().getY() + ", '" + content + "')";
    }
}
