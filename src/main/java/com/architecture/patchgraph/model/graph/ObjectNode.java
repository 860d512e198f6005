package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.service.parser.StatementTokenizer;
import lombok.Getter;

import java.util.List;

/**
 * Generic object box. {@code text} is stored escaped: class name then creation arguments.
 */
@Getter
public class ObjectNode extends GraphNode {

    private final String text;

    public ObjectNode(Position position, String text, Integer numInlets, Integer numOutlets) {
        super(position, numInlets, numOutlets);
        this.text = text == null ? "" : text;
    }

    public String getClassName() {
        List<String> tokens = StatementTokenizer.tokenize(text);
        return tokens.isEmpty() ? "" : tokens.get(0);
    }

    public boolean hasArguments() {
        return StatementTokenizer.tokenize(text).size() > 1;
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
        return "Obj(" + getPosition().getX() + ", " + getPosition().getY() + ", '" + text + "')";
    }
}
