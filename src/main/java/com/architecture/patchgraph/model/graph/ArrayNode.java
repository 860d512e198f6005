package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

/**
 * Data array declaration. Hidden: it takes no canvas space and has no ports.
 */
@Getter
public class ArrayNode extends GraphNode {

    private final String name;
    private final int length;
    private final String dataType;
    private final int saveFlag;

    public ArrayNode(String name, int length) {
        this(name, length, "float", 0);
    }

    public ArrayNode(String name, int length, String dataType, int saveFlag) {
        super(Position.ORIGIN, 0, 0);
        this.name = name;
        this.length = length;
        this.dataType = dataType;
        this.saveFlag = saveFlag;
    }

    @Override
    public boolean isHidden() {
        return true;
    }

    @Override
    public String toString() {
        return "Array('" + name + "', " + length + ")";
    }
}
