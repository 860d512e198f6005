package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where a new node should go: relative to the previous nodes, or at an absolute position.
 *
 * <p>{@code newRow} below 1 continues the current row; 1 starts a new row and larger values add
 * extra space above it. {@code newCol} shifts the node right by that many columns.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Placement {

    double newRow;
    double newCol;
    Position absolute;

    public static Placement nextRow() {
        return new Placement(1, 0, null);
    }

    public static Placement sameRow() {
        return new Placement(0, 0, null);
    }

    public static Placement relative(double newRow, double newCol) {
        return new Placement(newRow, newCol, null);
    }

    public static Placement at(int x, int y) {
        return new Placement(1, 0, Position.of(x, y));
    }

    public static Placement at(Position position) {
        return new Placement(1, 0, position);
    }

    public boolean isAbsolute() {
        return absolute != null;
    }
}
