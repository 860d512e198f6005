package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Canvas-local (x, y) coordinate of an element.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class Position {

    public static final Position ORIGIN = Position.of(0, 0);

    int x;
    int y;
}
