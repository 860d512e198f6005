package com.architecture.patchgraph.model.tree;

import lombok.Value;

/**
 * {@code #X restore x y kind name} closing a sub-canvas: where the sub-canvas box sits in its
 * parent and what it displays. {@code kind} is {@code pd} for sub-patches, {@code graph} for
 * array graphs.
 */
@Value
public class Restore {

    public static final String SUBPATCH = "pd";

    Position position;
    String kind;
    String name;

    public static Restore subpatch(Position position, String name) {
        return new Restore(position, SUBPATCH, name);
    }
}
