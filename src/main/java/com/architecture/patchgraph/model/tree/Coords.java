package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Graph-on-parent coordinates ({@code #X coords}) of the enclosing canvas.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class Coords implements PatchElement {

    double xFrom;
    double yFrom;
    double xTo;
    double yTo;
    int width;
    int height;
    @Builder.Default
    int graphOnParent = 1;
    @Builder.Default
    int hideName = 0;
    @Builder.Default
    int xMargin = 0;
    @Builder.Default
    int yMargin = 0;

    @Override
    public ElementKind getKind() {
        return ElementKind.COORDS;
    }
}
