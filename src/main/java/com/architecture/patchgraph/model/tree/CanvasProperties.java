package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Properties of a {@code #N canvas} statement.
 * A non-null name marks a nested sub-canvas; the root canvas carries a font size instead.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class CanvasProperties {

    public static final String DEFAULT_SUBPATCH_NAME = "(subpatch)";

    @Builder.Default
    int x = 0;
    @Builder.Default
    int y = 50;
    @Builder.Default
    int width = 1000;
    @Builder.Default
    int height = 600;
    @Builder.Default
    int fontSize = 10;
    String name;
    @Builder.Default
    int openOnLoad = 0;

    public static CanvasProperties root() {
        return CanvasProperties.builder().build();
    }

    public static CanvasProperties subCanvas(int width, int height) {
        return CanvasProperties.builder()
                .x(0)
                .y(0)
                .width(width)
                .height(height)
                .name(DEFAULT_SUBPATCH_NAME)
                .build();
    }

    public boolean isSubCanvas() {
        return name != null;
    }
}
