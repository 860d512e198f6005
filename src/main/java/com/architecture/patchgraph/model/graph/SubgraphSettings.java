package com.architecture.patchgraph.model.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link PatchGraph#addSubgraph}. Null port counts are inferred from the inner
 * graph's {@code inlet}/{@code outlet} objects.
 */
@Value
@Builder(toBuilder = true)
public class SubgraphSettings {

    public static final int DEFAULT_CANVAS_WIDTH = 300;
    public static final int DEFAULT_CANVAS_HEIGHT = 180;

    Integer numInlets;
    Integer numOutlets;
    @Builder.Default
    int canvasWidth = DEFAULT_CANVAS_WIDTH;
    @Builder.Default
    int canvasHeight = DEFAULT_CANVAS_HEIGHT;
    boolean inheritLayout;
    boolean graphOnParent;
    boolean hideName;
    @Builder.Default
    int gopWidth = 85;
    @Builder.Default
    int gopHeight = 60;
    // restore kind written for the box: pd for sub-patches, graph for array graphs
    @Builder.Default
    String restoreKind = "pd";

    public static SubgraphSettings defaults() {
        return SubgraphSettings.builder().build();
    }
}
