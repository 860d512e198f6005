package com.architecture.patchgraph.config;

import lombok.Builder;
import lombok.Value;

/**
 * Spacing used by dependency-ordered auto-layout.
 */
@Value
@Builder(toBuilder = true)
public class LayoutSettings {

    @Builder.Default
    int margin = 50;
    @Builder.Default
    int rowSpacing = 40;
    @Builder.Default
    int colSpacing = 120;
    @Builder.Default
    boolean alignColumns = true;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder().build();
    }
}
