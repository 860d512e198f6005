package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * VU meter ({@code vu}); two signal inlets (RMS and peak), no outlets, no send name.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class VuMeter implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int width = 15;
    @Builder.Default
    int height = 120;
    @Builder.Default
    String receive = "empty";
    @Builder.Default
    String label = "empty";
    @Builder.Default
    int labelX = -1;
    @Builder.Default
    int labelY = -8;
    @Builder.Default
    int font = 0;
    @Builder.Default
    int fontSize = 10;
    @Builder.Default
    int bgColor = IemDefaults.BG_COLOR;
    @Builder.Default
    int labelColor = IemDefaults.LABEL_COLOR;
    @Builder.Default
    int scale = 1;

    @Override
    public String getSend() {
        return "empty";
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.VU_METER;
    }

    @Override
    public int inletCount() {
        return 2;
    }

    @Override
    public int outletCount() {
        return 0;
    }
}
