package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Vertical slider ({@code vsl}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class VerticalSlider implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int width = 15;
    @Builder.Default
    int height = 128;
    @Builder.Default
    double minValue = 0;
    @Builder.Default
    double maxValue = 127;
    @Builder.Default
    int logFlag = 0;
    @Builder.Default
    int init = 0;
    @Builder.Default
    String send = "empty";
    @Builder.Default
    String receive = "empty";
    @Builder.Default
    String label = "empty";
    @Builder.Default
    int labelX = 0;
    @Builder.Default
    int labelY = -9;
    @Builder.Default
    int font = 0;
    @Builder.Default
    int fontSize = 10;
    @Builder.Default
    int bgColor = IemDefaults.BG_COLOR;
    @Builder.Default
    int fgColor = IemDefaults.FG_COLOR;
    @Builder.Default
    int labelColor = IemDefaults.LABEL_COLOR;
    @Builder.Default
    double initValue = 0;
    @Builder.Default
    int steady = 1;

    @Override
    public ElementKind getKind() {
        return ElementKind.VERTICAL_SLIDER;
    }

    @Override
    public int inletCount() {
        return 1;
    }

    @Override
    public int outletCount() {
        return 1;
    }
}
