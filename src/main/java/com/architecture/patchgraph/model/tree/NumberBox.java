package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * IEM number box ({@code nbx}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class NumberBox implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int width = 5;
    @Builder.Default
    int height = 14;
    @Builder.Default
    double minValue = -1e37;
    @Builder.Default
    double maxValue = 1e37;
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
    int labelY = -8;
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
    int logHeight = 256;

    @Override
    public ElementKind getKind() {
        return ElementKind.NUMBER_BOX;
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
