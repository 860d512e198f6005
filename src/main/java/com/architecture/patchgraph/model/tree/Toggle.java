package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Toggle ({@code tgl}). {@code defaultValue} is the non-zero value sent when switched on.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class Toggle implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int size = IemDefaults.SIZE;
    @Builder.Default
    int init = 0;
    @Builder.Default
    String send = "empty";
    @Builder.Default
    String receive = "empty";
    @Builder.Default
    String label = "empty";
    @Builder.Default
    int labelX = 17;
    @Builder.Default
    int labelY = 7;
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
    int initValue = 0;
    @Builder.Default
    int defaultValue = 0;

    @Override
    public ElementKind getKind() {
        return ElementKind.TOGGLE;
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
