package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Vertical radio buttons ({@code vradio}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class VerticalRadio implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int size = IemDefaults.SIZE;
    @Builder.Default
    int newOld = 0;
    @Builder.Default
    int init = 0;
    @Builder.Default
    int number = 8;
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
    int initValue = 0;

    @Override
    public ElementKind getKind() {
        return ElementKind.VERTICAL_RADIO;
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
