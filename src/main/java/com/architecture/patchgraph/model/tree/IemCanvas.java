package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Decorative IEM canvas ({@code cnv}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class IemCanvas implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int size = IemDefaults.SIZE;
    @Builder.Default
    int width = 100;
    @Builder.Default
    int height = 60;
    @Builder.Default
    String send = "empty";
    @Builder.Default
    String receive = "empty";
    @Builder.Default
    String label = "empty";
    @Builder.Default
    int labelX = 20;
    @Builder.Default
    int labelY = 12;
    @Builder.Default
    int font = 0;
    @Builder.Default
    int fontSize = 14;
    @Builder.Default
    int bgColor = -233017;
    @Builder.Default
    int labelColor = IemDefaults.LABEL_COLOR;

    @Override
    public ElementKind getKind() {
        return ElementKind.CANVAS;
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
