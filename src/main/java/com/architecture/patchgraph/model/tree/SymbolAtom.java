package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Symbol box ({@code #X symbolatom}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class SymbolAtom implements GuiElement {

    @With
    @Builder.Default
    Position position = Position.ORIGIN;
    @Builder.Default
    int width = 10;
    @Builder.Default
    double lowerLimit = 0;
    @Builder.Default
    double upperLimit = 0;
    @Builder.Default
    int labelPos = 0;
    @Builder.Default
    String label = "-";
    @Builder.Default
    String receive = "-";
    @Builder.Default
    String send = "-";

    @Override
    public ElementKind getKind() {
        return ElementKind.SYMBOL_ATOM;
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
