package com.architecture.patchgraph.model.tree;

import lombok.Value;

import java.util.List;

/**
 * Nested canvas. The restore directive is absent when the input ended before the
 * sub-canvas was closed.
 */
@Value
public class SubPatch implements PatchElement, ElementContainer {

    CanvasProperties canvas;
    List<PatchElement> elements;
    Restore restore;

    public SubPatch(CanvasProperties canvas, List<PatchElement> elements, Restore restore) {
        this.canvas = canvas;
        this.elements = List.copyOf(elements);
        this.restore = restore;
    }

    public SubPatch withElements(List<PatchElement> newElements) {
        return new SubPatch(canvas, newElements, restore);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SUBPATCH;
    }
}
