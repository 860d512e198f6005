package com.architecture.patchgraph.model.tree;

import lombok.Value;

import java.util.List;

/**
 * Root of a parsed patch: the main canvas and its elements.
 */
@Value
public class Patch implements ElementContainer {

    CanvasProperties canvas;
    List<PatchElement> elements;

    public Patch(CanvasProperties canvas, List<PatchElement> elements) {
        this.canvas = canvas;
        this.elements = List.copyOf(elements);
    }

    public Patch withElements(List<PatchElement> newElements) {
        return new Patch(canvas, newElements);
    }
}
