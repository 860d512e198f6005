package com.architecture.patchgraph.model.tree;

/**
 * One element of a canvas: an object, a box, a widget, a nested sub-canvas or a directive.
 */
public interface PatchElement {

    ElementKind getKind();

    default boolean isAddressable() {
        return getKind().isAddressable();
    }
}
