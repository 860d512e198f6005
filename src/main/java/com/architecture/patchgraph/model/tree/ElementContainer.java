package com.architecture.patchgraph.model.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Anything that owns an ordered element list: the root patch and nested sub-canvases.
 */
public interface ElementContainer {

    CanvasProperties getCanvas();

    List<PatchElement> getElements();

    /**
     * Elements addressable by connection indices, in declaration order.
     */
    default List<PatchElement> getObjects() {
        return getElements().stream()
                .filter(PatchElement::isAddressable)
                .collect(Collectors.toList());
    }

    default List<Connect> getConnections() {
        return getElements().stream()
                .filter(Connect.class::isInstance)
                .map(Connect.class::cast)
                .collect(Collectors.toList());
    }
}
