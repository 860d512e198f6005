package com.architecture.patchgraph.model.tree;

import java.util.Set;

/**
 * Positioned element with a fixed port layout and optional wireless send/receive names:
 * the number/symbol atoms and the IEM widgets.
 */
public interface GuiElement extends PatchElement {

    /** Values meaning "no send/receive name" across atom and widget kinds. */
    Set<String> INACTIVE_NAMES = Set.of("empty", "-", "");

    Position getPosition();

    GuiElement withPosition(Position position);

    String getSend();

    String getReceive();

    int inletCount();

    int outletCount();

    default boolean hasActiveSendReceive() {
        return isActive(getSend()) || isActive(getReceive());
    }

    static boolean isActive(String name) {
        return name != null && !INACTIVE_NAMES.contains(name);
    }
}
