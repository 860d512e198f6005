package com.architecture.patchgraph.model.tree;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of element kinds a canvas can hold.
 *
 * Addressable kinds are the ones counted by connection indices; directives
 * (connections, coords, declare, raw statements) are skipped when numbering.
 */
public enum ElementKind {

    OBJECT(true, null),
    MESSAGE(true, null),
    FLOAT_ATOM(true, null),
    SYMBOL_ATOM(true, null),
    COMMENT(true, null),
    ARRAY(true, null),
    SUBPATCH(true, null),
    BANG(true, "bng"),
    TOGGLE(true, "tgl"),
    NUMBER_BOX(true, "nbx"),
    VERTICAL_SLIDER(true, "vsl"),
    HORIZONTAL_SLIDER(true, "hsl"),
    VERTICAL_RADIO(true, "vradio"),
    HORIZONTAL_RADIO(true, "hradio"),
    CANVAS(true, "cnv"),
    VU_METER(true, "vu"),
    CONNECT(false, null),
    COORDS(false, null),
    DECLARE(false, null),
    RAW(false, null);

    private final boolean addressable;
    private final String widgetKeyword;

    ElementKind(boolean addressable, String widgetKeyword) {
        this.addressable = addressable;
        this.widgetKeyword = widgetKeyword;
    }

    public boolean isAddressable() {
        return addressable;
    }

    /**
     * Object keyword for IEM widget kinds ({@code bng}, {@code tgl}, ...), null otherwise.
     */
    public String getWidgetKeyword() {
        return widgetKeyword;
    }

    public boolean isWidget() {
        return widgetKeyword != null;
    }

    public static Optional<ElementKind> forWidgetKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> keyword.equals(kind.widgetKeyword))
                .findFirst();
    }
}
