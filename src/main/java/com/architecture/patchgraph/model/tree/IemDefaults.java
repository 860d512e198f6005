package com.architecture.patchgraph.model.tree;

/**
 * Stock IEM widget colours and size.
 */
public final class IemDefaults {

    public static final int BG_COLOR = -262144;
    public static final int FG_COLOR = -1;
    public static final int LABEL_COLOR = -1;
    public static final int SIZE = 15;

    private IemDefaults() {
    }
}
