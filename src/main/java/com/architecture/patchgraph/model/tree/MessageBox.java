package com.architecture.patchgraph.model.tree;

import lombok.Value;

/**
 * Message box ({@code #X msg}); content keeps its escape sequences.
 */
@Value
public class MessageBox implements PatchElement {

    Position position;
    String content;

    @Override
    public ElementKind getKind() {
        return ElementKind.MESSAGE;
    }
}
