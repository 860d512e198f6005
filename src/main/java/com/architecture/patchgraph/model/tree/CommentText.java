package com.architecture.patchgraph.model.tree;

import lombok.Value;

/**
 * Comment ({@code #X text}).
 */
@Value
public class CommentText implements PatchElement {

    Position position;
    String content;

    @Override
    public ElementKind getKind() {
        return ElementKind.COMMENT;
    }
}
