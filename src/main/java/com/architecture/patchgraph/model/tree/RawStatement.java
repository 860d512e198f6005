package com.architecture.patchgraph.model.tree;

import lombok.Value;

import java.util.List;

/**
 * Statement the parser does not model (array data, window hints, unknown directives).
 * Tokens are re-emitted unchanged.
 */
@Value
public class RawStatement implements PatchElement {

    List<String> tokens;

    public RawStatement(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.RAW;
    }
}
