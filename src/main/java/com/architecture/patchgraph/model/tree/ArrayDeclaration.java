package com.architecture.patchgraph.model.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Array declaration ({@code #X array name size type flags}).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class ArrayDeclaration implements PatchElement {

    String name;
    int size;
    @Builder.Default
    String dataType = "float";
    @Builder.Default
    int saveFlag = 0;

    @Override
    public ElementKind getKind() {
        return ElementKind.ARRAY;
    }
}
