package com.architecture.patchgraph.model.tree;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code #X declare} directive. Arguments are kept verbatim; {@link #getPaths()} pulls out
 * the values following each {@code -path} flag.
 */
@Value
public class Declare implements PatchElement {

    List<String> args;

    public Declare(List<String> args) {
        this.args = List.copyOf(args);
    }

    public List<String> getPaths() {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < args.size() - 1; i++) {
            if ("-path".equals(args.get(i))) {
                paths.add(args.get(i + 1));
                i++;
            }
        }
        return paths;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.DECLARE;
    }
}
