package com.architecture.patchgraph.model.tree;

import com.architecture.patchgraph.service.parser.StatementTokenizer;
import lombok.Value;

import java.util.List;

/**
 * Generic object box ({@code #X obj}): a class name followed by its creation arguments,
 * kept as raw (escape-compliant) tokens. Unknown classes always land here.
 */
@Value
public class ObjectBox implements PatchElement {

    Position position;
    String className;
    List<String> args;

    public ObjectBox(Position position, String className, List<String> args) {
        this.position = position;
        this.className = className;
        this.args = List.copyOf(args);
    }

    public ObjectBox(Position position, String className) {
        this(position, className, List.of());
    }

    /**
     * Splits escaped object text on unescaped whitespace: the first token becomes the class name.
     */
    public static ObjectBox fromText(Position position, String text) {
        List<String> parts = text == null ? List.of() : StatementTokenizer.tokenize(text);
        if (parts.isEmpty()) {
            return new ObjectBox(position, "");
        }
        return new ObjectBox(position, parts.get(0), parts.subList(1, parts.size()));
    }

    public String getText() {
        if (args.isEmpty()) {
            return className;
        }
        return className + " " + String.join(" ", args);
    }

    public ObjectBox withArgs(List<String> newArgs) {
        return new ObjectBox(position, className, newArgs);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.OBJECT;
    }
}
