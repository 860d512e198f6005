package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Object box backed by an external patch file. Written out exactly like an {@link ObjectNode};
 * the source path only serves to infer port counts.
 */
@Getter
public class AbstractionNode extends ObjectNode {

    private final Path sourcePath;

    public AbstractionNode(Position position, String text, Integer numInlets, Integer numOutlets,
                           Path sourcePath) {
        super(position, text, numInlets, numOutlets);
        this.sourcePath = sourcePath;
    }

    public String getName() {
        return getClassName();
    }

    @Override
    public String toString() {
        return "Abstraction(" + getPosition().getX() + ", " + getPosition().getY() + ", '" + getText() + "')";
    }
}
