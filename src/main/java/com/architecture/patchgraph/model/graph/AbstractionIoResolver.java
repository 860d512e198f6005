package com.architecture.patchgraph.model.graph;

import java.nio.file.Path;

/**
 * Works out how many inlets and outlets an abstraction file declares.
 */
@FunctionalInterface
public interface AbstractionIoResolver {

    PortCounts resolve(Path sourcePath);
}
