package com.architecture.patchgraph.model.graph;

import lombok.Value;

/**
 * Patch cord between two nodes, as indices into the owning graph's node list.
 */
@Value
public class Connection {

    int source;
    int outlet;
    int sink;
    int inlet;

    @Override
    public String toString() {
        return "Connection(" + source + ", " + outlet + ", " + sink + ", " + inlet + ")";
    }
}
