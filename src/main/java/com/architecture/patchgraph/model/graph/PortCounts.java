package com.architecture.patchgraph.model.graph;

/**
 * Inlet/outlet counts; a null count means "variable or unknown".
 */
public record PortCounts(Integer inlets, Integer outlets) {

    public static final PortCounts UNKNOWN = new PortCounts(null, null);

    public static PortCounts of(int inlets, int outlets) {
        return new PortCounts(inlets, outlets);
    }
}
