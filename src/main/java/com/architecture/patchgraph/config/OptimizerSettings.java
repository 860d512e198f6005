package com.architecture.patchgraph.config;

import lombok.Value;

import java.util.Set;

/**
 * Object classes the REST optimize endpoint may collapse when the request names none.
 */
@Value
public class OptimizerSettings {

    Set<String> collapsibleObjects;

    public OptimizerSettings(Set<String> collapsibleObjects) {
        this.collapsibleObjects = Set.copyOf(collapsibleObjects);
    }
}
