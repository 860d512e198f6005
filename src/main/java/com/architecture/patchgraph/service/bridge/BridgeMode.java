package com.architecture.patchgraph.service.bridge;

/**
 * What {@link PatchBridge#toGraph} does with a connection whose endpoint index names no element.
 */
public enum BridgeMode {

    /** Skip the connection and log a warning. */
    TOLERANT,

    /** Reject the tree, listing every dangling connection. */
    STRICT
}
