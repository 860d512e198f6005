package com.architecture.patchgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rewritten patch text plus what was done to it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchResponse {

    private String content;
    private int nodeCount;
    private int connectionCount;
    private OptimizationStats optimization;
}
