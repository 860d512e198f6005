package com.architecture.patchgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationStats {

    private int nodesRemoved;
    private int connectionsRemoved;
    private int duplicatesRemoved;
    private int passThroughsCollapsed;
    private int subgraphsOptimized;
}
