package com.architecture.patchgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStats {

    private int totalConnections;
    private int nodesWithConnections;
    private int maxInletUsed;
    private int maxOutletUsed;
    private double validationCoverage;   // % of nodes with a declared port count, one decimal
}
