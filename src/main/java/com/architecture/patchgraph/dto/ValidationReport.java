package com.architecture.patchgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking a graph's connections: every port-bound violation, plus cycle warnings
 * and connection statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private boolean valid;
    @Builder.Default
    private List<String> violations = new ArrayList<>();
    @Builder.Default
    private List<CycleReport> cycles = new ArrayList<>();
    private ConnectionStats stats;
}
