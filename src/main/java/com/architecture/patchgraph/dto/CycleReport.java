package com.architecture.patchgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A connection cycle found in a graph. Advisory: feedback loops are legal in patches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleReport {

    private List<Integer> nodeIndices;   // closed path, first index repeated at the end
    private String description;
}
