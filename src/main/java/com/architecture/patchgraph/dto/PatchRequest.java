package com.architecture.patchgraph.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchRequest {

    @NotBlank(message = "Patch content is required")
    private String content;

    // optimize only; null falls back to the configured defaults
    private Set<String> collapsibleObjects;
    private boolean recursive;

    // validate only
    @Builder.Default
    private boolean checkCycles = true;
}
