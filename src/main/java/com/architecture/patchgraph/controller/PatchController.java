package com.architecture.patchgraph.controller;

import com.architecture.patchgraph.config.OptimizerSettings;
import com.architecture.patchgraph.dto.OptimizationStats;
import com.architecture.patchgraph.dto.PatchRequest;
import com.architecture.patchgraph.dto.PatchResponse;
import com.architecture.patchgraph.dto.ValidationReport;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.service.bridge.PatchBridge;
import com.architecture.patchgraph.service.graph.AutoLayoutService;
import com.architecture.patchgraph.service.graph.ConnectionValidator;
import com.architecture.patchgraph.service.graph.GraphOptimizer;
import com.architecture.patchgraph.service.parser.PatchParser;
import com.architecture.patchgraph.service.serializer.PatchSerializer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * REST endpoints over patch text. Every request carries the whole patch document in
 * {@code content}; rewritten patches come back the same way.
 */
@RestController
@RequestMapping("/api/patches")
@RequiredArgsConstructor
@Slf4j
public class PatchController {

    private final PatchParser parser;
    private final PatchSerializer serializer;
    private final PatchBridge bridge;
    private final ConnectionValidator validator;
    private final AutoLayoutService layoutService;
    private final GraphOptimizer optimizer;
    private final OptimizerSettings optimizerSettings;

    /**
     * Check connection bounds. Violations are reported in the body, not as an error status.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validate(@Valid @RequestBody PatchRequest request) {
        PatchGraph graph = toGraph(request);
        log.info("Validating patch: {}", graph);

        ValidationReport report = validator.inspect(graph, request.isCheckCycles());
        return ResponseEntity.ok(report);
    }

    /**
     * Re-position every node by dataflow depth.
     */
    @PostMapping("/layout")
    public ResponseEntity<PatchResponse> layout(@Valid @RequestBody PatchRequest request) {
        PatchGraph graph = toGraph(request);
        log.info("Laying out patch: {}", graph);

        layoutService.layout(graph);
        return ResponseEntity.ok(render(graph, null));
    }

    @PostMapping("/optimize")
    public ResponseEntity<PatchResponse> optimize(@Valid @RequestBody PatchRequest request) {
        PatchGraph graph = toGraph(request);
        Set<String> collapsible = request.getCollapsibleObjects() != null
                ? request.getCollapsibleObjects()
                : optimizerSettings.getCollapsibleObjects();
        log.info("Optimizing patch: {}, collapsible: {}, recursive: {}", graph, collapsible, request.isRecursive());

        OptimizationStats stats = optimizer.optimize(graph, collapsible, request.isRecursive());
        return ResponseEntity.ok(render(graph, stats));
    }

    private PatchGraph toGraph(PatchRequest request) {
        return bridge.toGraph(parser.parse(request.getContent()));
    }

    private PatchResponse render(PatchGraph graph, OptimizationStats stats) {
        return PatchResponse.builder()
                .content(serializer.serialize(bridge.toTree(graph)))
                .nodeCount(graph.size())
                .connectionCount(graph.getConnections().size())
                .optimization(stats)
                .build();
    }
}
