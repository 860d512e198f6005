package com.architecture.patchgraph.service.graph;

import com.architecture.patchgraph.dto.ConnectionStats;
import com.architecture.patchgraph.dto.CycleReport;
import com.architecture.patchgraph.dto.ValidationReport;
import com.architecture.patchgraph.exception.InvalidConnectionException;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.PatchGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks connection port indices against the declared inlet/outlet counts of their nodes.
 *
 * Nodes with an unknown count are never flagged on that side. All violations of a graph are
 * collected in one pass before anything is reported.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionValidator {

    private final CycleDetector cycleDetector;

    /**
     * Validate and throw if any connection is out of range.
     *
     * @throws InvalidConnectionException listing every violation found
     */
    public ValidationReport validate(PatchGraph graph, boolean checkCycles) {
        ValidationReport report = inspect(graph, checkCycles);
        if (!report.isValid()) {
            throw new InvalidConnectionException(report.getViolations());
        }
        return report;
    }

    /**
     * Validate without throwing: violations, cycle warnings and statistics in one report.
     */
    public ValidationReport inspect(PatchGraph graph, boolean checkCycles) {
        List<String> violations = findViolations(graph);
        List<CycleReport> cycles = checkCycles ? cycleDetector.report(graph) : new ArrayList<>();

        log.info("[Validator] Checked {} connections: {} violation(s), {} cycle warning(s)",
                graph.getConnections().size(), violations.size(), cycles.size());

        return ValidationReport.builder()
                .valid(violations.isEmpty())
                .violations(violations)
                .cycles(cycles)
                .stats(stats(graph))
                .build();
    }

    public List<String> findViolations(PatchGraph graph) {
        List<String> violations = new ArrayList<>();

        for (Connection c : graph.getConnections()) {
            if (!graph.isNodeIndex(c.getSource()) || !graph.isNodeIndex(c.getSink())) {
                violations.add(c + " references missing node (patch has " + graph.size() + " nodes)");
                continue;
            }
            GraphNode source = graph.getNode(c.getSource());
            GraphNode sink = graph.getNode(c.getSink());

            if (source.getNumOutlets() != null) {
                if (c.getOutlet() >= source.getNumOutlets()) {
                    violations.add("Invalid outlet index " + c.getOutlet() + " on " + source
                            + " (has " + source.getNumOutlets() + " outlets)");
                } else if (c.getOutlet() < 0) {
                    violations.add("Negative outlet index " + c.getOutlet() + " on " + source);
                }
            }

            if (sink.getNumInlets() != null) {
                if (c.getInlet() >= sink.getNumInlets()) {
                    violations.add("Invalid inlet index " + c.getInlet() + " on " + sink
                            + " (has " + sink.getNumInlets() + " inlets)");
                } else if (c.getInlet() < 0) {
                    violations.add("Negative inlet index " + c.getInlet() + " on " + sink);
                }
            }
        }
        violations.forEach(v -> log.debug("[Validator] {}", v));
        return violations;
    }

    public ConnectionStats stats(PatchGraph graph) {
        List<Connection> connections = graph.getConnections();
        if (connections.isEmpty()) {
            return ConnectionStats.builder().build();
        }

        Set<Integer> connected = new HashSet<>();
        int maxInlet = 0;
        int maxOutlet = 0;
        for (Connection c : connections) {
            connected.add(c.getSource());
            connected.add(c.getSink());
            maxInlet = Math.max(maxInlet, c.getInlet());
            maxOutlet = Math.max(maxOutlet, c.getOutlet());
        }

        long withCounts = graph.getNodes().stream()
                .filter(n -> n.getNumInlets() != null || n.getNumOutlets() != null)
                .count();
        double coverage = graph.size() == 0 ? 0.0 : withCounts * 100.0 / graph.size();

        return ConnectionStats.builder()
                .totalConnections(connections.size())
                .nodesWithConnections(connected.size())
                .maxInletUsed(maxInlet)
                .maxOutletUsed(maxOutlet)
                .validationCoverage(Math.round(coverage * 10.0) / 10.0)
                .build();
    }
}
