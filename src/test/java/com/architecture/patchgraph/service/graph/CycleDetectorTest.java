package com.architecture.patchgraph.service.graph;

import com.architecture.patchgraph.dto.CycleReport;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.ObjectNode;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.tree.Position;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    @Test
    void detectCycles_returnsNothingForChain() {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("loadbang");
        ObjectNode b = graph.add("f");
        ObjectNode c = graph.add("print");
        graph.link(a, b);
        graph.link(b, c);

        assertThat(detector.detectCycles(graph)).isEmpty();
    }

    @Test
    void detectCycles_findsTwoNodeLoop() {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("f");
        ObjectNode b = graph.add("+ 1");
        graph.link(a, b);
        graph.link(b, a, 0, 1);

        assertThat(detector.detectCycles(graph)).containsExactly(List.of(0, 1, 0));
    }

    @Test
    void detectCycles_findsSelfLoop() {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("f");
        graph.link(a, a, 0, 1);

        assertThat(detector.detectCycles(graph)).containsExactly(List.of(0, 0));
    }

    @Test
    void detectCycles_isReproducibleRegardlessOfConnectionOrder() {
        PatchGraph first = threeNodeLoop(false);
        PatchGraph second = threeNodeLoop(true);

        assertThat(detector.detectCycles(first))
                .containsExactly(List.of(0, 1, 2, 0))
                .isEqualTo(detector.detectCycles(second));
    }

    @Test
    void detectCycles_ignoresDanglingConnections() {
        PatchGraph graph = new PatchGraph();
        graph.add("f");
        graph.addConnection(new Connection(0, 0, 4, 0));

        assertThat(detector.detectCycles(graph)).isEmpty();
    }

    @Test
    void report_describesNodesAlongCycle() {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("f");
        ObjectNode b = graph.add("+ 1");
        graph.link(a, b);
        graph.link(b, a, 0, 1);

        List<CycleReport> reports = detector.report(graph);

        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).getNodeIndices()).containsExactly(0, 1, 0);
        assertThat(reports.get(0).getDescription())
                .isEqualTo(a + " -> " + b + " -> " + a)
                .contains("'+ 1'");
    }

    @Test
    void detectCycles_findsLoopsInSeparateComponents() {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("f");
        ObjectNode b = graph.add("+ 1");
        ObjectNode c = graph.add("f");
        ObjectNode d = graph.add("+ 1");
        graph.link(a, b);
        graph.link(b, a, 0, 1);
        graph.link(c, d);
        graph.link(d, c, 0, 1);

        assertThat(detector.detectCycles(graph)).containsExactly(List.of(0, 1, 0), List.of(2, 3, 2));
    }

    @Test
    void detectCycles_staysLinearWithManyUnconnectedNodes() {
        int count = 200_000;
        PatchGraph graph = new PatchGraph();
        for (int i = 0; i < count; i++) {
            graph.insert(new ObjectNode(Position.of(0, 0), "f", 2, 1));
        }
        graph.addConnection(new Connection(count - 2, 0, count - 1, 0));
        graph.addConnection(new Connection(count - 1, 0, count - 2, 1));

        List<List<Integer>> cycles = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> detector.detectCycles(graph));

        assertThat(cycles).containsExactly(List.of(count - 2, count - 1, count - 2));
    }

    private PatchGraph threeNodeLoop(boolean reversed) {
        PatchGraph graph = new PatchGraph();
        ObjectNode a = graph.add("f");
        ObjectNode b = graph.add("+ 1");
        ObjectNode c = graph.add("moses 10");
        if (reversed) {
            graph.link(c, a, 0, 1);
            graph.link(b, c);
            graph.link(a, b);
        } else {
            graph.link(a, b);
            graph.link(b, c);
            graph.link(c, a, 0, 1);
        }
        return graph;
    }
}
