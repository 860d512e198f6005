package com.architecture.patchgraph.service.graph;

import com.architecture.patchgraph.dto.CycleReport;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.PatchGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds connection cycles in a patch graph using DFS.
 *
 * Cycles are legal in patches (feedback loops), so findings are advisory: they are logged
 * and reported, never thrown. Every edge that closes a cycle during traversal yields one
 * cycle, so the same loop can be reported more than once when it is entered from different
 * places.
 */
@Service
@Slf4j
public class CycleDetector {

    /**
     * Detect cycles as lists of node indices, first index repeated at the end.
     * Neighbours are visited in ascending index order so the output is reproducible.
     */
    public List<List<Integer>> detectCycles(PatchGraph graph) {
        Map<Integer, TreeSet<Integer>> adjacency = buildAdjacency(graph);
        List<List<Integer>> cycles = new ArrayList<>();
        boolean[] visited = new boolean[graph.size()];
        // shared across roots; every traversal clears its own entries on unwind
        boolean[] onStack = new boolean[graph.size()];

        for (int start = 0; start < graph.size(); start++) {
            if (!visited[start]) {
                dfs(start, adjacency, visited, onStack, cycles);
            }
        }
        return cycles;
    }

    /**
     * Detect cycles and describe each one with the nodes it passes through.
     */
    public List<CycleReport> report(PatchGraph graph) {
        List<CycleReport> reports = detectCycles(graph).stream()
                .map(cycle -> CycleReport.builder()
                        .nodeIndices(cycle)
                        .description(cycle.stream()
                                .map(i -> String.valueOf(graph.getNode(i)))
                                .collect(Collectors.joining(" -> ")))
                        .build())
                .collect(Collectors.toList());

        reports.forEach(r -> log.warn("[Cycles] Cycle detected: {}", r.getDescription()));
        return reports;
    }

    // ========================= DFS CYCLE DETECTION =========================

    private void dfs(int start, Map<Integer, TreeSet<Integer>> adjacency,
                     boolean[] visited, boolean[] onStack, List<List<Integer>> cycles) {
        List<Integer> path = new ArrayList<>();
        Deque<Iterator<Integer>> frames = new ArrayDeque<>();

        visited[start] = true;
        onStack[start] = true;
        path.add(start);
        frames.push(neighbours(adjacency, start));

        while (!frames.isEmpty()) {
            Iterator<Integer> it = frames.peek();
            if (!it.hasNext()) {
                frames.pop();
                int finished = path.remove(path.size() - 1);
                onStack[finished] = false;
                continue;
            }

            int neighbour = it.next();
            if (!visited[neighbour]) {
                visited[neighbour] = true;
                onStack[neighbour] = true;
                path.add(neighbour);
                frames.push(neighbours(adjacency, neighbour));
            } else if (onStack[neighbour]) {
                List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(neighbour), path.size()));
                cycle.add(neighbour);
                cycles.add(cycle);
            }
        }
    }

    private Iterator<Integer> neighbours(Map<Integer, TreeSet<Integer>> adjacency, int node) {
        TreeSet<Integer> set = adjacency.get(node);
        return set == null ? new TreeSet<Integer>().iterator() : set.iterator();
    }

    private Map<Integer, TreeSet<Integer>> buildAdjacency(PatchGraph graph) {
        Map<Integer, TreeSet<Integer>> adjacency = new HashMap<>();
        for (Connection c : graph.getConnections()) {
            // dangling indices are reported by validation, not here
            if (!graph.isNodeIndex(c.getSource()) || !graph.isNodeIndex(c.getSink())) continue;
            adjacency.computeIfAbsent(c.getSource(), k -> new TreeSet<>()).add(c.getSink());
        }
        return adjacency;
    }
}
