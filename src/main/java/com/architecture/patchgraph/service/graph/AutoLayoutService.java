package com.architecture.patchgraph.service.graph;

import com.architecture.patchgraph.config.LayoutSettings;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.tree.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Places nodes in rows by dataflow depth: sources on top, sinks at the bottom.
 *
 * Manual positions are ignored. Back-edges found by DFS are left out before depths are
 * computed, so feedback loops do not stop the layout from terminating. Hidden nodes are
 * not placed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AutoLayoutService {

    private final LayoutSettings settings;

    public void layout(PatchGraph graph) {
        layout(graph, settings);
    }

    public void layout(PatchGraph graph, LayoutSettings layoutSettings) {
        int n = graph.size();
        if (n == 0) {
            return;
        }

        List<TreeSet<Integer>> outgoing = buildAdjacency(graph);
        Set<Long> backEdges = findBackEdges(graph, outgoing);

        List<Set<Integer>> dagOut = new ArrayList<>();
        List<Set<Integer>> dagIn = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            dagOut.add(new TreeSet<>());
            dagIn.add(new TreeSet<>());
        }
        for (int i = 0; i < n; i++) {
            for (int j : outgoing.get(i)) {
                if (!backEdges.contains(edgeKey(i, j))) {
                    dagOut.get(i).add(j);
                    dagIn.get(j).add(i);
                }
            }
        }

        int[] depth = computeDepths(graph, dagOut, dagIn);

        TreeMap<Integer, List<Integer>> rows = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            if (!graph.getNode(i).isHidden()) {
                rows.computeIfAbsent(depth[i], d -> new ArrayList<>()).add(i);
            }
        }

        if (layoutSettings.isAlignColumns()) {
            alignRows(rows, dagIn);
        }

        for (Map.Entry<Integer, List<Integer>> row : rows.entrySet()) {
            int y = layoutSettings.getMargin() + row.getKey() * layoutSettings.getRowSpacing();
            List<Integer> members = row.getValue();
            for (int col = 0; col < members.size(); col++) {
                int x = layoutSettings.getMargin() + col * layoutSettings.getColSpacing();
                graph.getNode(members.get(col)).setPosition(Position.of(x, y));
            }
        }

        log.info("[Layout] Placed {} nodes in {} rows ({} back-edge(s) ignored)",
                rows.values().stream().mapToInt(List::size).sum(), rows.size(), backEdges.size());
    }

    // ========================= BACK-EDGES =========================

    /**
     * Iterative DFS from every unvisited visible node; an edge into a node on the active
     * stack is a back-edge.
     */
    private Set<Long> findBackEdges(PatchGraph graph, List<TreeSet<Integer>> outgoing) {
        int n = graph.size();
        Set<Long> backEdges = new HashSet<>();
        List<List<Integer>> sorted = new ArrayList<>();
        outgoing.forEach(set -> sorted.add(new ArrayList<>(set)));
        boolean[] visited = new boolean[n];
        boolean[] onStack = new boolean[n];

        for (int start = 0; start < n; start++) {
            if (visited[start] || graph.getNode(start).isHidden()) continue;

            Deque<int[]> stack = new ArrayDeque<>();   // {node, next neighbour position}
            stack.push(new int[]{start, 0});
            onStack[start] = true;

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> neighbours = sorted.get(frame[0]);
                if (frame[1] < neighbours.size()) {
                    int neighbour = neighbours.get(frame[1]++);
                    if (onStack[neighbour]) {
                        backEdges.add(edgeKey(frame[0], neighbour));
                    } else if (!visited[neighbour] && !graph.getNode(neighbour).isHidden()) {
                        onStack[neighbour] = true;
                        stack.push(new int[]{neighbour, 0});
                    }
                } else {
                    onStack[frame[0]] = false;
                    visited[frame[0]] = true;
                    stack.pop();
                }
            }
        }
        return backEdges;
    }

    // ========================= DEPTHS =========================

    /**
     * Longest path from any DAG source, relaxed in topological order. Depths only grow.
     */
    private int[] computeDepths(PatchGraph graph, List<Set<Integer>> dagOut, List<Set<Integer>> dagIn) {
        int n = graph.size();
        int[] depth = new int[n];
        int[] pending = new int[n];
        Deque<Integer> queue = new ArrayDeque<>();

        for (int i = 0; i < n; i++) {
            if (graph.getNode(i).isHidden()) continue;
            pending[i] = (int) dagIn.get(i).stream().filter(p -> !graph.getNode(p).isHidden()).count();
            if (pending[i] == 0) {
                queue.add(i);
            }
        }

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int next : dagOut.get(current)) {
                if (graph.getNode(next).isHidden()) continue;
                depth[next] = Math.max(depth[next], depth[current] + 1);
                if (--pending[next] == 0) {
                    queue.add(next);
                }
            }
        }
        return depth;
    }

    // ========================= ROW ORDER =========================

    /**
     * Orders each row by the mean column of its DAG predecessors in the row above.
     * The sort is stable; nodes without such predecessors go last.
     */
    private void alignRows(TreeMap<Integer, List<Integer>> rows, List<Set<Integer>> dagIn) {
        List<Integer> previous = null;
        for (List<Integer> row : rows.values()) {
            if (previous != null) {
                Map<Integer, Integer> columnOf = new HashMap<>();
                for (int col = 0; col < previous.size(); col++) {
                    columnOf.put(previous.get(col), col);
                }
                Map<Integer, Double> key = new HashMap<>();
                for (int node : row) {
                    key.put(node, dagIn.get(node).stream()
                            .filter(columnOf::containsKey)
                            .mapToInt(columnOf::get)
                            .average()
                            .orElse(Double.POSITIVE_INFINITY));
                }
                row.sort(Comparator.comparingDouble(key::get));
            }
            previous = row;
        }
    }

    private List<TreeSet<Integer>> buildAdjacency(PatchGraph graph) {
        List<TreeSet<Integer>> outgoing = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            outgoing.add(new TreeSet<>());
        }
        for (Connection c : graph.getConnections()) {
            if (graph.isNodeIndex(c.getSource()) && graph.isNodeIndex(c.getSink())) {
                outgoing.get(c.getSource()).add(c.getSink());
            }
        }
        return outgoing;
    }

    private static long edgeKey(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }
}
