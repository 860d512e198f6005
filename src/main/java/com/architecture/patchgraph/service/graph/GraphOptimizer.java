package com.architecture.patchgraph.service.graph;

import com.architecture.patchgraph.dto.OptimizationStats;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.ObjectNode;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.graph.SubgraphNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Simplifies a patch graph in three passes: duplicate connections are dropped, opted-in
 * pass-through objects are spliced out, and unconnected plain objects are pruned.
 *
 * <p>Only plain object boxes are ever removed. Comments, messages, atoms, GUI widgets, arrays,
 * sub-patches and abstractions are kept even when unconnected, as is anything routing through
 * an active send or receive name.</p>
 */
@Service
@Slf4j
public class GraphOptimizer {

    public OptimizationStats optimize(PatchGraph graph) {
        return optimize(graph, Set.of(), false);
    }

    /**
     * @param collapsibleObjects object classes the caller vouches are no-op pass-throughs
     * @param recursive          optimize every sub-patch's inner graph first
     */
    public OptimizationStats optimize(PatchGraph graph, Set<String> collapsibleObjects, boolean recursive) {
        OptimizationStats stats = OptimizationStats.builder().build();

        if (recursive) {
            for (GraphNode node : graph.getNodes()) {
                if (node instanceof SubgraphNode subgraph) {
                    optimize(subgraph.getGraph(), collapsibleObjects, true);
                    stats.setSubgraphsOptimized(stats.getSubgraphsOptimized() + 1);
                }
            }
        }

        int initialConnections = graph.getConnections().size();

        stats.setDuplicatesRemoved(removeDuplicates(graph));

        Set<Integer> removal = new TreeSet<>();
        if (collapsibleObjects != null && !collapsibleObjects.isEmpty()) {
            stats.setPassThroughsCollapsed(collapsePassThroughs(graph, collapsibleObjects, removal));
        }

        removal.addAll(findUnused(graph, removal));
        stats.setNodesRemoved(removal.size());
        graph.removeNodes(removal);

        stats.setConnectionsRemoved(initialConnections - graph.getConnections().size());

        log.info("[Optimizer] {} -> removed {} node(s), {} connection(s) ({} duplicate, {} pass-through)",
                graph, stats.getNodesRemoved(), stats.getConnectionsRemoved(),
                stats.getDuplicatesRemoved(), stats.getPassThroughsCollapsed());
        return stats;
    }

    // ========================= PASS 1: DEDUP =========================

    public int removeDuplicates(PatchGraph graph) {
        List<Connection> unique = new ArrayList<>(new LinkedHashSet<>(graph.getConnections()));
        int removed = graph.getConnections().size() - unique.size();
        if (removed > 0) {
            graph.replaceConnections(unique);
        }
        log.debug("[Optimizer] Dedup removed {} connection(s)", removed);
        return removed;
    }

    // ========================= PASS 2: PASS-THROUGH COLLAPSE =========================

    /**
     * Splices qualifying nodes out one at a time, updating the connection indexes after each
     * splice so chains of pass-throughs collapse into a single connection. Spliced node
     * indices are added to {@code removal}; the nodes themselves stay until pruning.
     */
    private int collapsePassThroughs(PatchGraph graph, Set<String> collapsible, Set<Integer> removal) {
        List<Connection> connections = new ArrayList<>(graph.getConnections());
        Map<Integer, List<Connection>> bySource = new HashMap<>();
        Map<Integer, List<Connection>> bySink = new HashMap<>();
        connections.forEach(c -> index(c, bySource, bySink));

        int collapsed = 0;
        for (int idx = 0; idx < graph.size(); idx++) {
            GraphNode node = graph.getNode(idx);
            if (!isCollapsible(node, collapsible)) continue;

            List<Connection> incoming = bySink.getOrDefault(idx, List.of());
            List<Connection> outgoing = bySource.getOrDefault(idx, List.of());
            if (incoming.size() != 1 || outgoing.size() != 1) continue;

            Connection in = incoming.get(0);
            Connection out = outgoing.get(0);
            if (in.getSource() == idx) continue;   // self-loop

            Connection bypass = new Connection(in.getSource(), in.getOutlet(), out.getSink(), out.getInlet());
            unindex(in, bySource, bySink);
            unindex(out, bySource, bySink);
            removeByIdentity(connections, in);
            removeByIdentity(connections, out);
            connections.add(bypass);
            index(bypass, bySource, bySink);

            removal.add(idx);
            collapsed++;
            log.debug("[Optimizer] Collapsed {} into {}", node, bypass);
        }

        if (collapsed > 0) {
            graph.replaceConnections(connections);
        }
        return collapsed;
    }

    private boolean isCollapsible(GraphNode node, Set<String> collapsible) {
        if (node.getClass() != ObjectNode.class) {
            return false;
        }
        ObjectNode object = (ObjectNode) node;
        return collapsible.contains(object.getClassName())
                && !object.hasArguments()
                && Integer.valueOf(1).equals(object.getNumInlets())
                && Integer.valueOf(1).equals(object.getNumOutlets());
    }

    // ========================= PASS 3: UNUSED NODES =========================

    private Set<Integer> findUnused(PatchGraph graph, Set<Integer> alreadyRemoved) {
        Set<Integer> connected = new HashSet<>();
        for (Connection c : graph.getConnections()) {
            connected.add(c.getSource());
            connected.add(c.getSink());
        }

        Set<Integer> unused = new TreeSet<>();
        for (int idx = 0; idx < graph.size(); idx++) {
            GraphNode node = graph.getNode(idx);
            if (connected.contains(idx) || alreadyRemoved.contains(idx)) continue;
            if (node.getClass() != ObjectNode.class) continue;
            if (node.hasActiveSendReceive()) continue;
            unused.add(idx);
        }
        return unused;
    }

    private static void index(Connection c, Map<Integer, List<Connection>> bySource,
                              Map<Integer, List<Connection>> bySink) {
        bySource.computeIfAbsent(c.getSource(), k -> new ArrayList<>()).add(c);
        bySink.computeIfAbsent(c.getSink(), k -> new ArrayList<>()).add(c);
    }

    private static void unindex(Connection c, Map<Integer, List<Connection>> bySource,
                                Map<Integer, List<Connection>> bySink) {
        removeByIdentity(bySource.get(c.getSource()), c);
        removeByIdentity(bySink.get(c.getSink()), c);
    }

    private static void removeByIdentity(List<Connection> list, Connection target) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == target) {
                list.remove(i);
                return;
            }
        }
    }
}
