package com.architecture.patchgraph.service.bridge;

import com.architecture.patchgraph.exception.InvalidConnectionException;
import com.architecture.patchgraph.model.graph.ArrayNode;
import com.architecture.patchgraph.model.graph.CommentNode;
import com.architecture.patchgraph.model.graph.Connection;
import com.architecture.patchgraph.model.graph.Directive;
import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.GuiNode;
import com.architecture.patchgraph.model.graph.MessageNode;
import com.architecture.patchgraph.model.graph.ObjectNode;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.graph.Placement;
import com.architecture.patchgraph.model.graph.PortCounts;
import com.architecture.patchgraph.model.graph.SubgraphNode;
import com.architecture.patchgraph.model.graph.SubgraphSettings;
import com.architecture.patchgraph.model.graph.layout.RowLayoutStrategy;
import com.architecture.patchgraph.model.tree.ArrayDeclaration;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.CommentText;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.Coords;
import com.architecture.patchgraph.model.tree.ElementContainer;
import com.architecture.patchgraph.model.tree.GuiElement;
import com.architecture.patchgraph.model.tree.MessageBox;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.SubPatch;
import com.architecture.patchgraph.service.registry.ObjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the graph model and the parsed tree.
 *
 * <p>Node order is element order: the n-th addressable element of a canvas becomes the n-th
 * node of its graph and back, so connection indices carry over unchanged. Directives
 * (declare, coords, unmodelled statements) travel with the graph and are written back in
 * front of the node they preceded; a sub-canvas's graph-on-parent {@code coords} is kept that
 * way too and only synthesized for sub-graphs built without one. Abstraction references
 * come back as plain objects.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchBridge {

    private static final String DEFAULT_SUBPATCH_NAME = "subpatch";

    private final BridgeMode mode;
    private final ObjectRegistry registry;

    // ========================= GRAPH -> TREE =========================

    public Patch toTree(PatchGraph graph) {
        Patch patch = new Patch(graph.getCanvas(), toElements(graph));
        log.info("[Bridge] Graph {} -> tree with {} elements", graph, patch.getElements().size());
        return patch;
    }

    private List<PatchElement> toElements(PatchGraph graph) {
        List<PatchElement> elements = new ArrayList<>();
        List<Directive> directives = graph.getDirectives();
        int next = 0;

        for (int i = 0; i < graph.size(); i++) {
            while (next < directives.size() && directives.get(next).anchor() <= i) {
                elements.add(directives.get(next++).element());
            }
            elements.add(toElement(graph.getNode(i)));
        }
        for (Connection c : graph.getConnections()) {
            elements.add(new Connect(c.getSource(), c.getOutlet(), c.getSink(), c.getInlet()));
        }
        while (next < directives.size()) {
            elements.add(directives.get(next++).element());
        }
        return elements;
    }

    private PatchElement toElement(GraphNode node) {
        if (node instanceof SubgraphNode subgraph) {
            return toSubPatch(subgraph);
        }
        if (node instanceof ObjectNode object) {
            return ObjectBox.fromText(object.getPosition(), object.getText());
        }
        if (node instanceof MessageNode message) {
            return new MessageBox(message.getPosition(), message.getText());
        }
        if (node instanceof CommentNode comment) {
            return new CommentText(comment.getPosition(), comment.getContent());
        }
        if (node instanceof ArrayNode array) {
            return ArrayDeclaration.builder()
                    .name(array.getName())
                    .size(array.getLength())
                    .dataType(array.getDataType())
                    .saveFlag(array.getSaveFlag())
                    .build();
        }
        if (node instanceof GuiNode gui) {
            return gui.toElement();
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    private SubPatch toSubPatch(SubgraphNode node) {
        PatchGraph inner = node.getGraph();
        CanvasProperties canvas = inner.getCanvas().isSubCanvas()
                ? inner.getCanvas().toBuilder().width(node.getCanvasWidth()).height(node.getCanvasHeight()).build()
                : CanvasProperties.subCanvas(node.getCanvasWidth(), node.getCanvasHeight());

        List<PatchElement> elements = toElements(inner);
        boolean coordsKept = inner.getDirectives().stream()
                .anyMatch(d -> d.element() instanceof Coords coords && coords.getGraphOnParent() >= 1);
        if (node.isGraphOnParent() && !coordsKept) {
            elements.add(Coords.builder()
                    .xFrom(0).yFrom(1).xTo(1).yTo(0)
                    .width(node.getGopWidth())
                    .height(node.getGopHeight())
                    .graphOnParent(1)
                    .hideName(node.isHideName() ? 1 : 0)
                    .build());
        }
        return new SubPatch(canvas, elements, new Restore(node.getPosition(), node.getRestoreKind(), node.getName()));
    }

    // ========================= TREE -> GRAPH =========================

    /**
     * @throws InvalidConnectionException in {@link BridgeMode#STRICT} when a connection names
     *                                    a missing element
     */
    public PatchGraph toGraph(Patch patch) {
        PatchGraph graph = toGraph(patch, patch.getCanvas());
        log.info("[Bridge] Tree with {} elements -> graph {}", patch.getElements().size(), graph);
        return graph;
    }

    private PatchGraph toGraph(ElementContainer container, CanvasProperties canvas) {
        PatchGraph graph = new PatchGraph(new RowLayoutStrategy(), registry);
        graph.setCanvas(canvas);

        // pass 1: one node per addressable element, in order
        List<GraphNode> nodes = new ArrayList<>();
        for (PatchElement element : container.getElements()) {
            if (element instanceof Connect) {
                continue;
            }
            if (!element.isAddressable()) {
                graph.addDirective(element);
                continue;
            }
            nodes.add(toNode(graph, element));
        }

        // pass 2: replay connections
        List<String> dangling = new ArrayList<>();
        for (Connect connect : container.getConnections()) {
            if (!inRange(connect.getSource(), nodes) || !inRange(connect.getSink(), nodes)
                    || connect.getOutlet() < 0 || connect.getInlet() < 0) {
                String problem = "Connection(" + connect.getSource() + ", " + connect.getOutlet() + ", "
                        + connect.getSink() + ", " + connect.getInlet() + ") references a missing element"
                        + " or port (canvas has " + nodes.size() + " elements)";
                if (mode == BridgeMode.STRICT) {
                    dangling.add(problem);
                } else {
                    log.warn("[Bridge] Skipping {}", problem);
                }
                continue;
            }
            graph.link(nodes.get(connect.getSource()), nodes.get(connect.getSink()),
                    connect.getOutlet(), connect.getInlet());
        }
        if (!dangling.isEmpty()) {
            throw new InvalidConnectionException(dangling);
        }
        return graph;
    }

    private GraphNode toNode(PatchGraph graph, PatchElement element) {
        if (element instanceof ObjectBox box) {
            PortCounts counts = registry.lookup(box.getClassName()).orElse(PortCounts.UNKNOWN);
            return graph.insert(new ObjectNode(box.getPosition(), box.getText(), counts.inlets(), counts.outlets()));
        }
        if (element instanceof MessageBox message) {
            return graph.insert(new MessageNode(message.getPosition(), message.getContent()));
        }
        if (element instanceof CommentText comment) {
            return graph.insert(new CommentNode(comment.getPosition(), comment.getContent()));
        }
        if (element instanceof ArrayDeclaration array) {
            return graph.insert(new ArrayNode(array.getName(), array.getSize(), array.getDataType(), array.getSaveFlag()));
        }
        if (element instanceof GuiElement gui) {
            return graph.insert(new GuiNode(gui.getPosition(), gui));
        }
        if (element instanceof SubPatch sub) {
            return toSubgraph(graph, sub);
        }
        throw new IllegalArgumentException("Unsupported element kind: " + element.getKind());
    }

    private SubgraphNode toSubgraph(PatchGraph graph, SubPatch sub) {
        PatchGraph inner = toGraph(sub, sub.getCanvas());
        Restore restore = sub.getRestore();
        String name = restore != null ? restore.getName() : DEFAULT_SUBPATCH_NAME;
        Position position = restore != null ? restore.getPosition() : Position.ORIGIN;

        SubgraphSettings.SubgraphSettingsBuilder settings = SubgraphSettings.builder()
                .canvasWidth(sub.getCanvas().getWidth())
                .canvasHeight(sub.getCanvas().getHeight());
        if (restore != null && restore.getKind() != null) {
            settings.restoreKind(restore.getKind());
        }
        Coords coords = graphOnParentCoords(sub);
        if (coords != null) {
            settings.graphOnParent(true)
                    .hideName(coords.getHideName() != 0)
                    .gopWidth(coords.getWidth())
                    .gopHeight(coords.getHeight());
        }
        return graph.addSubgraph(name, inner, Placement.at(position), settings.build());
    }

    private static Coords graphOnParentCoords(ElementContainer container) {
        return container.getElements().stream()
                .filter(Coords.class::isInstance)
                .map(Coords.class::cast)
                .filter(c -> c.getGraphOnParent() >= 1)
                .findFirst()
                .orElse(null);
    }

    private static boolean inRange(int index, List<GraphNode> nodes) {
        return index >= 0 && index < nodes.size();
    }
}
