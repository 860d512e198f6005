package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.exception.NodeNotFoundException;
import com.architecture.patchgraph.exception.PatchConnectionException;
import com.architecture.patchgraph.model.graph.layout.LayoutStrategy;
import com.architecture.patchgraph.model.graph.layout.RowLayoutStrategy;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.ElementKind;
import com.architecture.patchgraph.model.tree.GuiElement;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.service.registry.ObjectRegistry;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Mutable patch under construction: an ordered node list plus connections that refer to nodes
 * by their index in that list.
 *
 * <p>Positions are assigned when a node is added, by this graph's {@link LayoutStrategy} unless
 * the placement is absolute. Instances are not thread-safe.</p>
 *
 * <pre>
 * PatchGraph graph = new PatchGraph();
 * ObjectNode osc = graph.add("osc~ 440");
 * ObjectNode dac = graph.add("dac~");
 * graph.link(osc, dac);
 * graph.link(osc.outlet(0), dac, 1);
 * </pre>
 */
public class PatchGraph {

    private static final Set<String> INLET_CLASSES = Set.of("inlet", "inlet~");
    private static final Set<String> OUTLET_CLASSES = Set.of("outlet", "outlet~");

    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<Directive> directives = new ArrayList<>();

    @Getter
    private final LayoutStrategy layout;
    @Getter
    private final ObjectRegistry registry;
    @Getter
    @Setter
    private AbstractionIoResolver abstractionResolver;
    @Getter
    @Setter
    private CanvasProperties canvas = CanvasProperties.root();

    public PatchGraph() {
        this(new RowLayoutStrategy());
    }

    public PatchGraph(LayoutStrategy layout) {
        this(layout, ObjectRegistry.standard());
    }

    public PatchGraph(LayoutStrategy layout, ObjectRegistry registry) {
        this.layout = layout;
        this.registry = registry;
    }

    // ========================= NODES =========================

    public ObjectNode add(String text) {
        return add(text, Placement.nextRow());
    }

    public ObjectNode add(String text, Placement placement) {
        return add(text, placement, null, null);
    }

    /**
     * Adds an object box. Counts left null are filled from the object registry when the class
     * name is known there; otherwise they stay unknown.
     */
    public ObjectNode add(String text, Placement placement, Integer numInlets, Integer numOutlets) {
        String className = firstToken(text);
        PortCounts known = registry.lookup(className).orElse(PortCounts.UNKNOWN);
        Integer inlets = numInlets != null ? numInlets : known.inlets();
        Integer outlets = numOutlets != null ? numOutlets : known.outlets();
        ObjectNode node = new ObjectNode(layout.compute(placement), PatchText.escape(text), inlets, outlets);
        return place(node, placement);
    }

    /**
     * Adds a reference to an abstraction (an object loaded from another patch file). Missing
     * counts are resolved from {@code sourcePath} through the configured
     * {@link AbstractionIoResolver}; without a source path they default to zero.
     */
    public AbstractionNode addAbstraction(String text, Path sourcePath, Placement placement,
                                          Integer numInlets, Integer numOutlets) {
        Integer inlets = numInlets;
        Integer outlets = numOutlets;
        if (sourcePath != null && (inlets == null || outlets == null)) {
            if (abstractionResolver == null) {
                throw new IllegalStateException("No abstraction resolver configured to read " + sourcePath);
            }
            PortCounts resolved = abstractionResolver.resolve(sourcePath);
            inlets = inlets != null ? inlets : resolved.inlets();
            outlets = outlets != null ? outlets : resolved.outlets();
        }
        AbstractionNode node = new AbstractionNode(layout.compute(placement), PatchText.escape(text),
                inlets != null ? inlets : 0, outlets != null ? outlets : 0, sourcePath);
        return place(node, placement);
    }

    public MessageNode addMessage(String text) {
        return addMessage(text, Placement.nextRow());
    }

    public MessageNode addMessage(String text, Placement placement) {
        return place(new MessageNode(layout.compute(placement), PatchText.escape(text)), placement);
    }

    public CommentNode addComment(String content) {
        return addComment(content, Placement.nextRow());
    }

    public CommentNode addComment(String content, Placement placement) {
        return place(new CommentNode(layout.compute(placement), PatchText.escape(content)), placement);
    }

    /**
     * Declares an array. Arrays are hidden and do not move the layout anchors.
     */
    public ArrayNode addArray(String name, int length) {
        ArrayNode node = new ArrayNode(name, length);
        nodes.add(node);
        return node;
    }

    public GuiNode addGui(GuiElement element) {
        return addGui(element, Placement.nextRow());
    }

    public GuiNode addGui(GuiElement element, Placement placement) {
        return place(new GuiNode(layout.compute(placement), element), placement);
    }

    public SubgraphNode addSubgraph(String name, PatchGraph inner) {
        return addSubgraph(name, inner, Placement.nextRow(), SubgraphSettings.defaults());
    }

    /**
     * Adds a sub-patch owning {@code inner}. Counts not set in {@code settings} are the number of
     * {@code inlet}/{@code inlet~} and {@code outlet}/{@code outlet~} objects in the inner graph.
     */
    public SubgraphNode addSubgraph(String name, PatchGraph inner, Placement placement, SubgraphSettings settings) {
        if (settings.isInheritLayout()) {
            inner.getLayout().inheritSpacing(layout);
        }
        Integer inlets = settings.getNumInlets() != null
                ? settings.getNumInlets() : inner.countObjects(INLET_CLASSES);
        Integer outlets = settings.getNumOutlets() != null
                ? settings.getNumOutlets() : inner.countObjects(OUTLET_CLASSES);
        SubgraphNode node = new SubgraphNode(layout.compute(placement), name, inner, inlets, outlets, settings);
        return place(node, placement);
    }

    /**
     * Appends an already positioned node, registering it as an absolute placement.
     */
    public <T extends GraphNode> T insert(T node) {
        nodes.add(node);
        if (!node.isHidden()) {
            layout.register(node, Placement.at(node.getPosition()));
        }
        return node;
    }

    /**
     * Keeps a non-node statement (declare, coords, unmodelled statements) after the nodes added
     * so far, to be written back out in the same place.
     */
    public void addDirective(PatchElement element) {
        if (element.isAddressable() || element.getKind() == ElementKind.CONNECT) {
            throw new IllegalArgumentException("Not a directive: " + element.getKind());
        }
        directives.add(new Directive(nodes.size(), element));
    }

    // ========================= CONNECTIONS =========================

    public Connection link(GraphNode source, GraphNode sink) {
        return link(source, sink, 0, 0);
    }

    public Connection link(Outlet source, GraphNode sink) {
        return link(source, sink, 0);
    }

    public Connection link(Outlet source, GraphNode sink, int inlet) {
        return link(source.getOwner(), sink, source.getIndex(), inlet);
    }

    /**
     * Connects {@code outlet} of {@code source} to {@code inlet} of {@code sink}. Both nodes must
     * belong to this graph (checked by identity). Port bounds are checked later by validation.
     */
    public Connection link(GraphNode source, GraphNode sink, int outlet, int inlet) {
        int sourceIndex = indexOf(source);
        if (sourceIndex < 0) {
            throw new NodeNotFoundException("Source node " + source + " not found in patch");
        }
        int sinkIndex = indexOf(sink);
        if (sinkIndex < 0) {
            throw new NodeNotFoundException("Sink node " + sink + " not found in patch");
        }
        if (outlet < 0) {
            throw new PatchConnectionException("Outlet index must be non-negative, got " + outlet);
        }
        if (inlet < 0) {
            throw new PatchConnectionException("Inlet index must be non-negative, got " + inlet);
        }
        Connection connection = new Connection(sourceIndex, outlet, sinkIndex, inlet);
        connections.add(connection);
        return connection;
    }

    /**
     * Appends a connection by raw indices, without any checks.
     */
    public void addConnection(Connection connection) {
        connections.add(connection);
    }

    public void replaceConnections(List<Connection> replacement) {
        connections.clear();
        connections.addAll(replacement);
    }

    // ========================= REMOVAL =========================

    /**
     * Removes the nodes at {@code indices}, renumbering the survivors. Connections touching a
     * removed node (or pointing outside the node list) are dropped, the rest are remapped. Layout anchors are reset.
     */
    public void removeNodes(Set<Integer> indices) {
        if (indices.isEmpty()) {
            return;
        }
        int[] oldToNew = new int[nodes.size()];
        List<GraphNode> kept = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (indices.contains(i)) {
                oldToNew[i] = -1;
            } else {
                oldToNew[i] = kept.size();
                kept.add(nodes.get(i));
            }
        }

        List<Connection> remapped = new ArrayList<>();
        for (Connection c : connections) {
            if (indices.contains(c.getSource()) || indices.contains(c.getSink())
                    || !isNodeIndex(c.getSource()) || !isNodeIndex(c.getSink())) {
                continue;
            }
            remapped.add(new Connection(oldToNew[c.getSource()], c.getOutlet(), oldToNew[c.getSink()], c.getInlet()));
        }

        List<Directive> shifted = new ArrayList<>();
        for (Directive directive : directives) {
            int removedBefore = (int) indices.stream().filter(i -> i < directive.anchor()).count();
            shifted.add(new Directive(directive.anchor() - removedBefore, directive.element()));
        }

        nodes.clear();
        nodes.addAll(kept);
        replaceConnections(remapped);
        directives.clear();
        directives.addAll(shifted);
        layout.reset();
    }

    // ========================= QUERIES =========================

    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public List<Directive> getDirectives() {
        return Collections.unmodifiableList(directives);
    }

    public GraphNode getNode(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Index of {@code node} in this graph by identity, or -1.
     */
    public int indexOf(GraphNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    public boolean isNodeIndex(int index) {
        return index >= 0 && index < nodes.size();
    }

    private int countObjects(Set<String> classNames) {
        return (int) nodes.stream()
                .filter(ObjectNode.class::isInstance)
                .map(n -> ((ObjectNode) n).getClassName())
                .filter(classNames::contains)
                .count();
    }

    private <T extends GraphNode> T place(T node, Placement placement) {
        nodes.add(node);
        layout.register(node, placement);
        return node;
    }

    private static String firstToken(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? "" : trimmed.split("\\s+", 2)[0];
    }

    @Override
    public String toString() {
        return "PatchGraph(nodes=" + nodes.size() + ", connections=" + connections.size() + ")";
    }
}
