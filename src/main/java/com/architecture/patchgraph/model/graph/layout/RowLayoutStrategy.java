package com.architecture.patchgraph.model.graph.layout;

import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.Placement;
import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

/**
 * Default placement: rows of nodes flowing left to right.
 *
 * <p>The row head (first node of the current row) anchors new rows, which start below it.
 * The row tail (last node placed) anchors same-row placement, which continues to its right.
 * The first node lands at ({@code margin}, {@code margin}).</p>
 */
@Getter
public class RowLayoutStrategy implements LayoutStrategy {

    public static final int DEFAULT_MARGIN = 25;
    public static final int DEFAULT_ROW_HEIGHT = 25;
    public static final int DEFAULT_COLUMN_WIDTH = 50;

    private int margin;
    private int rowHeight;
    private int columnWidth;
    private GraphNode rowHead;
    private GraphNode rowTail;

    public RowLayoutStrategy() {
        this(DEFAULT_MARGIN, DEFAULT_ROW_HEIGHT, DEFAULT_COLUMN_WIDTH);
    }

    public RowLayoutStrategy(int margin, int rowHeight, int columnWidth) {
        this.margin = margin;
        this.rowHeight = rowHeight;
        this.columnWidth = columnWidth;
    }

    @Override
    public Position compute(Placement placement) {
        if (placement.isAbsolute()) {
            return placement.getAbsolute();
        }
        GraphNode anchor = placement.getNewRow() < 1 ? rowTail : rowHead;
        if (anchor == null) {
            return Position.of(margin, margin);
        }
        return relativeTo(anchor, placement.getNewRow(), placement.getNewCol());
    }

    protected Position relativeTo(GraphNode anchor, double newRow, double newCol) {
        int x = anchor.getPosition().getX();
        int y = anchor.getPosition().getY();
        double columns = newCol;
        if (newRow < 1) {
            x += anchor.getWidth();
            columns -= 1;
        } else {
            y += anchor.getHeight() + (int) (rowHeight * (newRow - 1));
        }
        x += Math.max(0, (int) (columnWidth * columns));
        return Position.of(x, y);
    }

    @Override
    public void register(GraphNode node, Placement placement) {
        rowTail = node;
        if (placement.isAbsolute() || rowHead == null || placement.getNewCol() > 0 || placement.getNewRow() >= 1) {
            rowHead = node;
        }
    }

    @Override
    public void reset() {
        rowHead = null;
        rowTail = null;
    }

    @Override
    public void inheritSpacing(LayoutStrategy parent) {
        if (parent instanceof RowLayoutStrategy row) {
            this.margin = row.margin;
            this.rowHeight = row.rowHeight;
            this.columnWidth = row.columnWidth;
        }
    }
}
