package com.architecture.patchgraph.model.graph.layout;

import com.architecture.patchgraph.model.graph.GraphNode;
import com.architecture.patchgraph.model.graph.Placement;
import com.architecture.patchgraph.model.tree.Position;
import lombok.Getter;

/**
 * Places relatively-positioned nodes left to right on a fixed grid, wrapping after
 * {@code columns} cells. Row/column hints are ignored; absolute placements still apply and do
 * not consume a cell.
 */
@Getter
public class GridLayoutStrategy extends RowLayoutStrategy {

    private final int columns;
    private final int cellWidth;
    private final int cellHeight;
    private int placedCount;

    public GridLayoutStrategy() {
        this(4, 100, 40, DEFAULT_MARGIN);
    }

    public GridLayoutStrategy(int columns, int cellWidth, int cellHeight, int margin) {
        super(margin, DEFAULT_ROW_HEIGHT, DEFAULT_COLUMN_WIDTH);
        if (columns < 1) {
            throw new IllegalArgumentException("Grid needs at least one column, got " + columns);
        }
        this.columns = columns;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    @Override
    public Position compute(Placement placement) {
        if (placement.isAbsolute()) {
            return placement.getAbsolute();
        }
        int col = placedCount % columns;
        int row = placedCount / columns;
        return Position.of(getMargin() + col * cellWidth, getMargin() + row * cellHeight);
    }

    @Override
    public void register(GraphNode node, Placement placement) {
        super.register(node, placement);
        if (!placement.isAbsolute()) {
            placedCount++;
        }
    }

    @Override
    public void reset() {
        super.reset();
        placedCount = 0;
    }
}
