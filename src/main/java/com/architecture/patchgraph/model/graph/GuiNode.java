package com.architecture.patchgraph.model.graph;

import com.architecture.patchgraph.model.tree.Bang;
import com.architecture.patchgraph.model.tree.GuiElement;
import com.architecture.patchgraph.model.tree.HorizontalRadio;
import com.architecture.patchgraph.model.tree.HorizontalSlider;
import com.architecture.patchgraph.model.tree.IemCanvas;
import com.architecture.patchgraph.model.tree.NumberBox;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.SymbolAtom;
import com.architecture.patchgraph.model.tree.Toggle;
import com.architecture.patchgraph.model.tree.VerticalRadio;
import com.architecture.patchgraph.model.tree.VerticalSlider;
import com.architecture.patchgraph.model.tree.VuMeter;
import lombok.Getter;

/**
 * Number/symbol atom or IEM widget. The widget parameters live in the wrapped tree element;
 * the node's own position wins over the element's.
 */
@Getter
public class GuiNode extends GraphNode {

    private static final int CHAR_WIDTH = 6;
    private static final int ATOM_WIDTH = 50;

    private final GuiElement element;

    public GuiNode(Position position, GuiElement element) {
        super(position, element.inletCount(), element.outletCount());
        this.element = element;
    }

    /**
     * The wrapped element moved to this node's current position.
     */
    public GuiElement toElement() {
        return element.withPosition(getPosition());
    }

    @Override
    public boolean hasActiveSendReceive() {
        return element.hasActiveSendReceive();
    }

    @Override
    public int getWidth() {
        switch (element.getKind()) {
            case FLOAT_ATOM:
                return ATOM_WIDTH;
            case SYMBOL_ATOM:
                return ((SymbolAtom) element).getWidth() * CHAR_WIDTH;
            case BANG:
                return ((Bang) element).getSize();
            case TOGGLE:
                return ((Toggle) element).getSize();
            case NUMBER_BOX:
                return ((NumberBox) element).getWidth() * CHAR_WIDTH;
            case VERTICAL_SLIDER:
                return ((VerticalSlider) element).getWidth();
            case HORIZONTAL_SLIDER:
                return ((HorizontalSlider) element).getWidth();
            case VERTICAL_RADIO:
                return ((VerticalRadio) element).getSize();
            case HORIZONTAL_RADIO:
                HorizontalRadio radio = (HorizontalRadio) element;
                return radio.getSize() * radio.getNumber();
            case CANVAS:
                return ((IemCanvas) element).getWidth();
            case VU_METER:
                return ((VuMeter) element).getWidth();
            default:
                return 0;
        }
    }

    @Override
    public int getHeight() {
        switch (element.getKind()) {
            case FLOAT_ATOM:
            case SYMBOL_ATOM:
                return ROW_HEIGHT;
            case BANG:
                return ((Bang) element).getSize();
            case TOGGLE:
                return ((Toggle) element).getSize();
            case NUMBER_BOX:
                return ((NumberBox) element).getHeight();
            case VERTICAL_SLIDER:
                return ((VerticalSlider) element).getHeight();
            case HORIZONTAL_SLIDER:
                return ((HorizontalSlider) element).getHeight();
            case VERTICAL_RADIO:
                VerticalRadio radio = (VerticalRadio) element;
                return radio.getSize() * radio.getNumber();
            case HORIZONTAL_RADIO:
                return ((HorizontalRadio) element).getSize();
            case CANVAS:
                return ((IemCanvas) element).getHeight();
            case VU_METER:
                return ((VuMeter) element).getHeight();
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        return "Gui(" + element.getKind() + ", " + getPosition().getX() + ", " + getPosition().getY() + ")";
    }
}
