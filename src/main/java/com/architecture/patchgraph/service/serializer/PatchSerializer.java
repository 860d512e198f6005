package com.architecture.patchgraph.service.serializer;

import com.architecture.patchgraph.model.tree.ArrayDeclaration;
import com.architecture.patchgraph.model.tree.Bang;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.CommentText;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.Coords;
import com.architecture.patchgraph.model.tree.Declare;
import com.architecture.patchgraph.model.tree.ElementContainer;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.HorizontalRadio;
import com.architecture.patchgraph.model.tree.HorizontalSlider;
import com.architecture.patchgraph.model.tree.IemCanvas;
import com.architecture.patchgraph.model.tree.MessageBox;
import com.architecture.patchgraph.model.tree.NumberBox;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.RawStatement;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.SubPatch;
import com.architecture.patchgraph.model.tree.SymbolAtom;
import com.architecture.patchgraph.model.tree.Toggle;
import com.architecture.patchgraph.model.tree.VerticalRadio;
import com.architecture.patchgraph.model.tree.VerticalSlider;
import com.architecture.patchgraph.model.tree.VuMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.architecture.patchgraph.service.parser.NumericFields.formatFloat;

/**
 * Renders a {@link Patch} tree back to patch text, one statement per line.
 *
 * <p>Field order mirrors what the parser reads. Text fields are written as stored: escaping
 * is done by whoever built the element.</p>
 */
@Service
@Slf4j
public class PatchSerializer {

    public String serialize(Patch patch) {
        StringBuilder out = new StringBuilder();
        writeCanvas(out, patch, null);
        log.info("[Serializer] Rendered {} top-level elements ({} chars)",
                patch.getElements().size(), out.length());
        return out.toString();
    }

    /**
     * Renders a single element. Sub-patches render their whole block.
     */
    public String serializeElement(PatchElement element) {
        StringBuilder out = new StringBuilder();
        writeElement(out, element);
        return out.toString();
    }

    private void writeCanvas(StringBuilder out, ElementContainer container, Restore restore) {
        statement(out, canvasFields(container.getCanvas()));
        for (PatchElement element : container.getElements()) {
            writeElement(out, element);
        }
        if (restore != null) {
            statement(out, "#X", "restore", restore.getPosition(), restore.getKind(), restore.getName());
        }
    }

    private Object[] canvasFields(CanvasProperties canvas) {
        if (canvas.isSubCanvas()) {
            return new Object[]{"#N", "canvas", canvas.getX(), canvas.getY(), canvas.getWidth(),
                    canvas.getHeight(), canvas.getName(), canvas.getOpenOnLoad()};
        }
        return new Object[]{"#N", "canvas", canvas.getX(), canvas.getY(), canvas.getWidth(),
                canvas.getHeight(), canvas.getFontSize()};
    }

    private void writeElement(StringBuilder out, PatchElement element) {
        switch (element.getKind()) {
            case SUBPATCH -> {
                SubPatch sub = (SubPatch) element;
                writeCanvas(out, sub, sub.getRestore());
            }
            case OBJECT -> {
                ObjectBox obj = (ObjectBox) element;
                statement(out, "#X", "obj", obj.getPosition(), obj.getText());
            }
            case MESSAGE -> {
                MessageBox msg = (MessageBox) element;
                statement(out, "#X", "msg", msg.getPosition(), msg.getContent());
            }
            case COMMENT -> {
                CommentText text = (CommentText) element;
                statement(out, "#X", "text", text.getPosition(), text.getContent());
            }
            case FLOAT_ATOM -> {
                FloatAtom a = (FloatAtom) element;
                statement(out, "#X", "floatatom", a.getPosition(), a.getWidth(),
                        formatFloat(a.getLowerLimit()), formatFloat(a.getUpperLimit()), a.getLabelPos(),
                        a.getLabel(), a.getReceive(), a.getSend());
            }
            case SYMBOL_ATOM -> {
                SymbolAtom a = (SymbolAtom) element;
                statement(out, "#X", "symbolatom", a.getPosition(), a.getWidth(),
                        formatFloat(a.getLowerLimit()), formatFloat(a.getUpperLimit()), a.getLabelPos(),
                        a.getLabel(), a.getReceive(), a.getSend());
            }
            case ARRAY -> {
                ArrayDeclaration array = (ArrayDeclaration) element;
                statement(out, "#X", "array", array.getName(), array.getSize(), array.getDataType(),
                        array.getSaveFlag());
            }
            case CONNECT -> {
                Connect c = (Connect) element;
                statement(out, "#X", "connect", c.getSource(), c.getOutlet(), c.getSink(), c.getInlet());
            }
            case COORDS -> {
                Coords c = (Coords) element;
                statement(out, "#X", "coords", formatFloat(c.getXFrom()), formatFloat(c.getYFrom()),
                        formatFloat(c.getXTo()), formatFloat(c.getYTo()), c.getWidth(), c.getHeight(),
                        c.getGraphOnParent(), c.getHideName(), c.getXMargin(), c.getYMargin());
            }
            case DECLARE -> {
                Declare declare = (Declare) element;
                statement(out, "#X", "declare", String.join(" ", declare.getArgs()));
            }
            case RAW -> statement(out, String.join(" ", ((RawStatement) element).getTokens()));
            case BANG -> {
                Bang w = (Bang) element;
                statement(out, "#X", "obj", w.getPosition(), "bng", w.getSize(), w.getHold(),
                        w.getInterrupt(), w.getInit(), w.getSend(), w.getReceive(), w.getLabel(),
                        w.getLabelX(), w.getLabelY(), w.getFont(), w.getFontSize(),
                        w.getBgColor(), w.getFgColor(), w.getLabelColor());
            }
            case TOGGLE -> {
                Toggle w = (Toggle) element;
                statement(out, "#X", "obj", w.getPosition(), "tgl", w.getSize(), w.getInit(),
                        w.getSend(), w.getReceive(), w.getLabel(), w.getLabelX(), w.getLabelY(),
                        w.getFont(), w.getFontSize(), w.getBgColor(), w.getFgColor(), w.getLabelColor(),
                        w.getInitValue(), w.getDefaultValue());
            }
            case NUMBER_BOX -> {
                NumberBox w = (NumberBox) element;
                statement(out, "#X", "obj", w.getPosition(), "nbx", w.getWidth(), w.getHeight(),
                        formatFloat(w.getMinValue()), formatFloat(w.getMaxValue()), w.getLogFlag(),
                        w.getInit(), w.getSend(), w.getReceive(), w.getLabel(), w.getLabelX(),
                        w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(), w.getFgColor(),
                        w.getLabelColor(), formatFloat(w.getInitValue()), w.getLogHeight());
            }
            case VERTICAL_SLIDER -> {
                VerticalSlider w = (VerticalSlider) element;
                statement(out, "#X", "obj", w.getPosition(), "vsl", w.getWidth(), w.getHeight(),
                        formatFloat(w.getMinValue()), formatFloat(w.getMaxValue()), w.getLogFlag(),
                        w.getInit(), w.getSend(), w.getReceive(), w.getLabel(), w.getLabelX(),
                        w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(), w.getFgColor(),
                        w.getLabelColor(), formatFloat(w.getInitValue()), w.getSteady());
            }
            case HORIZONTAL_SLIDER -> {
                HorizontalSlider w = (HorizontalSlider) element;
                statement(out, "#X", "obj", w.getPosition(), "hsl", w.getWidth(), w.getHeight(),
                        formatFloat(w.getMinValue()), formatFloat(w.getMaxValue()), w.getLogFlag(),
                        w.getInit(), w.getSend(), w.getReceive(), w.getLabel(), w.getLabelX(),
                        w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(), w.getFgColor(),
                        w.getLabelColor(), formatFloat(w.getInitValue()), w.getSteady());
            }
            case VERTICAL_RADIO -> {
                VerticalRadio w = (VerticalRadio) element;
                statement(out, "#X", "obj", w.getPosition(), "vradio", w.getSize(), w.getNewOld(),
                        w.getInit(), w.getNumber(), w.getSend(), w.getReceive(), w.getLabel(),
                        w.getLabelX(), w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(),
                        w.getFgColor(), w.getLabelColor(), w.getInitValue());
            }
            case HORIZONTAL_RADIO -> {
                HorizontalRadio w = (HorizontalRadio) element;
                statement(out, "#X", "obj", w.getPosition(), "hradio", w.getSize(), w.getNewOld(),
                        w.getInit(), w.getNumber(), w.getSend(), w.getReceive(), w.getLabel(),
                        w.getLabelX(), w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(),
                        w.getFgColor(), w.getLabelColor(), w.getInitValue());
            }
            case CANVAS -> {
                IemCanvas w = (IemCanvas) element;
                statement(out, "#X", "obj", w.getPosition(), "cnv", w.getSize(), w.getWidth(),
                        w.getHeight(), w.getSend(), w.getReceive(), w.getLabel(), w.getLabelX(),
                        w.getLabelY(), w.getFont(), w.getFontSize(), w.getBgColor(), w.getLabelColor(), 0);
            }
            case VU_METER -> {
                VuMeter w = (VuMeter) element;
                statement(out, "#X", "obj", w.getPosition(), "vu", w.getWidth(), w.getHeight(),
                        w.getReceive(), w.getLabel(), w.getLabelX(), w.getLabelY(), w.getFont(),
                        w.getFontSize(), w.getBgColor(), w.getLabelColor(), w.getScale(), 0);
            }
            default -> throw new IllegalStateException("Unhandled element kind: " + element.getKind());
        }
    }

    /**
     * Appends one statement: non-empty fields joined by single spaces, then {@code ;} and a newline.
     */
    private static void statement(StringBuilder out, Object... fields) {
        List<String> parts = new ArrayList<>(fields.length + 1);
        for (Object field : fields) {
            String text;
            if (field instanceof Position position) {
                text = position.getX() + " " + position.getY();
            } else {
                text = field == null ? "" : field.toString();
            }
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        out.append(String.join(" ", parts)).append(";\n");
    }
}
