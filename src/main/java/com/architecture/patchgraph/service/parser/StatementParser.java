package com.architecture.patchgraph.service.parser;

import com.architecture.patchgraph.exception.PatchParseException;
import com.architecture.patchgraph.model.tree.ArrayDeclaration;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.CommentText;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.Coords;
import com.architecture.patchgraph.model.tree.Declare;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.MessageBox;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.RawStatement;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.SymbolAtom;

import java.util.List;

import static com.architecture.patchgraph.service.parser.NumericFields.doubleAt;
import static com.architecture.patchgraph.service.parser.NumericFields.intAt;
import static com.architecture.patchgraph.service.parser.NumericFields.parseDouble;
import static com.architecture.patchgraph.service.parser.NumericFields.parseInt;
import static com.architecture.patchgraph.service.parser.NumericFields.stringAt;

/**
 * Decodes a single tokenized statement. Token 0 is the directive ({@code #N}, {@code #X},
 * {@code #A}), token 1 the keyword.
 */
public class StatementParser {

    public static final String CANVAS_DIRECTIVE = "#N";
    public static final String ELEMENT_DIRECTIVE = "#X";
    public static final String CANVAS = "canvas";
    public static final String RESTORE = "restore";
    public static final String POP = "pop";

    public boolean isCanvasOpen(List<String> tokens) {
        return tokens.size() > 1 && CANVAS_DIRECTIVE.equals(tokens.get(0)) && CANVAS.equals(tokens.get(1));
    }

    public boolean isRestore(List<String> tokens) {
        return isElement(tokens, RESTORE);
    }

    public boolean isPop(List<String> tokens) {
        return isElement(tokens, POP);
    }

    /**
     * {@code #N canvas x y width height [font | name open]}.
     *
     * <p>Eight or more tokens: named sub-canvas. Seven: root canvas if the last token is an
     * integer font size, otherwise a sub-canvas whose open flag is missing. Six: root canvas
     * with the default font size. A seven-token sub-canvas with a numeric name is therefore read
     * as a root canvas.</p>
     */
    public CanvasProperties parseCanvas(List<String> tokens) {
        requireTokens(tokens, 6, "canvas");
        CanvasProperties.CanvasPropertiesBuilder builder = CanvasProperties.builder()
                .x(parseInt(tokens.get(2), 0))
                .y(parseInt(tokens.get(3), 0))
                .width(parseInt(tokens.get(4), 0))
                .height(parseInt(tokens.get(5), 0));
        if (tokens.size() >= 8) {
            return builder.name(tokens.get(6)).openOnLoad(parseInt(tokens.get(7), 0)).build();
        }
        if (tokens.size() == 7) {
            Integer fontSize = NumericFields.tryParseInt(tokens.get(6));
            if (fontSize == null) {
                return builder.name(tokens.get(6)).openOnLoad(0).build();
            }
            return builder.fontSize(fontSize).build();
        }
        return builder.fontSize(10).build();
    }

    /**
     * {@code #X restore x y kind [name...]}.
     */
    public Restore parseRestore(List<String> tokens) {
        requireTokens(tokens, 5, RESTORE);
        String name = String.join(" ", tokens.subList(5, tokens.size()));
        return new Restore(position(tokens), tokens.get(4), name);
    }

    /**
     * Decodes an element statement. Keywords this parser does not model, and any directive other
     * than {@code #X}, come back as a {@link RawStatement}.
     */
    public PatchElement parseElement(List<String> tokens) {
        if (tokens.size() < 2 || !ELEMENT_DIRECTIVE.equals(tokens.get(0))) {
            return new RawStatement(tokens);
        }
        switch (tokens.get(1)) {
            case "obj":
                return parseObject(tokens);
            case "msg":
                requireTokens(tokens, 4, "msg");
                return new MessageBox(position(tokens), joinFrom(tokens, 4));
            case "floatatom":
                requireTokens(tokens, 4, "floatatom");
                return parseFloatAtom(tokens);
            case "symbolatom":
                requireTokens(tokens, 4, "symbolatom");
                return parseSymbolAtom(tokens);
            case "text":
                requireTokens(tokens, 4, "text");
                return new CommentText(position(tokens), joinFrom(tokens, 4));
            case "array":
                requireTokens(tokens, 5, "array");
                return ArrayDeclaration.builder()
                        .name(tokens.get(2))
                        .size(parseInt(tokens.get(3), 0))
                        .dataType(tokens.get(4))
                        .saveFlag(intAt(tokens, 5, 0))
                        .build();
            case "connect":
                requireTokens(tokens, 6, "connect");
                return new Connect(
                        parseInt(tokens.get(2), 0),
                        parseInt(tokens.get(3), 0),
                        parseInt(tokens.get(4), 0),
                        parseInt(tokens.get(5), 0));
            case "coords":
                requireTokens(tokens, 9, "coords");
                return parseCoords(tokens);
            case "declare":
                return new Declare(tokens.subList(2, tokens.size()));
            default:
                return new RawStatement(tokens);
        }
    }

    private PatchElement parseObject(List<String> tokens) {
        requireTokens(tokens, 5, "obj");
        Position position = position(tokens);
        String className = tokens.get(4);
        List<String> args = tokens.subList(5, tokens.size());
        return WidgetDecoders.decode(position, className, args)
                .<PatchElement>map(widget -> widget)
                .orElseGet(() -> new ObjectBox(position, className, args));
    }

    private FloatAtom parseFloatAtom(List<String> tokens) {
        return FloatAtom.builder()
                .position(position(tokens))
                .width(intAt(tokens, 4, 5))
                .lowerLimit(doubleAt(tokens, 5, 0))
                .upperLimit(doubleAt(tokens, 6, 0))
                .labelPos(intAt(tokens, 7, 0))
                .label(stringAt(tokens, 8, "-"))
                .receive(stringAt(tokens, 9, "-"))
                .send(stringAt(tokens, 10, "-"))
                .build();
    }

    private SymbolAtom parseSymbolAtom(List<String> tokens) {
        return SymbolAtom.builder()
                .position(position(tokens))
                .width(intAt(tokens, 4, 10))
                .lowerLimit(doubleAt(tokens, 5, 0))
                .upperLimit(doubleAt(tokens, 6, 0))
                .labelPos(intAt(tokens, 7, 0))
                .label(stringAt(tokens, 8, "-"))
                .receive(stringAt(tokens, 9, "-"))
                .send(stringAt(tokens, 10, "-"))
                .build();
    }

    private Coords parseCoords(List<String> tokens) {
        return Coords.builder()
                .xFrom(parseDouble(tokens.get(2), 0))
                .yFrom(parseDouble(tokens.get(3), 0))
                .xTo(parseDouble(tokens.get(4), 0))
                .yTo(parseDouble(tokens.get(5), 0))
                .width(parseInt(tokens.get(6), 0))
                .height(parseInt(tokens.get(7), 0))
                .graphOnParent(intAt(tokens, 8, 1))
                .hideName(intAt(tokens, 9, 0))
                .xMargin(intAt(tokens, 10, 0))
                .yMargin(intAt(tokens, 11, 0))
                .build();
    }

    private boolean isElement(List<String> tokens, String keyword) {
        return tokens.size() > 1 && ELEMENT_DIRECTIVE.equals(tokens.get(0)) && keyword.equals(tokens.get(1));
    }

    private static Position position(List<String> tokens) {
        return Position.of(parseInt(tokens.get(2), 0), parseInt(tokens.get(3), 0));
    }

    private static String joinFrom(List<String> tokens, int from) {
        return from < tokens.size() ? String.join(" ", tokens.subList(from, tokens.size())) : "";
    }

    private static void requireTokens(List<String> tokens, int min, String what) {
        if (tokens.size() < min) {
            throw new PatchParseException("Invalid " + what + " statement (expected at least " + min
                    + " tokens, got " + tokens.size() + "): " + String.join(" ", tokens));
        }
    }
}
