package com.architecture.patchgraph.service.parser;

import com.architecture.patchgraph.model.tree.Bang;
import com.architecture.patchgraph.model.tree.ElementKind;
import com.architecture.patchgraph.model.tree.GuiElement;
import com.architecture.patchgraph.model.tree.HorizontalRadio;
import com.architecture.patchgraph.model.tree.HorizontalSlider;
import com.architecture.patchgraph.model.tree.IemCanvas;
import com.architecture.patchgraph.model.tree.IemDefaults;
import com.architecture.patchgraph.model.tree.NumberBox;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.Toggle;
import com.architecture.patchgraph.model.tree.VerticalRadio;
import com.architecture.patchgraph.model.tree.VerticalSlider;
import com.architecture.patchgraph.model.tree.VuMeter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

import static com.architecture.patchgraph.service.parser.NumericFields.doubleAt;
import static com.architecture.patchgraph.service.parser.NumericFields.intAt;
import static com.architecture.patchgraph.service.parser.NumericFields.stringAt;

/**
 * Fixed-schema decoders for the IEM widget keywords. Each widget needs a minimum number of
 * creation arguments; with fewer the object stays a generic {@code ObjectBox}.
 */
public final class WidgetDecoders {

    private static final String NO_NAME = "empty";

    private record Decoder(int minArgs, BiFunction<Position, List<String>, GuiElement> decode) {
    }

    private static final Map<ElementKind, Decoder> DECODERS = new EnumMap<>(ElementKind.class);

    static {
        DECODERS.put(ElementKind.BANG, new Decoder(14, WidgetDecoders::bang));
        DECODERS.put(ElementKind.TOGGLE, new Decoder(14, WidgetDecoders::toggle));
        DECODERS.put(ElementKind.NUMBER_BOX, new Decoder(18, WidgetDecoders::numberBox));
        DECODERS.put(ElementKind.VERTICAL_SLIDER, new Decoder(18, WidgetDecoders::verticalSlider));
        DECODERS.put(ElementKind.HORIZONTAL_SLIDER, new Decoder(18, WidgetDecoders::horizontalSlider));
        DECODERS.put(ElementKind.VERTICAL_RADIO, new Decoder(15, WidgetDecoders::verticalRadio));
        DECODERS.put(ElementKind.HORIZONTAL_RADIO, new Decoder(15, WidgetDecoders::horizontalRadio));
        DECODERS.put(ElementKind.CANVAS, new Decoder(13, WidgetDecoders::canvas));
        DECODERS.put(ElementKind.VU_METER, new Decoder(12, WidgetDecoders::vuMeter));
    }

    private WidgetDecoders() {
    }

    /**
     * Decodes {@code className args...} into a widget when the class is a known widget keyword
     * and enough arguments are present.
     */
    public static Optional<GuiElement> decode(Position position, String className, List<String> args) {
        return ElementKind.forWidgetKeyword(className)
                .map(DECODERS::get)
                .filter(decoder -> args.size() >= decoder.minArgs())
                .map(decoder -> decoder.decode().apply(position, args));
    }

    public static int minimumArgs(ElementKind kind) {
        Decoder decoder = DECODERS.get(kind);
        if (decoder == null) {
            throw new IllegalArgumentException("Not a widget kind: " + kind);
        }
        return decoder.minArgs();
    }

    private static GuiElement bang(Position pos, List<String> a) {
        return Bang.builder()
                .position(pos)
                .size(intAt(a, 0, IemDefaults.SIZE))
                .hold(intAt(a, 1, 250))
                .interrupt(intAt(a, 2, 50))
                .init(intAt(a, 3, 0))
                .send(stringAt(a, 4, NO_NAME))
                .receive(stringAt(a, 5, NO_NAME))
                .label(stringAt(a, 6, NO_NAME))
                .labelX(intAt(a, 7, 17))
                .labelY(intAt(a, 8, 7))
                .font(intAt(a, 9, 0))
                .fontSize(intAt(a, 10, 10))
                .bgColor(intAt(a, 11, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 12, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 13, IemDefaults.LABEL_COLOR))
                .build();
    }

    private static GuiElement toggle(Position pos, List<String> a) {
        return Toggle.builder()
                .position(pos)
                .size(intAt(a, 0, IemDefaults.SIZE))
                .init(intAt(a, 1, 0))
                .send(stringAt(a, 2, NO_NAME))
                .receive(stringAt(a, 3, NO_NAME))
                .label(stringAt(a, 4, NO_NAME))
                .labelX(intAt(a, 5, 17))
                .labelY(intAt(a, 6, 7))
                .font(intAt(a, 7, 0))
                .fontSize(intAt(a, 8, 10))
                .bgColor(intAt(a, 9, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 10, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 11, IemDefaults.LABEL_COLOR))
                .initValue(intAt(a, 12, 0))
                .defaultValue(intAt(a, 13, 0))
                .build();
    }

    private static GuiElement numberBox(Position pos, List<String> a) {
        return NumberBox.builder()
                .position(pos)
                .width(intAt(a, 0, 5))
                .height(intAt(a, 1, 14))
                .minValue(doubleAt(a, 2, -1e37))
                .maxValue(doubleAt(a, 3, 1e37))
                .logFlag(intAt(a, 4, 0))
                .init(intAt(a, 5, 0))
                .send(stringAt(a, 6, NO_NAME))
                .receive(stringAt(a, 7, NO_NAME))
                .label(stringAt(a, 8, NO_NAME))
                .labelX(intAt(a, 9, 0))
                .labelY(intAt(a, 10, -8))
                .font(intAt(a, 11, 0))
                .fontSize(intAt(a, 12, 10))
                .bgColor(intAt(a, 13, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 14, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 15, IemDefaults.LABEL_COLOR))
                .initValue(doubleAt(a, 16, 0))
                .logHeight(intAt(a, 17, 256))
                .build();
    }

    private static GuiElement verticalSlider(Position pos, List<String> a) {
        return VerticalSlider.builder()
                .position(pos)
                .width(intAt(a, 0, 15))
                .height(intAt(a, 1, 128))
                .minValue(doubleAt(a, 2, 0))
                .maxValue(doubleAt(a, 3, 127))
                .logFlag(intAt(a, 4, 0))
                .init(intAt(a, 5, 0))
                .send(stringAt(a, 6, NO_NAME))
                .receive(stringAt(a, 7, NO_NAME))
                .label(stringAt(a, 8, NO_NAME))
                .labelX(intAt(a, 9, 0))
                .labelY(intAt(a, 10, -9))
                .font(intAt(a, 11, 0))
                .fontSize(intAt(a, 12, 10))
                .bgColor(intAt(a, 13, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 14, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 15, IemDefaults.LABEL_COLOR))
                .initValue(doubleAt(a, 16, 0))
                .steady(intAt(a, 17, 1))
                .build();
    }

    private static GuiElement horizontalSlider(Position pos, List<String> a) {
        return HorizontalSlider.builder()
                .position(pos)
                .width(intAt(a, 0, 128))
                .height(intAt(a, 1, 15))
                .minValue(doubleAt(a, 2, 0))
                .maxValue(doubleAt(a, 3, 127))
                .logFlag(intAt(a, 4, 0))
                .init(intAt(a, 5, 0))
                .send(stringAt(a, 6, NO_NAME))
                .receive(stringAt(a, 7, NO_NAME))
                .label(stringAt(a, 8, NO_NAME))
                .labelX(intAt(a, 9, -2))
                .labelY(intAt(a, 10, -8))
                .font(intAt(a, 11, 0))
                .fontSize(intAt(a, 12, 10))
                .bgColor(intAt(a, 13, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 14, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 15, IemDefaults.LABEL_COLOR))
                .initValue(doubleAt(a, 16, 0))
                .steady(intAt(a, 17, 1))
                .build();
    }

    private static GuiElement verticalRadio(Position pos, List<String> a) {
        return VerticalRadio.builder()
                .position(pos)
                .size(intAt(a, 0, IemDefaults.SIZE))
                .newOld(intAt(a, 1, 0))
                .init(intAt(a, 2, 0))
                .number(intAt(a, 3, 8))
                .send(stringAt(a, 4, NO_NAME))
                .receive(stringAt(a, 5, NO_NAME))
                .label(stringAt(a, 6, NO_NAME))
                .labelX(intAt(a, 7, 0))
                .labelY(intAt(a, 8, -8))
                .font(intAt(a, 9, 0))
                .fontSize(intAt(a, 10, 10))
                .bgColor(intAt(a, 11, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 12, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 13, IemDefaults.LABEL_COLOR))
                .initValue(intAt(a, 14, 0))
                .build();
    }

    private static GuiElement horizontalRadio(Position pos, List<String> a) {
        return HorizontalRadio.builder()
                .position(pos)
                .size(intAt(a, 0, IemDefaults.SIZE))
                .newOld(intAt(a, 1, 0))
                .init(intAt(a, 2, 0))
                .number(intAt(a, 3, 8))
                .send(stringAt(a, 4, NO_NAME))
                .receive(stringAt(a, 5, NO_NAME))
                .label(stringAt(a, 6, NO_NAME))
                .labelX(intAt(a, 7, 0))
                .labelY(intAt(a, 8, -8))
                .font(intAt(a, 9, 0))
                .fontSize(intAt(a, 10, 10))
                .bgColor(intAt(a, 11, IemDefaults.BG_COLOR))
                .fgColor(intAt(a, 12, IemDefaults.FG_COLOR))
                .labelColor(intAt(a, 13, IemDefaults.LABEL_COLOR))
                .initValue(intAt(a, 14, 0))
                .build();
    }

    private static GuiElement canvas(Position pos, List<String> a) {
        return IemCanvas.builder()
                .position(pos)
                .size(intAt(a, 0, IemDefaults.SIZE))
                .width(intAt(a, 1, 100))
                .height(intAt(a, 2, 60))
                .send(stringAt(a, 3, NO_NAME))
                .receive(stringAt(a, 4, NO_NAME))
                .label(stringAt(a, 5, NO_NAME))
                .labelX(intAt(a, 6, 20))
                .labelY(intAt(a, 7, 12))
                .font(intAt(a, 8, 0))
                .fontSize(intAt(a, 9, 14))
                .bgColor(intAt(a, 10, -233017))
                .labelColor(intAt(a, 11, IemDefaults.LABEL_COLOR))
                .build();
    }

    private static GuiElement vuMeter(Position pos, List<String> a) {
        return VuMeter.builder()
                .position(pos)
                .width(intAt(a, 0, 15))
                .height(intAt(a, 1, 120))
                .receive(stringAt(a, 2, NO_NAME))
                .label(stringAt(a, 3, NO_NAME))
                .labelX(intAt(a, 4, -1))
                .labelY(intAt(a, 5, -8))
                .font(intAt(a, 6, 0))
                .fontSize(intAt(a, 7, 10))
                .bgColor(intAt(a, 8, IemDefaults.BG_COLOR))
                .labelColor(intAt(a, 9, IemDefaults.LABEL_COLOR))
                .scale(intAt(a, 10, 1))
                .build();
    }
}
