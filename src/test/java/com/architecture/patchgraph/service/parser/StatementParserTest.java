package com.architecture.patchgraph.service.parser;

import com.architecture.patchgraph.exception.PatchParseException;
import com.architecture.patchgraph.model.tree.ArrayDeclaration;
import com.architecture.patchgraph.model.tree.Bang;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.Coords;
import com.architecture.patchgraph.model.tree.Declare;
import com.architecture.patchgraph.model.tree.ElementKind;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.MessageBox;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.RawStatement;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.Toggle;
import com.architecture.patchgraph.model.tree.VuMeter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementParserTest {

    private final StatementParser parser = new StatementParser();

    private PatchElement parse(String statement) {
        return parser.parseElement(StatementTokenizer.tokenize(statement));
    }

    // ========================= CANVAS =========================

    @Test
    void parseCanvas_readsFontSize_whenSevenNumericFields() {
        CanvasProperties canvas = parser.parseCanvas(StatementTokenizer.tokenize("#N canvas 0 50 450 300 12;"));

        assertThat(canvas.isSubCanvas()).isFalse();
        assertThat(canvas.getWidth()).isEqualTo(450);
        assertThat(canvas.getFontSize()).isEqualTo(12);
    }

    @Test
    void parseCanvas_readsNameAndOpenFlag_whenEightFields() {
        CanvasProperties canvas = parser.parseCanvas(StatementTokenizer.tokenize("#N canvas 10 20 300 180 synth 1;"));

        assertThat(canvas.getName()).isEqualTo("synth");
        assertThat(canvas.getOpenOnLoad()).isEqualTo(1);
    }

    @Test
    void parseCanvas_treatsNonNumericSeventhFieldAsName() {
        CanvasProperties canvas = parser.parseCanvas(StatementTokenizer.tokenize("#N canvas 0 0 300 180 mixer;"));

        assertThat(canvas.getName()).isEqualTo("mixer");
        assertThat(canvas.getOpenOnLoad()).isZero();
    }

    @Test
    void parseCanvas_defaultsFontSize_whenSixFields() {
        CanvasProperties canvas = parser.parseCanvas(StatementTokenizer.tokenize("#N canvas 0 0 300 180;"));

        assertThat(canvas.getFontSize()).isEqualTo(10);
        assertThat(canvas.isSubCanvas()).isFalse();
    }

    @Test
    void parseCanvas_throws_whenTooFewFields() {
        assertThatThrownBy(() -> parser.parseCanvas(StatementTokenizer.tokenize("#N canvas 0 0 300;")))
                .isInstanceOf(PatchParseException.class)
                .hasMessageContaining("canvas")
                .hasMessageContaining("expected at least 6");
    }

    @Test
    void parseRestore_joinsNameTokens() {
        Restore restore = parser.parseRestore(StatementTokenizer.tokenize("#X restore 40 60 pd my synth;"));

        assertThat(restore.getPosition()).isEqualTo(Position.of(40, 60));
        assertThat(restore.getKind()).isEqualTo("pd");
        assertThat(restore.getName()).isEqualTo("my synth");
    }

    // ========================= ELEMENTS =========================

    @Test
    void parseElement_decodesGenericObject() {
        ObjectBox obj = (ObjectBox) parse("#X obj 50 50 osc~ 440;");

        assertThat(obj.getPosition()).isEqualTo(Position.of(50, 50));
        assertThat(obj.getClassName()).isEqualTo("osc~");
        assertThat(obj.getArgs()).containsExactly("440");
    }

    @Test
    void parseElement_keepsUnknownClassAsGenericObject() {
        ObjectBox obj = (ObjectBox) parse("#X obj 0 0 mylib/thing~ 1 2 foo;");

        assertThat(obj.getClassName()).isEqualTo("mylib/thing~");
        assertThat(obj.getArgs()).containsExactly("1", "2", "foo");
    }

    @Test
    void parseElement_decodesBangWidget_whenSchemaComplete() {
        Bang bang = (Bang) parse("#X obj 10 10 bng 25 250 50 0 snd rcv empty 17 7 0 10 -262144 -1 -1;");

        assertThat(bang.getSize()).isEqualTo(25);
        assertThat(bang.getSend()).isEqualTo("snd");
        assertThat(bang.getReceive()).isEqualTo("rcv");
        assertThat(bang.hasActiveSendReceive()).isTrue();
    }

    @Test
    void parseElement_fallsBackToObject_whenWidgetArgumentsMissing() {
        PatchElement element = parse("#X obj 10 10 tgl 15;");

        assertThat(element).isInstanceOf(ObjectBox.class);
        assertThat(((ObjectBox) element).getArgs()).containsExactly("15");
    }

    @Test
    void parseElement_substitutesDefaults_forMalformedNumericFields() {
        Toggle toggle = (Toggle) parse("#X obj 10 10 tgl big 0 empty empty empty 17 7 0 10 -262144 -1 -1 0 1;");

        assertThat(toggle.getSize()).isEqualTo(15);
        assertThat(toggle.getDefaultValue()).isEqualTo(1);
    }

    @Test
    void parseElement_decodesVuMeter() {
        VuMeter vu = (VuMeter) parse("#X obj 5 5 vu 15 120 level empty -1 -8 0 10 -66577 -1 1 0;");

        assertThat(vu.getReceive()).isEqualTo("level");
        assertThat(vu.getKind()).isEqualTo(ElementKind.VU_METER);
        assertThat(vu.inletCount()).isEqualTo(2);
        assertThat(vu.outletCount()).isZero();
    }

    @Test
    void parseElement_joinsMessageContentWithEscapes() {
        MessageBox msg = (MessageBox) parse("#X msg 10 10 440 \\, 880 \\; foo 1;");

        assertThat(msg.getContent()).isEqualTo("440 \\, 880 \\; foo 1");
    }

    @Test
    void parseElement_decodesFloatAtomInParserFieldOrder() {
        FloatAtom atom = (FloatAtom) parse("#X floatatom 20 30 8 0 127 0 vol vol-in vol-out;");

        assertThat(atom.getWidth()).isEqualTo(8);
        assertThat(atom.getUpperLimit()).isEqualTo(127.0);
        assertThat(atom.getLabel()).isEqualTo("vol");
        assertThat(atom.getReceive()).isEqualTo("vol-in");
        assertThat(atom.getSend()).isEqualTo("vol-out");
    }

    @Test
    void parseElement_decodesConnectArrayCoordsAndDeclare() {
        assertThat(parse("#X connect 0 1 2 3;")).isEqualTo(new Connect(0, 1, 2, 3));

        ArrayDeclaration array = (ArrayDeclaration) parse("#X array table 64 float 3;");
        assertThat(array.getName()).isEqualTo("table");
        assertThat(array.getSize()).isEqualTo(64);
        assertThat(array.getSaveFlag()).isEqualTo(3);

        Coords coords = (Coords) parse("#X coords 0 -1 1 1 85 60 1 0 0;");
        assertThat(coords.getYFrom()).isEqualTo(-1.0);
        assertThat(coords.getWidth()).isEqualTo(85);
        assertThat(coords.getGraphOnParent()).isEqualTo(1);

        Declare declare = (Declare) parse("#X declare -path lib -lib zexy -path ../abs;");
        assertThat(declare.getPaths()).containsExactly("lib", "../abs");
    }

    @Test
    void parseElement_preservesUnknownStatementsVerbatim() {
        PatchElement array = parse("#A 0 0.1 0.2 0.3;");
        PatchElement unknown = parse("#X scalar foo 1 2;");

        assertThat(array).isInstanceOf(RawStatement.class);
        assertThat(((RawStatement) array).getTokens()).containsExactly("#A", "0", "0.1", "0.2", "0.3");
        assertThat(unknown.isAddressable()).isFalse();
    }

    @Test
    void parseElement_throws_whenStatementTruncated() {
        assertThatThrownBy(() -> parse("#X connect 0 0 1;"))
                .isInstanceOf(PatchParseException.class)
                .hasMessageContaining("#X connect 0 0 1");
        assertThatThrownBy(() -> parse("#X obj 10 10;"))
                .isInstanceOf(PatchParseException.class);
    }

    @Test
    void widgetMinimumArgs_matchesSchemaLengths() {
        assertThat(WidgetDecoders.minimumArgs(ElementKind.BANG)).isEqualTo(14);
        assertThat(WidgetDecoders.minimumArgs(ElementKind.NUMBER_BOX)).isEqualTo(18);
        assertThat(WidgetDecoders.minimumArgs(ElementKind.VU_METER)).isEqualTo(12);
        assertThat(WidgetDecoders.decode(Position.ORIGIN, "osc~", List.of("440"))).isEmpty();
    }
}
