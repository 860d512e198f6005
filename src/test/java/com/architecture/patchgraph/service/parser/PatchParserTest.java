package com.architecture.patchgraph.service.parser;

import com.architecture.patchgraph.exception.PatchParseException;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.ElementKind;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.SubPatch;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchParserTest {

    private final PatchParser parser = new PatchParser();

    @Test
    void parse_buildsFlatPatch() {
        Patch patch = parser.parse("#N canvas 0 50 450 300 10;\n#X obj 50 50 osc~ 440;\n#X obj 50 100 dac~;\n#X connect 0 0 1 0;");

        assertThat(patch.getCanvas().getWidth()).isEqualTo(450);
        assertThat(patch.getElements()).extracting(PatchElement::getKind)
                .containsExactly(ElementKind.OBJECT, ElementKind.OBJECT, ElementKind.CONNECT);
        assertThat(patch.getObjects()).hasSize(2);
        assertThat(patch.getConnections()).containsExactly(new Connect(0, 0, 1, 0));
    }

    @Test
    void parse_nestsSubCanvasesWithRestore() {
        String text = """
                #N canvas 0 50 450 300 10;
                #X obj 10 10 loadbang;
                #N canvas 0 0 300 180 outer 0;
                #X obj 10 10 inlet;
                #N canvas 0 0 200 100 inner 0;
                #X obj 5 5 outlet;
                #X restore 20 40 pd inner;
                #X connect 0 0 1 0;
                #X restore 30 60 pd outer;
                #X connect 0 0 1 0;
                """;

        Patch patch = parser.parse(text);

        assertThat(patch.getElements()).hasSize(3);
        SubPatch outer = (SubPatch) patch.getElements().get(1);
        assertThat(outer.getRestore().getName()).isEqualTo("outer");
        assertThat(outer.getCanvas().getName()).isEqualTo("outer");
        assertThat(outer.getElements()).extracting(PatchElement::getKind)
                .containsExactly(ElementKind.OBJECT, ElementKind.SUBPATCH, ElementKind.CONNECT);

        SubPatch inner = (SubPatch) outer.getElements().get(1);
        assertThat(inner.getRestore().getPosition().getX()).isEqualTo(20);
        assertThat(((ObjectBox) inner.getElements().get(0)).getClassName()).isEqualTo("outlet");
    }

    @Test
    void parse_closesUnterminatedSubCanvasesImplicitly() {
        Patch patch = parser.parse("#N canvas 0 50 450 300 10;\n#N canvas 0 0 100 100 sub 0;\n#X obj 1 1 f;");

        assertThat(patch.getElements()).hasSize(1);
        SubPatch sub = (SubPatch) patch.getElements().get(0);
        assertThat(sub.getRestore()).isNull();
        assertThat(sub.getElements()).hasSize(1);
    }

    @Test
    void parse_acceptsObsoletePopAsNoOp() {
        Patch patch = parser.parse("#N canvas 0 50 450 300 10;\n#X obj 1 1 f;\n#X pop;");

        assertThat(patch.getElements()).hasSize(1);
    }

    @Test
    void parse_throws_whenInputEmpty() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(PatchParseException.class)
                .hasMessage("Empty patch file");
        assertThatThrownBy(() -> parser.parse("  \n ")).isInstanceOf(PatchParseException.class);
    }

    @Test
    void parse_throws_whenElementPrecedesCanvas() {
        assertThatThrownBy(() -> parser.parse("#X obj 1 1 f;\n#N canvas 0 50 450 300 10;"))
                .isInstanceOf(PatchParseException.class)
                .hasMessageStartingWith("Element before canvas");
    }

    @Test
    void parse_throws_whenRestoreHasNoOpenSubCanvas() {
        assertThatThrownBy(() -> parser.parse("#N canvas 0 50 450 300 10;\n#X restore 0 0 pd x;"))
                .isInstanceOf(PatchParseException.class)
                .hasMessageStartingWith("Restore without matching canvas");
    }

    @Test
    void parse_throws_whenStatementTruncated() {
        assertThatThrownBy(() -> parser.parse("#N canvas 0 50 450 300 10;\n#X connect 0 0;"))
                .isInstanceOf(PatchParseException.class)
                .hasMessageContaining("connect");
    }
}
