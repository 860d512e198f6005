package com.architecture.patchgraph.service.serializer;

import com.architecture.patchgraph.PatchFixtures;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.Connect;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.IemCanvas;
import com.architecture.patchgraph.model.tree.MessageBox;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Position;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.SubPatch;
import com.architecture.patchgraph.service.parser.PatchParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatchSerializerTest {

    private final PatchParser parser = new PatchParser();
    private final PatchSerializer serializer = new PatchSerializer();

    @Test
    void serialize_reproducesEveryStatementOfSimplePatch() {
        String text = "#N canvas 0 50 450 300 10;\n#X obj 50 50 osc~ 440;\n#X obj 50 100 dac~;\n#X connect 0 0 1 0;";

        String out = serializer.serialize(parser.parse(text));

        assertThat(out).isEqualTo(text + "\n");
    }

    @Test
    void serialize_isExactForCanonicalInput() {
        String text = PatchFixtures.load(PatchFixtures.SYNTH);

        assertThat(serializer.serialize(parser.parse(text))).isEqualTo(text);
    }

    @Test
    void roundTrip_preservesTreeStructure() {
        Patch first = parser.parse(PatchFixtures.load(PatchFixtures.SYNTH));
        Patch second = parser.parse(serializer.serialize(first));

        assertThat(second).isEqualTo(first);
        assertThat(second.getElements()).extracting(PatchElement::getKind)
                .containsExactlyElementsOf(first.getElements().stream().map(PatchElement::getKind).toList());
    }

    @Test
    void roundTrip_normalizesNonCanonicalDefaults() {
        // short floatatom and a 6-field canvas come back with their defaults spelled out
        String text = "#N canvas 0 0 300 200;\n#X floatatom 10 10;\n";

        String out = serializer.serialize(parser.parse(text));

        assertThat(out).isEqualTo("#N canvas 0 0 300 200 10;\n#X floatatom 10 10 5 0 0 0 - - -;\n");
        assertThat(parser.parse(out)).isEqualTo(parser.parse(text));
    }

    @Test
    void serialize_writesSubPatchBlockWithRestore() {
        SubPatch sub = new SubPatch(CanvasProperties.subCanvas(300, 180),
                List.of(new ObjectBox(Position.of(10, 10), "inlet")),
                Restore.subpatch(Position.of(40, 50), "voice"));
        Patch patch = new Patch(CanvasProperties.root(), List.of(sub));

        assertThat(serializer.serialize(patch)).isEqualTo("""
                #N canvas 0 50 1000 600 10;
                #N canvas 0 0 300 180 (subpatch) 0;
                #X obj 10 10 inlet;
                #X restore 40 50 pd voice;
                """);
    }

    @Test
    void serializeElement_rendersSingleStatements() {
        assertThat(serializer.serializeElement(new Connect(1, 0, 2, 1))).isEqualTo("#X connect 1 0 2 1;\n");
        assertThat(serializer.serializeElement(new MessageBox(Position.of(5, 6), "set \\$1")))
                .isEqualTo("#X msg 5 6 set \\$1;\n");
        assertThat(serializer.serializeElement(FloatAtom.builder().position(Position.of(1, 2)).upperLimit(0.5).build()))
                .isEqualTo("#X floatatom 1 2 5 0 0.5 0 - - -;\n");
        assertThat(serializer.serializeElement(IemCanvas.builder().position(Position.of(0, 0)).build()))
                .isEqualTo("#X obj 0 0 cnv 15 100 60 empty empty empty 20 12 0 14 -233017 -1 0;\n");
    }
}
