package com.architecture.patchgraph.service;

import com.architecture.patchgraph.model.tree.CommentText;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.SubPatch;
import com.architecture.patchgraph.model.tree.SymbolAtom;
import com.architecture.patchgraph.service.parser.PatchParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatchTreeServiceTest {

    private static final String NESTED = """
            #N canvas 0 50 450 300 10;
            #X declare -path outer;
            #X obj 10 10 r volume;
            #X floatatom 10 40 5 0 0 0 volume volume volume;
            #X text 10 70 notes;
            #N canvas 0 0 300 180 inner 0;
            #X declare -path inner -lib zexy;
            #X obj 10 10 s volume;
            #X obj 10 40 s~ volume;
            #X obj 10 70 send other;
            #X symbolatom 10 100 10 0 0 0 - volume -;
            #X restore 100 100 pd inner;
            """;

    private final PatchParser parser = new PatchParser();
    private final PatchTreeService treeService = new PatchTreeService();

    @Test
    void findElements_visitsSubCanvasBeforeItsChildren() {
        Patch patch = parser.parse(NESTED);

        List<PatchElement> found = treeService.findElements(patch,
                e -> e instanceof SubPatch || e instanceof ObjectBox);

        assertThat(found).hasSize(5);
        assertThat(found.get(1)).isInstanceOf(SubPatch.class);
        assertThat(((ObjectBox) found.get(2)).getText()).isEqualTo("s volume");
    }

    @Test
    void transform_dropsElementsMappedToNull() {
        Patch patch = parser.parse(NESTED);

        Patch stripped = treeService.transform(patch, e -> e instanceof CommentText ? null : e);

        assertThat(treeService.findElements(stripped, CommentText.class::isInstance)).isEmpty();
        assertThat(stripped.getElements()).hasSize(patch.getElements().size() - 1);
    }

    @Test
    void transform_rewritesChildrenBeforeParent() {
        Patch patch = parser.parse(NESTED);

        Patch result = treeService.transform(patch, e -> {
            if (e instanceof SubPatch sub) {
                assertThat(sub.getElements()).noneMatch(ObjectBox.class::isInstance);
            }
            return e instanceof ObjectBox ? null : e;
        });

        assertThat(treeService.findElements(result, ObjectBox.class::isInstance)).isEmpty();
    }

    @Test
    void transform_withIdentity_leavesTreeEqual() {
        Patch patch = parser.parse(NESTED);

        assertThat(treeService.transform(patch, e -> e)).isEqualTo(patch);
    }

    @Test
    void renameSendsReceives_rewritesAtomsAndSendReceiveObjects() {
        Patch patch = parser.parse(NESTED);

        Patch renamed = treeService.renameSendsReceives(patch, "volume", "level");

        List<String> objectTexts = treeService.findElements(renamed, ObjectBox.class::isInstance).stream()
                .map(e -> ((ObjectBox) e).getText())
                .toList();
        assertThat(objectTexts).containsExactly("r level", "s level", "s~ level", "send other");

        FloatAtom atom = (FloatAtom) treeService.findElements(renamed, FloatAtom.class::isInstance).get(0);
        assertThat(atom.getLabel()).isEqualTo("level");
        assertThat(atom.getReceive()).isEqualTo("level");
        assertThat(atom.getSend()).isEqualTo("level");

        SymbolAtom symbol = (SymbolAtom) treeService.findElements(renamed, SymbolAtom.class::isInstance).get(0);
        assertThat(symbol.getReceive()).isEqualTo("level");
        assertThat(symbol.getLabel()).isEqualTo("-");
    }

    @Test
    void renameSendsReceives_leavesOtherObjectsAlone() {
        Patch patch = parser.parse("#N canvas 0 50 450 300 10;\n#X obj 10 10 print volume;\n");

        Patch renamed = treeService.renameSendsReceives(patch, "volume", "level");

        assertThat(renamed).isEqualTo(patch);
    }

    @Test
    void extractDeclarePaths_listsInnerCanvasesFirst() {
        Patch patch = parser.parse(NESTED);

        assertThat(treeService.extractDeclarePaths(patch)).containsExactly("inner", "outer");
    }
}
