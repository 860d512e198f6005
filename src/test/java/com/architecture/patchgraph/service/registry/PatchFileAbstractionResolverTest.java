package com.architecture.patchgraph.service.registry;

import com.architecture.patchgraph.model.graph.AbstractionNode;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.graph.Placement;
import com.architecture.patchgraph.model.graph.PortCounts;
import com.architecture.patchgraph.service.PatchFileService;
import com.architecture.patchgraph.service.parser.PatchParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatchFileAbstractionResolverTest {

    private static final String VOICE = """
            #N canvas 0 50 450 300 10;
            #X obj 10 10 inlet;
            #X obj 60 10 inlet~;
            #X obj 10 40 osc~;
            #X obj 10 70 outlet~;
            #N canvas 0 0 300 180 inside 0;
            #X obj 10 10 outlet;
            #X restore 100 100 pd inside;
            """;

    @Mock
    private PatchFileService fileService;

    @InjectMocks
    private PatchFileAbstractionResolver resolver;

    @Test
    void resolve_countsTopLevelInletsAndOutlets() {
        Path path = Path.of("voice.pd");
        when(fileService.parseFile(path)).thenReturn(new PatchParser().parse(VOICE));

        PortCounts counts = resolver.resolve(path);

        assertThat(counts).isEqualTo(PortCounts.of(2, 1));
        verify(fileService).parseFile(path);
    }

    @Test
    void resolve_backsAbstractionNodesInGraph() {
        Path path = Path.of("lib", "voice.pd");
        when(fileService.parseFile(path)).thenReturn(new PatchParser().parse(VOICE));
        PatchGraph graph = new PatchGraph();
        graph.setAbstractionResolver(resolver);

        AbstractionNode voice = graph.addAbstraction("voice 440", path, Placement.nextRow(), null, null);

        assertThat(voice.getNumInlets()).isEqualTo(2);
        assertThat(voice.getNumOutlets()).isEqualTo(1);
        assertThat(voice.getSourcePath()).isEqualTo(path);
    }
}
