package com.architecture.patchgraph.service.registry;

import com.architecture.patchgraph.model.graph.AbstractionIoResolver;
import com.architecture.patchgraph.model.graph.PortCounts;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.service.PatchFileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Set;

/**
 * Infers an abstraction's ports from its patch file: one inlet per top-level
 * {@code inlet}/{@code inlet~} object, one outlet per {@code outlet}/{@code outlet~}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchFileAbstractionResolver implements AbstractionIoResolver {

    private static final Set<String> INLETS = Set.of("inlet", "inlet~");
    private static final Set<String> OUTLETS = Set.of("outlet", "outlet~");

    private final PatchFileService fileService;

    @Override
    public PortCounts resolve(Path sourcePath) {
        Patch patch = fileService.parseFile(sourcePath);
        int inlets = count(patch, INLETS);
        int outlets = count(patch, OUTLETS);
        log.debug("[Registry] Abstraction {} has {} inlet(s), {} outlet(s)", sourcePath, inlets, outlets);
        return PortCounts.of(inlets, outlets);
    }

    private int count(Patch patch, Set<String> classNames) {
        return (int) patch.getElements().stream()
                .filter(ObjectBox.class::isInstance)
                .map(e -> ((ObjectBox) e).getClassName())
                .filter(classNames::contains)
                .count();
    }
}
