package com.architecture.patchgraph.service;

import com.architecture.patchgraph.model.tree.Declare;
import com.architecture.patchgraph.model.tree.ElementContainer;
import com.architecture.patchgraph.model.tree.FloatAtom;
import com.architecture.patchgraph.model.tree.ObjectBox;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.SubPatch;
import com.architecture.patchgraph.model.tree.SymbolAtom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Queries and rewrites over parsed patch trees. Trees are immutable; rewrites return a
 * new tree.
 */
@Service
@Slf4j
public class PatchTreeService {

    private static final Set<String> SEND_RECEIVE_CLASSES =
            Set.of("send", "s", "receive", "r", "send~", "s~", "receive~", "r~");

    /**
     * Apply {@code fn} to every element, depth-first: a sub-canvas's children are rewritten
     * before the sub-canvas itself is passed to {@code fn}. A null result drops the element.
     */
    public Patch transform(Patch patch, Function<PatchElement, PatchElement> fn) {
        return patch.withElements(transformAll(patch.getElements(), fn));
    }

    /**
     * All elements matching {@code predicate}, a sub-canvas before its children.
     */
    public List<PatchElement> findElements(Patch patch, Predicate<PatchElement> predicate) {
        List<PatchElement> found = new ArrayList<>();
        collect(patch, predicate, found);
        return found;
    }

    /**
     * Rename a wireless send/receive name in atoms and in the first argument of
     * send/receive objects, at every nesting level.
     */
    public Patch renameSendsReceives(Patch patch, String oldName, String newName) {
        Patch renamed = transform(patch, element -> {
            if (element instanceof FloatAtom atom) {
                return atom.toBuilder()
                        .label(swap(atom.getLabel(), oldName, newName))
                        .receive(swap(atom.getReceive(), oldName, newName))
                        .send(swap(atom.getSend(), oldName, newName))
                        .build();
            }
            if (element instanceof SymbolAtom atom) {
                return atom.toBuilder()
                        .label(swap(atom.getLabel(), oldName, newName))
                        .receive(swap(atom.getReceive(), oldName, newName))
                        .send(swap(atom.getSend(), oldName, newName))
                        .build();
            }
            if (element instanceof ObjectBox box && SEND_RECEIVE_CLASSES.contains(box.getClassName())
                    && !box.getArgs().isEmpty() && box.getArgs().get(0).equals(oldName)) {
                List<String> args = new ArrayList<>(box.getArgs());
                args.set(0, newName);
                return box.withArgs(args);
            }
            return element;
        });
        log.info("[PatchTree] Renamed send/receive '{}' to '{}'", oldName, newName);
        return renamed;
    }

    /**
     * Every {@code -path} value of {@code declare} directives, innermost canvases first.
     */
    public List<String> extractDeclarePaths(ElementContainer container) {
        List<String> paths = new ArrayList<>();
        for (PatchElement element : container.getElements()) {
            if (element instanceof SubPatch sub) {
                paths.addAll(extractDeclarePaths(sub));
            }
        }
        for (PatchElement element : container.getElements()) {
            if (element instanceof Declare declare) {
                paths.addAll(declare.getPaths());
            }
        }
        return paths;
    }

    private List<PatchElement> transformAll(List<PatchElement> elements, Function<PatchElement, PatchElement> fn) {
        List<PatchElement> result = new ArrayList<>();
        for (PatchElement element : elements) {
            PatchElement input = element instanceof SubPatch sub
                    ? sub.withElements(transformAll(sub.getElements(), fn))
                    : element;
            PatchElement output = fn.apply(input);
            if (output != null) {
                result.add(output);
            }
        }
        return result;
    }

    private void collect(ElementContainer container, Predicate<PatchElement> predicate, List<PatchElement> found) {
        for (PatchElement element : container.getElements()) {
            if (predicate.test(element)) {
                found.add(element);
            }
            if (element instanceof SubPatch sub) {
                collect(sub, predicate, found);
            }
        }
    }

    private static String swap(String value, String oldName, String newName) {
        return oldName.equals(value) ? newName : value;
    }
}
