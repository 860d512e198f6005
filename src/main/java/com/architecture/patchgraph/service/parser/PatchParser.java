package com.architecture.patchgraph.service.parser;

import com.architecture.patchgraph.exception.PatchParseException;
import com.architecture.patchgraph.model.tree.CanvasProperties;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.model.tree.PatchElement;
import com.architecture.patchgraph.model.tree.Restore;
import com.architecture.patchgraph.model.tree.SubPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a {@link Patch} tree from patch text.
 *
 * <p>Nested canvases are tracked with an explicit stack: {@code #N canvas} pushes the canvas
 * being filled, {@code #X restore} pops it and appends the finished {@link SubPatch} to the
 * parent. Sub-canvases still open at end of input are closed without a restore directive.</p>
 */
@Service
@Slf4j
public class PatchParser {

    private final StatementParser statementParser = new StatementParser();

    private static final class Frame {
        private final CanvasProperties canvas;
        private final List<PatchElement> elements = new ArrayList<>();

        private Frame(CanvasProperties canvas) {
            this.canvas = canvas;
        }
    }

    public Patch parse(String content) {
        if (content == null) {
            throw new PatchParseException("Empty patch file");
        }
        List<String> statements = StatementTokenizer.splitStatements(StatementTokenizer.preprocess(content));
        if (statements.isEmpty()) {
            throw new PatchParseException("Empty patch file");
        }

        Deque<Frame> stack = new ArrayDeque<>();
        Frame current = null;

        for (String statement : statements) {
            List<String> tokens = StatementTokenizer.tokenize(statement);
            if (tokens.isEmpty()) {
                continue;
            }

            if (statementParser.isCanvasOpen(tokens)) {
                CanvasProperties canvas = statementParser.parseCanvas(tokens);
                if (current != null) {
                    stack.push(current);
                    log.debug("[Parser] Opening sub-canvas at depth {}", stack.size());
                }
                current = new Frame(canvas);
                continue;
            }

            if (current == null) {
                throw new PatchParseException("Element before canvas: " + statement);
            }

            if (statementParser.isRestore(tokens)) {
                Restore restore = statementParser.parseRestore(tokens);
                if (stack.isEmpty()) {
                    throw new PatchParseException("Restore without matching canvas: " + statement);
                }
                SubPatch subPatch = new SubPatch(current.canvas, current.elements, restore);
                current = stack.pop();
                current.elements.add(subPatch);
            } else if (!statementParser.isPop(tokens)) {
                current.elements.add(statementParser.parseElement(tokens));
            }
        }

        if (current == null) {
            throw new PatchParseException("No canvas found in patch");
        }

        if (!stack.isEmpty()) {
            log.warn("[Parser] Input ended with {} unterminated sub-canvas(es); closing them implicitly",
                    stack.size());
        }
        while (!stack.isEmpty()) {
            SubPatch unterminated = new SubPatch(current.canvas, current.elements, null);
            current = stack.pop();
            current.elements.add(unterminated);
        }

        Patch patch = new Patch(current.canvas, current.elements);
        log.info("[Parser] Parsed {} statements into {} top-level elements",
                statements.size(), patch.getElements().size());
        return patch;
    }
}
