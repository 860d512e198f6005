package com.architecture.patchgraph.service;

import com.architecture.patchgraph.exception.PatchIOException;
import com.architecture.patchgraph.model.graph.PatchGraph;
import com.architecture.patchgraph.model.tree.Patch;
import com.architecture.patchgraph.service.bridge.PatchBridge;
import com.architecture.patchgraph.service.parser.PatchParser;
import com.architecture.patchgraph.service.serializer.PatchSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Whole-document file I/O around the parser and serializer. Files are read as UTF-8 with
 * malformed bytes replaced, never rejected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchFileService {

    private final PatchParser parser;
    private final PatchSerializer serializer;
    private final PatchBridge bridge;

    public Patch parseFile(Path path) {
        Patch patch = parser.parse(readText(path));
        log.info("[PatchFile] Parsed {} ({} top-level elements)", path, patch.getElements().size());
        return patch;
    }

    public void serializeToFile(Patch patch, Path path) {
        writeText(serializer.serialize(patch), path);
    }

    public PatchGraph readGraph(Path path) {
        return bridge.toGraph(parseFile(path));
    }

    public void writeGraph(PatchGraph graph, Path path) {
        writeText(renderGraph(graph), path);
    }

    public String renderGraph(PatchGraph graph) {
        return serializer.serialize(bridge.toTree(graph));
    }

    public String readText(Path path) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(path))).toString();
        } catch (IOException e) {
            throw new PatchIOException("Failed to read patch file " + path, e);
        }
    }

    private void writeText(String content, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.info("[PatchFile] Wrote {} ({} chars)", path, content.length());
        } catch (IOException e) {
            throw new PatchIOException("Failed to write patch file " + path, e);
        }
    }
}
