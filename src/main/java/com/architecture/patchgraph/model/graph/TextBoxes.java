package com.architecture.patchgraph.model.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Rough footprint of a text box (object, message), from its display text.
 */
final class TextBoxes {

    static final int WRAP_WIDTH = 60;
    static final int CHAR_WIDTH = 6;
    static final int MIN_WIDTH = 50;
    static final int PADDING = 20;
    static final int LINE_HEIGHT = 15;
    static final int BASE_HEIGHT = 10;

    private TextBoxes() {
    }

    static List<String> displayLines(String escapedText) {
        List<String> lines = new ArrayList<>();
        for (String line : PatchText.unescape(escapedText).split("\n")) {
            String remaining = line.trim();
            while (remaining.length() > WRAP_WIDTH) {
                int cut = remaining.lastIndexOf(' ', WRAP_WIDTH);
                if (cut <= 0) {
                    cut = WRAP_WIDTH;
                }
                lines.add(remaining.substring(0, cut).trim());
                remaining = remaining.substring(cut).trim();
            }
            if (!remaining.isEmpty()) {
                lines.add(remaining);
            }
        }
        return lines;
    }

    static int width(String escapedText) {
        int maxChars = displayLines(escapedText).stream().mapToInt(String::length).max().orElse(0);
        return Math.max(MIN_WIDTH, PADDING + maxChars * CHAR_WIDTH);
    }

    static int height(String escapedText) {
        return BASE_HEIGHT + LINE_HEIGHT * displayLines(escapedText).size();
    }
}
