package com.architecture.patchgraph.model.graph;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Converts between display text and the escaped form stored in patch files.
 */
public final class PatchText {

    private PatchText() {
    }

    /**
     * Doubles backslashes, turns {@code ;} and {@code ,} into spaced escape sequences and escapes
     * a {@code $} that is followed by a digit.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        String escaped = text.replace("\\", "\\\\");
        escaped = escaped.replace(";", " \\; ");
        escaped = escaped.replace(",", " \\, ");
        return escaped.replaceAll("\\$(?=[0-9])", "\\\\\\$");
    }

    /**
     * Reverses {@link #escape(String)} for display: {@code  \; } becomes a line break,
     * {@code  \, } a comma and {@code \$} a dollar sign. Each resulting line is trimmed.
     */
    public static String unescape(String text) {
        if (text == null) {
            return "";
        }
        String display = text.replaceAll(" (?<!\\\\)\\\\; ", "\n");
        display = display.replaceAll(" (?<!\\\\)\\\\, ", ",");
        display = display.replaceAll("(?<!\\\\)\\\\\\$", "\\$");
        return Arrays.stream(display.split("\n", -1))
                .map(String::trim)
                .collect(Collectors.joining("\n"));
    }
}
