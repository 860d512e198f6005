package com.architecture.patchgraph.service.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits patch text into statements and statements into tokens.
 *
 * <p>A backslash escapes the character after it: the pair is copied as one unit and is never
 * a separator or a terminator. Escape sequences are kept as-is in the produced tokens.</p>
 */
public final class StatementTokenizer {

    public static final char ESCAPE = '\\';
    public static final char TERMINATOR = ';';

    private StatementTokenizer() {
    }

    /**
     * Normalizes line endings to {@code \n} and removes backslash-newline continuations.
     */
    public static String preprocess(String content) {
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        return normalized.replace("\\\n", "");
    }

    /**
     * Splits preprocessed text on unescaped terminators. Each returned statement is trimmed and
     * still ends with its terminator; trailing text without one is returned as a last statement.
     */
    public static List<String> splitStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == ESCAPE && i + 1 < content.length()) {
                current.append(c).append(content.charAt(i + 1));
                i += 2;
                continue;
            }
            current.append(c);
            if (c == TERMINATOR) {
                addIfNotBlank(statements, current);
                current.setLength(0);
            }
            i++;
        }
        addIfNotBlank(statements, current);
        return statements;
    }

    /**
     * Splits one statement on runs of whitespace outside escapes, dropping the terminator.
     */
    public static List<String> tokenize(String statement) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < statement.length()) {
            char c = statement.charAt(i);
            if (c == ESCAPE && i + 1 < statement.length()) {
                current.append(c).append(statement.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\n' || c == TERMINATOR) {
                flush(tokens, current);
            } else {
                current.append(c);
            }
            i++;
        }
        flush(tokens, current);
        return tokens;
    }

    private static void addIfNotBlank(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static void flush(List<String> tokens, StringBuilder current) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
