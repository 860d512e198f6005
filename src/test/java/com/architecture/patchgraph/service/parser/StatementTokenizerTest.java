package com.architecture.patchgraph.service.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatementTokenizerTest {

    @Test
    void splitStatements_keepsEscapedTerminatorInsideStatement() {
        List<String> statements = StatementTokenizer.splitStatements("#X msg 10 10 a \\; b;\n#X obj 1 2 f;");

        assertThat(statements).containsExactly("#X msg 10 10 a \\; b;", "#X obj 1 2 f;");
    }

    @Test
    void splitStatements_returnsTrailingStatementWithoutTerminator() {
        List<String> statements = StatementTokenizer.splitStatements("#X obj 1 2 f;\n#X obj 3 4 t b b");

        assertThat(statements).containsExactly("#X obj 1 2 f;", "#X obj 3 4 t b b");
    }

    @Test
    void splitStatements_ignoresBlankTail() {
        assertThat(StatementTokenizer.splitStatements("#X obj 1 2 f;\n\n  ")).hasSize(1);
    }

    @Test
    void preprocess_normalizesLineEndingsAndRemovesContinuations() {
        String text = "#X text 1 2 long\\\ncomment;\r\n#X obj 1 2 f;\r";

        assertThat(StatementTokenizer.preprocess(text)).isEqualTo("#X text 1 2 longcomment;\n#X obj 1 2 f;\n");
    }

    @Test
    void tokenize_splitsOnWhitespaceRunsAndDropsTerminator() {
        assertThat(StatementTokenizer.tokenize("#X obj  10\t20 osc~ 440;"))
                .containsExactly("#X", "obj", "10", "20", "osc~", "440");
    }

    @Test
    void tokenize_keepsEscapeSequencesAsPartOfToken() {
        assertThat(StatementTokenizer.tokenize("#X msg 0 0 hello\\ world \\; \\$1;"))
                .containsExactly("#X", "msg", "0", "0", "hello\\ world", "\\;", "\\$1");
    }
}
