package com.architecture.patchgraph.model.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatchTextTest {

    @Test
    void escape_spacesOutSemicolonsAndCommas() {
        assertThat(PatchText.escape("a;b")).isEqualTo("a \\; b");
        assertThat(PatchText.escape("1,2")).isEqualTo("1 \\, 2");
    }

    @Test
    void escape_onlyEscapesDollarBeforeDigit() {
        assertThat(PatchText.escape("set $1 $x")).isEqualTo("set \\$1 $x");
    }

    @Test
    void escape_doublesBackslashes_andToleratesNull() {
        assertThat(PatchText.escape("a\\b")).isEqualTo("a\\\\b");
        assertThat(PatchText.escape(null)).isEmpty();
    }

    @Test
    void unescape_turnsSemicolonIntoLineBreak() {
        assertThat(PatchText.unescape("440 \\; gain 0.5")).isEqualTo("440\ngain 0.5");
    }

    @Test
    void unescape_reversesCommaAndDollar() {
        assertThat(PatchText.unescape("1 \\, 2 \\$1")).isEqualTo("1,2 $1");
    }
}
