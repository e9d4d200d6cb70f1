package com.github.errfix.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class GoStringsTest {

    @Test
    void unquotesEscapes() {
        assertThat(GoStrings.unquote("\"a\\tb\\n\\\"c\\\\\"")).hasValue("a\tb\n\"c\\");
        assertThat(GoStrings.unquote("\"\\x41\\101\\u00e9\\U0001F600\"")).hasValue("AAé\uD83D\uDE00");
    }

    @Test
    void byteEscapesFormUtf8Sequences() {
        assertThat(GoStrings.unquote("\"\\xc3\\xa9\"")).hasValue("é");
    }

    @Test
    void rawStringsAreTakenLiterally() {
        assertThat(GoStrings.unquote("`a\\n\"b\"\r\nc`")).hasValue("a\\n\"b\"\nc");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "\"", "\"abc", "'a'", "\"a\"b\"", "\"\\q\"", "\"\\x4\"", "\"\\400\"", "\"\\ud800\"", "\"a\\\""})
    void rejectsMalformedLiterals(String literal) {
        assertThat(GoStrings.unquote(literal)).isEmpty();
    }

    @Test
    void quotesLikeGo() {
        assertThat(GoStrings.quote("plain")).isEqualTo("\"plain\"");
        assertThat(GoStrings.quote("say \"hi\"\\")).isEqualTo("\"say \\\"hi\\\"\\\\\"");
        assertThat(GoStrings.quote("tab\there\n")).isEqualTo("\"tab\\there\\n\"");
        assertThat(GoStrings.quote("\u0001\u007f")).isEqualTo("\"\\x01\\x7f\"");
        assertThat(GoStrings.quote("café ✓")).isEqualTo("\"café ✓\"");
        assertThat(GoStrings.quote("\u00a0\u200b")).isEqualTo("\"\\u00a0\\u200b\"");
    }

    @Test
    void quoteThenUnquoteKeepsText() {
        String text = "x: %d, \"y\"\t\u0000é";

        assertThat(GoStrings.unquote(GoStrings.quote(text))).hasValue(text);
    }
}
