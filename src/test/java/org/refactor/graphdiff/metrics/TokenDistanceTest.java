package org.refactor.graphdiff.metrics;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.SourceParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenDistanceTest {

    private final SourceParser parser = new SourceParser();

    private List<String> tokens(String code) {
        return TokenDistance.tokens(code, parser.parse(code));
    }

    @Test
    void snippetTokensExcludeWrapperAndComments() {
        assertEquals(List.of("int", "x", "=", "1", ";", "x", "++", ";"), tokens("int x = 1; // note\nx++;"));
    }

    @Test
    void completeUnitKeepsEveryToken() {
        assertEquals(List.of("class", "A", "{", "}"), tokens("class A {}"));
    }

    @Test
    void unparsedSourceSplitsOnWhitespace() {
        assertEquals(List.of("}}}", "not", "java", "{{{"), tokens("  }}} not\njava {{{ "));
        assertEquals(List.of(), TokenDistance.tokens("", parser.parse("")));
    }

    @Test
    void levenshteinCountsSingleTokenEdits() {
        assertEquals(2, TokenDistance.levenshtein(List.of("a", "b", "c"), List.of("a", "x", "c", "d")));
        assertEquals(2, TokenDistance.levenshtein(List.of(), List.of("a", "b")));
        assertEquals(0, TokenDistance.levenshtein(List.of("a"), List.of("a")));
    }

    @Test
    void whitespaceOnlyChangesAreFree() {
        assertEquals(0, TokenDistance.levenshtein(tokens("int f() { return 1; }"),
                tokens("int f() {\n    return 1;\n}")));
    }
}
