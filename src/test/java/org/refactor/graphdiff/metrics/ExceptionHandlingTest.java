package org.refactor.graphdiff.metrics;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.SourceParser;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionHandlingTest {

    static final String WIDE = "class A {\n"
            + "    void f() { try { g(); } catch (Exception e) { } }\n"
            + "    void g() {}\n"
            + "}";
    static final String NARROW = "class A {\n"
            + "    void f() {\n"
            + "        try { g(); }\n"
            + "        catch (IllegalStateException | IllegalArgumentException e) { throw e; }\n"
            + "        finally { }\n"
            + "    }\n"
            + "    void g() {}\n"
            + "}";

    private final SourceParser parser = new SourceParser();

    @Test
    void countsTryCatchFinallyAndThrow() {
        ExceptionHandling e = ExceptionHandling.of(parser.parse(NARROW));

        assertEquals(1, e.tryBlocks());
        assertEquals(1, e.catchClauses());
        assertEquals(Set.of("IllegalStateException", "IllegalArgumentException"), e.caughtTypes());
        assertEquals(0, e.genericCatches());
        assertEquals(1, e.finallyBlocks());
        assertEquals(1, e.throwStatements());
    }

    @Test
    void narrowingACatchIsMoreSpecific() {
        ExceptionHandling.Changes changes = ExceptionHandling.of(parser.parse(WIDE))
                .changesTo(ExceptionHandling.of(parser.parse(NARROW)));

        assertEquals(0, changes.tryBlocksDelta());
        assertEquals(0, changes.catchClausesDelta());
        assertEquals(List.of("IllegalArgumentException", "IllegalStateException"), changes.newTypes());
        assertEquals(List.of("Exception"), changes.removedTypes());
        assertEquals(-1, changes.specificityChange());
        assertEquals(1, changes.finallyBlocksDelta());
        assertEquals(1, changes.throwStatementsDelta());
        assertEquals(3, changes.total());
    }

    @Test
    void unparsedSourceHasNoHandlers() {
        assertSame(ExceptionHandling.NONE, ExceptionHandling.of(parser.parse("}}} not java {{{")));
    }
}
