package org.refactor.graphdiff.metrics;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.SourceParser;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VariableScopesTest {

    static final String AS_LOCAL = "class A {\n    void f() { int count = 0; count++; }\n}";
    static final String AS_FIELD = "class A {\n    int count;\n    void f() { count++; }\n}";

    private final SourceParser parser = new SourceParser();

    private VariableScopes scopes(String code) {
        return VariableScopes.of(parser.parse(code));
    }

    @Test
    void localPromotedToField() {
        VariableScopes.Changes changes = scopes(AS_LOCAL).changesTo(scopes(AS_FIELD));

        assertEquals(1, changes.localToField());
        assertEquals(0, changes.fieldToLocal());
        assertEquals(1, changes.newFields());
        assertEquals(0, changes.removedFields());
        assertEquals(2, changes.total());
    }

    @Test
    void fieldDemotedToLocal() {
        VariableScopes.Changes changes = scopes(AS_FIELD).changesTo(scopes(AS_LOCAL));

        assertEquals(0, changes.localToField());
        assertEquals(1, changes.fieldToLocal());
        assertEquals(1, changes.removedFields());
        assertEquals(2, changes.total());
    }

    @Test
    void anonymousClassFieldsAreNotLocals() {
        VariableScopes s = scopes("class A { void f() { Object o = new Object() { int hidden; }; } }");

        assertEquals(Set.of("o"), s.locals().get("A.f"));
        assertEquals(0, s.fieldCount());
        assertEquals(1, s.localCount());
    }

    @Test
    void unchangedCodeHasNoScopeChanges() {
        assertEquals(0, scopes(AS_FIELD).changesTo(scopes(AS_FIELD)).total());
        assertSame(VariableScopes.NONE, scopes("}}} not java {{{"));
    }
}
