package org.refactor.graphdiff.callgraph;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.graph.*;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private static final String CALCULATOR = "class Calculator {\n"
            + "    Calculator() { }\n"
            + "    int add(int a, int b) { return Util.sum(a, b); }\n"
            + "    int twice(int a) { return add(a, a); }\n"
            + "}\n"
            + "class Util {\n"
            + "    static int sum(int a, int b) { return a + b; }\n"
            + "}\n"
            + "class Runner {\n"
            + "    void run() {\n"
            + "        Calculator c = new Calculator();\n"
            + "        c.twice(3);\n"
            + "        helper();\n"
            + "        helper();\n"
            + "    }\n"
            + "    void helper() { }\n"
            + "}";

    private final CallGraphBuilder builder = new CallGraphBuilder();

    private static boolean calls(CallGraph g, String caller, String callee) {
        return g.hasEdge(new Edge(g.function(caller).id(), g.function(callee).id(), EdgeType.CALL));
    }

    @Test
    void registersEveryMethodAndConstructor() {
        CallGraph g = builder.build(CALCULATOR, "calc");

        assertEquals(6, g.functions().size());
        assertTrue(g.hasFunction("Calculator.<init>"));
        assertEquals(NodeType.FUNCTION, g.function("Util.sum").type());
        assertEquals(NodeType.METHOD, g.function("Runner.run").type());
        assertEquals(3, g.nodesOfType(NodeType.CLASS).size());
        assertEquals(6, g.countEdges(EdgeType.INHERIT), "one defines edge per method");
    }

    @Test
    void resolvesCallsByName() {
        CallGraph g = builder.build(CALCULATOR, "calc");

        assertTrue(calls(g, "Calculator.add", "Util.sum"), "static call through the type name");
        assertTrue(calls(g, "Calculator.twice", "Calculator.add"), "unqualified call in the same class");
        assertTrue(calls(g, "Runner.run", "Calculator.<init>"), "constructor call");
        assertTrue(calls(g, "Runner.run", "Calculator.twice"), "call through a local variable");
        assertTrue(calls(g, "Runner.run", "Runner.helper"));
        assertEquals(5, g.callCount(), "repeated calls collapse into one edge");
    }

    @Test
    void ownClassWinsOverAmbiguousSimpleName() {
        CallGraph g = builder.build("class A {\n"
                + "    void go() { }\n"
                + "    void start() { go(); }\n"
                + "}\n"
                + "class B {\n"
                + "    void go() { }\n"
                + "}\n"
                + "class C {\n"
                + "    void m(Object x) { x.go(); }\n"
                + "}", "amb");

        assertTrue(calls(g, "A.start", "A.go"));
        assertTrue(g.outgoingEdges(g.function("C.m").id()).isEmpty(), "ambiguous receiver call is dropped");
        assertEquals(1, g.callCount());
    }

    @Test
    void callsAreAttributedToTheEnclosingDeclaredMember() {
        CallGraph g = builder.build("class A {\n"
                + "    A() { init(); }\n"
                + "    void init() { }\n"
                + "    void work() { }\n"
                + "    void viaLambda() { Runnable r = () -> work(); }\n"
                + "    void viaAnonymous() {\n"
                + "        Runnable r = new Runnable() { public void run() { init(); } };\n"
                + "    }\n"
                + "}", "attr");

        assertTrue(calls(g, "A.<init>", "A.init"), "constructor body");
        assertTrue(calls(g, "A.viaLambda", "A.work"), "lambda body belongs to its method");
        assertTrue(g.outgoingEdges(g.function("A.viaAnonymous").id()).isEmpty(), "anonymous class body is skipped");
        assertEquals(2, g.callCount());
    }

    @Test
    void unknownCalleesAreDropped() {
        CallGraph g = builder.build("class A { void f() { System.out.println(1); list.add(2); } }", "a");

        assertEquals(0, g.callCount());
        assertEquals(1, g.functions().size());
    }

    @Test
    void supertypesDeclaredInScopeAreLinked() {
        CallGraph g = builder.build("interface Shape { double area(); }\n"
                + "class Base { }\n"
                + "class Circle extends Base implements Shape, Comparable<Circle> {\n"
                + "    public double area() { return 1; }\n"
                + "    public int compareTo(Circle o) { return 0; }\n"
                + "}", "shapes");

        assertTrue(g.hasEdge(new Edge("class_Circle", "class_Base", EdgeType.INHERIT)));
        assertTrue(g.hasEdge(new Edge("class_Circle", "class_Shape", EdgeType.INHERIT)));
        assertFalse(g.hasNode("class_Comparable"));
    }

    @Test
    void multiFileContextSharesFunctionTable() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A.java", "class A { void a() { B.b(); } }");
        files.put("B.java", "class B { static void b() { } }");
        files.put("Broken.java", "}}} not java {{{");

        CallGraph g = builder.build(files, "project");

        assertEquals(2, g.functions().size());
        assertTrue(calls(g, "A.a", "B.b"));
    }

    @Test
    void parseFailureYieldsSingleErrorNode() {
        CallGraph g = builder.build("}}} not java {{{", "broken");

        assertEquals(1, g.nodeCount());
        assertEquals(0, g.callCount());
    }
}
