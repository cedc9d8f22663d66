package org.refactor.graphdiff.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphTest {

    private static Graph triangle() {
        Graph g = new Graph("t");
        g.addNode(new Node("a", NodeType.ENTRY, "entry"));
        g.addNode(new Node("b", NodeType.STATEMENT, "x = 1;"));
        g.addNode(new Node("c", NodeType.EXIT, "exit"));
        g.addEdge(new Edge("a", "b", EdgeType.CONTROL_FLOW));
        g.addEdge(new Edge("b", "c", EdgeType.CONTROL_FLOW));
        g.addEdge(new Edge("a", "c", EdgeType.FALSE_BRANCH));
        return g;
    }

    @Test
    void edgeToMissingNodeFailsLoudly() {
        Graph g = new Graph("g");
        g.addNode(new Node("a", NodeType.STATEMENT, "a"));

        GraphInvariantException ex = assertThrows(GraphInvariantException.class,
                () -> g.addEdge(new Edge("a", "missing", EdgeType.CONTROL_FLOW)));
        assertTrue(ex.getMessage().contains("missing"));
        assertEquals(0, g.edgeCount());
    }

    @Test
    void reAddingNodeOverwritesIt() {
        Graph g = new Graph("g");
        g.addNode(new Node("a", NodeType.STATEMENT, "old"));
        g.addNode(new Node("a", NodeType.BRANCH, "new"));

        assertEquals(1, g.nodeCount());
        assertEquals("new", g.getNode("a").label());
        assertNull(g.getNode("nope"));
    }

    @Test
    void adjacencyQueries() {
        Graph g = triangle();

        assertEquals(List.of("b", "c"), g.successors("a"));
        assertEquals(List.of("b", "a"), g.predecessors("c"));
        assertEquals(2, g.incomingEdges("c").size());
        assertEquals(2, g.outgoingEdges("a").size());
        assertEquals(1, g.countEdges(EdgeType.FALSE_BRANCH));
        assertEquals(1, g.nodesOfType(NodeType.EXIT).size());
        assertEquals(new GraphSize(3, 3), g.size());
    }

    @Test
    void edgeIdentityIgnoresLabel() {
        Graph g = triangle();

        assertTrue(g.hasEdge(new Edge("a", "b", EdgeType.CONTROL_FLOW, "other label")));
        assertFalse(g.hasEdge(new Edge("a", "b", EdgeType.TRUE_BRANCH)));
    }

    @Test
    void nodeAccessorsReadAttributes() {
        Node n = new Node("d1", NodeType.DEFINITION, "def x_2@4",
                Map.of(Node.VARIABLE, "x", Node.VERSION, 2, Node.LINE, 4, Node.PHI, true));

        assertEquals("x", n.variable());
        assertEquals(2, n.version());
        assertEquals(4, n.line());
        assertEquals(-1, n.column());
        assertTrue(n.isPhi());
        assertFalse(n.isParam());
        assertEquals(new Node("d1", NodeType.USE, "something else"), n);
    }

    @Test
    void recordUsesWireNames() {
        GraphRecord record = triangle().toRecord();

        assertEquals("t", record.name());
        assertEquals(3, record.nodes().size());
        assertEquals("entry", record.nodes().get(0).type());
        assertEquals("false_branch", record.edges().get(2).type());
    }

    @Test
    void callGraphDeduplicatesCalls() {
        CallGraph cg = new CallGraph("cg");
        cg.addFunction("A.f", new Node("method_A.f", NodeType.METHOD, "A.f"));
        cg.addFunction("A.g", new Node("method_A.g", NodeType.METHOD, "A.g"));

        assertTrue(cg.addCallEdge("A.f", "A.g"));
        assertFalse(cg.addCallEdge("A.f", "A.g"));
        assertEquals(1, cg.callCount());
        assertThrows(GraphInvariantException.class, () -> cg.addCallEdge("A.f", "B.h"));
    }

    @Test
    void dataFlowGraphIndexesDefinitionsAndUses() {
        DataFlowGraph g = new DataFlowGraph("d");
        g.addDefinition("x", new Node("d0", NodeType.DEFINITION, "def x@1"));
        g.addUse("x", new Node("d1", NodeType.USE, "use x@2"));
        g.addUse("y", new Node("d2", NodeType.USE, "use y@2"));
        g.addEdge(new Edge("d0", "d1", EdgeType.DEF_USE, "x"));

        assertEquals(List.of("d0"), g.definitionsOf("x"));
        assertEquals(List.of(), g.definitionsOf("y"));
        assertEquals(List.of("x", "y"), List.copyOf(g.variables()));
        assertEquals(List.of(new DefUseChain("d0", "d1", "x")), g.defUseChains());
        assertTrue(g.phiNodes().isEmpty());
    }
}
