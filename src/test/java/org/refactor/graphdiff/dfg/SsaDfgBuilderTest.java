package org.refactor.graphdiff.dfg;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.graph.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.refactor.graphdiff.dfg.DfgBuilderTest.reachingDefs;
import static org.refactor.graphdiff.dfg.DfgBuilderTest.use;

class SsaDfgBuilderTest {

    private static final String IF_ELSE = "class P {\n"  // 1
            + "    int g(boolean c) {\n"                   // 2
            + "        int x = 0;\n"                       // 3
            + "        if (c) {\n"                         // 4
            + "            x = 1;\n"                       // 5
            + "        } else {\n"                         // 6
            + "            x = 2;\n"                       // 7
            + "        }\n"                                // 8
            + "        return x;\n"                        // 9
            + "    }\n"
            + "}";

    private static final String FOR_EACH = "class Q {\n"     // 1
            + "    int sum(int[] items) {\n"                 // 2
            + "        int total = 0;\n"                     // 3
            + "        for (int item : items) {\n"           // 4
            + "            total += item;\n"                 // 5
            + "        }\n"                                  // 6
            + "        return total;\n"                      // 7
            + "    }\n"
            + "}";

    private final SsaDfgBuilder builder = new SsaDfgBuilder();

    private static List<Node> phisOf(DataFlowGraph g, String variable) {
        return g.phiNodes().stream()
                .filter(n -> variable.equals(n.variable()))
                .collect(Collectors.toList());
    }

    @Test
    void eachDefinitionGetsAFreshVersion() {
        DataFlowGraph g = builder.build(DfgBuilderTest.CALC, "calc");

        Set<Integer> versions = g.definitionsOf("y").stream()
                .map(id -> g.getNode(id).version())
                .collect(Collectors.toSet());
        assertEquals(Set.of(1, 2), versions);
        assertEquals("use y_2@6", use(g, "y", 6).label());
    }

    @Test
    void useLinksToExactlyOneVersion() {
        DataFlowGraph g = builder.build(DfgBuilderTest.CALC, "calc");

        List<Edge> atReturn = reachingDefs(g, use(g, "y", 6));
        assertEquals(1, atReturn.size());
        assertEquals(5, g.getNode(atReturn.get(0).source()).line());
        List<Edge> inAssign = reachingDefs(g, use(g, "y", 5));
        assertEquals(1, inAssign.size());
        assertEquals(4, g.getNode(inAssign.get(0).source()).line());
    }

    @Test
    void ifElseMergesReassignedVariableWithOnePhi() {
        DataFlowGraph g = builder.build(IF_ELSE, "p");

        List<Node> phis = phisOf(g, "x");
        assertEquals(1, phis.size());
        assertEquals(1, g.phiNodes().size(), "c is untouched by the branches");
        Node phi = phis.get(0);
        assertEquals(SsaDfgBuilder.IF_MERGE, phi.attribute("phi_context"));

        Set<Integer> incoming = g.incomingEdges(phi.id()).stream()
                .filter(e -> "phi".equals(e.label()))
                .map(e -> g.getNode(e.source()).line())
                .collect(Collectors.toSet());
        assertEquals(Set.of(5, 7), incoming);

        List<Edge> atReturn = reachingDefs(g, use(g, "x", 9));
        assertEquals(1, atReturn.size());
        assertEquals(phi.id(), atReturn.get(0).source());
    }

    @Test
    void ifWithoutElseMergesWithValueBeforeTheBranch() {
        DataFlowGraph g = builder.build("int g(boolean c) {\n"
                + "    int x = 0;\n"
                + "    if (c) x = 1;\n"
                + "    return x;\n"
                + "}", "g");

        List<Node> phis = phisOf(g, "x");
        assertEquals(1, phis.size());
        assertEquals(2, g.incomingEdges(phis.get(0).id()).size());
    }

    @Test
    void branchThatLeavesVariableAloneNeedsNoPhi() {
        DataFlowGraph g = builder.build("int g(boolean c) {\n"
                + "    int x = 0;\n"
                + "    if (c) { log(x); }\n"
                + "    return x;\n"
                + "}", "g");

        assertTrue(g.phiNodes().isEmpty());
        assertEquals(1, reachingDefs(g, use(g, "x", 5)).size());
    }

    @Test
    void switchIsMergedLikeAnNWayIf() {
        DataFlowGraph g = builder.build("int g(int k) {\n"
                + "    int x = 0;\n"
                + "    switch (k) {\n"
                + "        case 1: x = 10; break;\n"
                + "        case 2: x = 20; break;\n"
                + "    }\n"
                + "    return x;\n"
                + "}", "g");

        List<Node> phis = phisOf(g, "x");
        assertEquals(1, phis.size());
        assertEquals(SsaDfgBuilder.SWITCH_MERGE, phis.get(0).attribute("phi_context"));
        // case 1, case 2 and the fall-through-to-nothing path
        assertEquals(3, g.incomingEdges(phis.get(0).id()).size());
    }

    @Test
    void forEachLoopVariableGetsEntryAndExitPhis() {
        DataFlowGraph g = builder.build(FOR_EACH, "q");

        List<Node> itemPhis = phisOf(g, "item");
        assertEquals(2, itemPhis.size());
        assertTrue(phisOf(g, "total").isEmpty());
        Set<Object> contexts = itemPhis.stream().map(n -> n.attribute("phi_context")).collect(Collectors.toSet());
        assertEquals(Set.of(SsaDfgBuilder.FOR_LOOP, SsaDfgBuilder.FOR_EXIT), contexts);

        Node loopPhi = g.getNode(reachingDefs(g, use(g, "item", 5)).get(0).source());
        assertEquals(SsaDfgBuilder.FOR_LOOP, loopPhi.attribute("phi_context"));
    }

    @Test
    void countingLoopPlacesPhisForInitialisedVariables() {
        DataFlowGraph g = builder.build("int g() {\n"
                + "    int s = 0;\n"
                + "    for (int i = 0; i < 3; i++) {\n"
                + "        s += i;\n"
                + "    }\n"
                + "    return s;\n"
                + "}", "g");

        assertEquals(2, phisOf(g, "i").size());
        assertTrue(phisOf(g, "s").isEmpty());
        Node inBody = g.getNode(reachingDefs(g, use(g, "i", 5)).get(0).source());
        assertTrue(inBody.isPhi());
    }

    @Test
    void phiLabelsShowVersionAndContext() {
        DataFlowGraph g = builder.build(IF_ELSE, "p");
        Node phi = g.phiNodes().get(0);

        assertEquals("φ x_4@8 (if_merge)", phi.label());
        assertEquals(NodeType.DEFINITION, phi.type());
    }
}
