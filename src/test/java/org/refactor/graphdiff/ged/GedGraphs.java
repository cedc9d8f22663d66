package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Edge;
import org.refactor.graphdiff.graph.EdgeType;
import org.refactor.graphdiff.graph.Graph;
import org.refactor.graphdiff.graph.Node;
import org.refactor.graphdiff.graph.NodeType;

/**
 * 测试用的小图。
 */
final class GedGraphs {

    private GedGraphs() {
    }

    static Graph graph(String name, Object... idTypeLabel) {
        Graph g = new Graph(name);
        for (int i = 0; i < idTypeLabel.length; i += 3) {
            g.addNode(new Node((String) idTypeLabel[i], (NodeType) idTypeLabel[i + 1], (String) idTypeLabel[i + 2]));
        }
        return g;
    }

    /**
     * a1 "a" / a2 "b" 对 b1 "b" / b2 "c"(branch)：最优是 a2->b1、a1->b2，代价 1.0；
     * 只看眼前的贪心会先把 a1 换成 b1（0.5），最终 1.5。
     */
    static Graph trapBefore() {
        return graph("before",
                "a1", NodeType.STATEMENT, "a",
                "a2", NodeType.STATEMENT, "b");
    }

    static Graph trapAfter() {
        return graph("after",
                "b1", NodeType.STATEMENT, "b",
                "b2", NodeType.BRANCH, "c");
    }

    static Graph chain(String name, int length) {
        Graph g = new Graph(name);
        for (int i = 0; i < length; i++) {
            g.addNode(new Node(name + i, i == 0 ? NodeType.ENTRY : NodeType.STATEMENT, "s" + (i % 7)));
            if (i > 0) {
                g.addEdge(new Edge(name + (i - 1), name + i, EdgeType.CONTROL_FLOW));
            }
        }
        return g;
    }
}
