package org.refactor.graphdiff.dfg;

import org.refactor.graphdiff.graph.DataFlowGraph;
import org.refactor.graphdiff.graph.Node;
import org.refactor.graphdiff.graph.NodeType;

import java.util.Map;

/**
 * 一次 DFG 构建的全部可变状态，显式地在遍历中传递。
 */
class DfgContext {

    final DataFlowGraph graph;
    final SymbolTable symbols = new SymbolTable();
    private int counter = 0;
    private Anchor anchor;

    DfgContext(String name) {
        this.graph = new DataFlowGraph(name);
    }

    String nextId() {
        return "d" + counter++;
    }

    /**
     * 进入一条新语句。语句节点延迟到第一次出现定义或使用时才创建。
     */
    Anchor beginStatement(String label, int line) {
        anchor = new Anchor(label, line);
        return anchor;
    }

    /**
     * 回到之前的语句（例如 for 循环体之后的更新表达式仍属于循环头）。
     */
    void resume(Anchor saved) {
        anchor = saved;
    }

    void endStatement() {
        anchor = null;
    }

    /**
     * @return 当前语句节点的 id，不在任何语句中时返回 null
     */
    String anchorId() {
        if (anchor == null) {
            return null;
        }
        if (anchor.nodeId == null) {
            anchor.nodeId = nextId();
            Map<String, Object> attrs = anchor.line >= 0 ? Map.of(Node.LINE, anchor.line) : Map.of();
            graph.addNode(new Node(anchor.nodeId, NodeType.STATEMENT, anchor.label, attrs));
        }
        return anchor.nodeId;
    }

    static final class Anchor {
        final String label;
        final int line;
        String nodeId;

        Anchor(String label, int line) {
            this.label = label;
            this.line = line;
        }
    }
}
