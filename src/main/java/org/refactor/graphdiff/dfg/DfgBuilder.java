package org.refactor.graphdiff.dfg;

import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.graph.DataFlowGraph;
import org.refactor.graphdiff.graph.Node;

import java.util.List;
import java.util.Map;

/**
 * 基础 DFG：不区分版本，变量的每个定义连到它能到达的每个使用。
 * <p>
 * 可达规则：同一作用域内定义位置在使用之前；module 作用域的定义可以到达任何函数；
 * 其他跨作用域的组合不可达。同一个使用可能有多个到达定义（这正是与 SSA 版本的区别）。
 */
public class DfgBuilder extends AbstractDfgBuilder {

    public DfgBuilder() {
        this(new SourceParser());
    }

    public DfgBuilder(SourceParser parser) {
        super(parser);
    }

    @Override
    protected void linkDefUses(DfgContext ctx) {
        DataFlowGraph g = ctx.graph;
        for (Map.Entry<String, List<String>> entry : g.uses().entrySet()) {
            List<String> defs = g.definitionsOf(entry.getKey());
            for (String useId : entry.getValue()) {
                Node use = g.getNode(useId);
                for (String defId : defs) {
                    Node def = g.getNode(defId);
                    if (reaches(def, use)) {
                        addDefUseEdge(ctx, def, use);
                    }
                }
            }
        }
    }

    static boolean reaches(Node def, Node use) {
        if (def.scopeId() == use.scopeId()) {
            return precedes(def, use);
        }
        return Scope.MODULE.equals(def.scope());
    }

    @Override
    protected int nextVersion(DfgContext ctx, Scope scope, String variable) {
        return 0;
    }

    @Override
    protected int currentVersion(DfgContext ctx, Scope scope, String variable) {
        return 0;
    }

    @Override
    protected String displayName(String variable, int version) {
        return variable;
    }
}
