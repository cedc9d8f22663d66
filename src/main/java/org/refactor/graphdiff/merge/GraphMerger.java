package org.refactor.graphdiff.merge;

import org.refactor.graphdiff.graph.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 把 CFG、DFG（和调用图）合并成 PDG / CPG。
 * <p>
 * DFG 里的语句节点如果和某个 CFG 节点标签完全相同，就合并到那个 CFG 节点上
 * （取第一个同名的 CFG 节点），其余 DFG 节点原样加入。
 * CFG 边变成控制依赖边，DFG 边变成数据依赖边，原来的边类型记在 origin 属性里。
 */
public class GraphMerger {

    public static final String ORIGIN = "origin";

    public ProgramDependenceGraph toPdg(ControlFlowGraph cfg, DataFlowGraph dfg, String name) {
        ProgramDependenceGraph pdg = new ProgramDependenceGraph(name);
        merge(pdg, cfg, dfg);
        return pdg;
    }

    public CodePropertyGraph toCpg(ControlFlowGraph cfg, DataFlowGraph dfg, CallGraph callGraph, String name) {
        CodePropertyGraph cpg = new CodePropertyGraph(name);
        merge(cpg, cfg, dfg);

        for (Node n : callGraph.nodes()) {
            if (!cpg.hasNode(n.id())) {
                cpg.addNode(n);
            }
        }
        for (Edge e : callGraph.edges()) {
            if (!cpg.hasEdge(e)) {
                cpg.addStructureEdge(e);
            }
        }
        return cpg;
    }

    private void merge(ProgramDependenceGraph target, ControlFlowGraph cfg, DataFlowGraph dfg) {
        // 标签 -> 第一个带这个标签的 CFG 节点
        Map<String, String> cfgByLabel = new HashMap<>();
        for (Node n : cfg.nodes()) {
            target.addNode(n);
            cfgByLabel.putIfAbsent(n.label(), n.id());
        }

        Map<String, String> remap = new HashMap<>();
        for (Node n : dfg.nodes()) {
            String same = n.type() == NodeType.STATEMENT ? cfgByLabel.get(n.label()) : null;
            if (same != null) {
                remap.put(n.id(), same);
            } else {
                if (target.hasNode(n.id())) {
                    throw new GraphInvariantException("data flow node id '" + n.id() + "' collides with a control flow node");
                }
                target.addNode(n);
            }
        }

        for (Edge e : cfg.edges()) {
            Edge control = e.withType(EdgeType.CONTROL_DEPENDENCE, Map.of(ORIGIN, e.type().wireName()));
            if (!target.hasEdge(control)) {
                target.addControlEdge(control);
            }
        }
        for (Edge e : dfg.edges()) {
            Edge moved = e.reconnect(remap.getOrDefault(e.source(), e.source()), remap.getOrDefault(e.target(), e.target()));
            Edge data = moved.withType(EdgeType.DATA_DEPENDENCE, Map.of(ORIGIN, e.type().wireName()));
            if (!target.hasEdge(data)) {
                target.addDataEdge(data);
            }
        }
    }
}
