package org.refactor.graphdiff.graph;

import java.util.*;

/**
 * 数据流图：在通用图之上维护 变量 -> 定义节点 / 使用节点 的索引。
 * def-use 链就是构建器建出的 {@link EdgeType#DEF_USE} 边。
 */
public class DataFlowGraph extends Graph {

    private final Map<String, List<String>> definitions = new LinkedHashMap<>();
    private final Map<String, List<String>> uses = new LinkedHashMap<>();

    public DataFlowGraph(String name) {
        super(name);
    }

    public void addDefinition(String variable, Node node) {
        addNode(node);
        definitions.computeIfAbsent(variable, k -> new ArrayList<>()).add(node.id());
    }

    public void addUse(String variable, Node node) {
        addNode(node);
        uses.computeIfAbsent(variable, k -> new ArrayList<>()).add(node.id());
    }

    public Map<String, List<String>> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public Map<String, List<String>> uses() {
        return Collections.unmodifiableMap(uses);
    }

    public List<String> definitionsOf(String variable) {
        return definitions.getOrDefault(variable, Collections.emptyList());
    }

    public List<String> usesOf(String variable) {
        return uses.getOrDefault(variable, Collections.emptyList());
    }

    /**
     * 出现过（被定义或被使用）的变量名集合。
     */
    public Set<String> variables() {
        Set<String> vars = new LinkedHashSet<>(definitions.keySet());
        vars.addAll(uses.keySet());
        return vars;
    }

    public List<DefUseChain> defUseChains() {
        List<DefUseChain> chains = new ArrayList<>();
        for (Edge e : edges()) {
            if (e.type() == EdgeType.DEF_USE) {
                chains.add(new DefUseChain(e.source(), e.target(), e.label()));
            }
        }
        return chains;
    }

    public List<Node> phiNodes() {
        List<Node> phis = new ArrayList<>();
        for (Node n : nodes()) {
            if (n.isPhi()) phis.add(n);
        }
        return phis;
    }
}
