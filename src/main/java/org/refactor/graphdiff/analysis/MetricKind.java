package org.refactor.graphdiff.analysis;

/**
 * 度量种类。前五种在程序图上算编辑距离，其余直接在源码 / AST 上计算。
 */
public enum MetricKind {
    CFG("cfg", true),
    DFG("dfg", true),
    CALL_GRAPH("call_graph", true),
    PDG("pdg", true),
    CPG("cpg", true),
    AST("ast", false),
    LOC("loc", false),
    TOKEN("token", false),
    CYCLOMATIC("cyclomatic", false),
    HALSTEAD("halstead", false),
    VARIABLE_SCOPE("variable_scope", false),
    TYPE_CHANGES("type_changes", false),
    EXCEPTION_HANDLING("exception_handling", false);

    private final String key;
    private final boolean graph;

    MetricKind(String key, boolean graph) {
        this.key = key;
        this.graph = graph;
    }

    public String key() {
        return key;
    }

    /**
     * 是否是程序图上的 GED 度量。
     */
    public boolean isGraph() {
        return graph;
    }

    public static MetricKind fromKey(String key) {
        for (MetricKind k : values()) {
            if (k.key.equalsIgnoreCase(key.trim())) {
                return k;
            }
        }
        throw new IllegalArgumentException("unknown metric kind: " + key);
    }
}
