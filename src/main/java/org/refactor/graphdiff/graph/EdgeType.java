package org.refactor.graphdiff.graph;

/**
 * 图边类型（封闭集合）。
 */
public enum EdgeType {
    CONTROL_FLOW("control_flow"),
    TRUE_BRANCH("true_branch"),
    FALSE_BRANCH("false_branch"),
    DATA_FLOW("data_flow"),
    DEF_USE("def_use"),
    CALL("call"),
    INHERIT("inherit"),
    CONTROL_DEPENDENCE("control_dependence"),
    DATA_DEPENDENCE("data_dependence");

    private final String wireName;

    EdgeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
