package org.refactor.graphdiff.graph;

/**
 * 图节点类型（封闭集合）。wireName 为序列化到 JSON 时使用的名字。
 */
public enum NodeType {
    STATEMENT("statement"),
    ENTRY("entry"),
    EXIT("exit"),
    BRANCH("branch"),
    LOOP("loop"),
    VARIABLE("variable"),
    DEFINITION("definition"),
    USE("use"),
    FUNCTION("function"),
    METHOD("method"),
    CLASS("class"),
    AST_NODE("ast_node"),
    TYPE("type");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
