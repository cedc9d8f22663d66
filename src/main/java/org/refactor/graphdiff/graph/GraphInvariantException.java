package org.refactor.graphdiff.graph;

/**
 * 图的结构不变量被破坏（例如边引用了不存在的节点）。
 * 出现它说明构建器本身有 bug，而不是输入代码有问题。
 */
public class GraphInvariantException extends RuntimeException {

    public GraphInvariantException(String message) {
        super(message);
    }
}
