package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;

/**
 * 图编辑距离计算器。实现必须满足：GED(G, G) = 0，结果非负。
 */
public interface GedCalculator {

    GedResult compute(Graph before, Graph after);

    /**
     * 写入结果 method 字段的名字。
     */
    String method();
}
