package org.refactor.graphdiff.analysis;

import org.refactor.graphdiff.ged.GedResult;

/**
 * PDG / CPG 合并失败时的退化估计。
 * <p>
 * CFG 与 DFG 共享语句节点，直接相加会重复计算：
 * {@code PDG ≈ max(cfg, dfg) + 0.3 · min(cfg, dfg)}，CPG 再加上调用图距离。
 * 节点数按 DFG 与 CFG 有 30% 重叠估算。
 */
public final class WeightedGedEstimator {

    public static final String METHOD = "weighted_approximation";
    public static final double SECONDARY_WEIGHT = 0.3;
    public static final double OVERLAP_FACTOR = 0.7;

    private WeightedGedEstimator() {
    }

    public static double combine(double a, double b) {
        return Math.max(a, b) + SECONDARY_WEIGHT * Math.min(a, b);
    }

    /**
     * @param callGraph 计算 CPG 时传入，PDG 传 null
     */
    public static MetricRecord estimate(MetricKind kind, MetricRecord cfg, MetricRecord dfg, MetricRecord callGraph) {
        MetricRecord r = new MetricRecord();
        r.kind = kind.key();
        r.method = METHOD;
        r.distance = combine(cfg.distance, dfg.distance);
        r.nodesBefore = (int) (cfg.nodesBefore + dfg.nodesBefore * OVERLAP_FACTOR);
        r.nodesAfter = (int) (cfg.nodesAfter + dfg.nodesAfter * OVERLAP_FACTOR);
        r.edgesBefore = cfg.edgesBefore + dfg.edgesBefore;
        r.edgesAfter = cfg.edgesAfter + dfg.edgesAfter;
        if (callGraph != null) {
            r.distance += callGraph.distance;
            r.nodesBefore += callGraph.count("functions_before");
            r.nodesAfter += callGraph.count("functions_after");
            r.edgesBefore += callGraph.count("calls_before");
            r.edgesAfter += callGraph.count("calls_after");
        }
        r.normalizedDistance = GedResult.normalize(r.distance, r.nodesBefore, r.nodesAfter);
        return r;
    }
}
