package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 按图规模选择束宽的自适应计算器（默认策略）。
 * <pre>
 *   max(|V1|,|V2|) &lt; 20    束宽 100   small
 *                  &lt; 50    束宽 50    medium
 *                  &lt; 100   束宽 20    large
 *                  &lt; 200   束宽 10    very_large
 *                  其他     贪心二分匹配  huge
 * </pre>
 * 超出时间预算或搜索抛异常时，退回束宽 1 重新计算。
 */
public class HybridGed extends AbstractGedCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(HybridGed.class);

    public static final String METHOD = "hybrid";
    public static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(120);

    private final Duration timeBudget;

    public HybridGed() {
        this(EditCosts.UNIT, DEFAULT_TIME_BUDGET);
    }

    public HybridGed(EditCosts costs, Duration timeBudget) {
        super(costs);
        this.timeBudget = timeBudget;
    }

    @Override
    public String method() {
        return METHOD;
    }

    public static int beamWidthFor(int maxNodes) {
        if (maxNodes < 20) return 100;
        if (maxNodes < 50) return 50;
        if (maxNodes < 100) return 20;
        if (maxNodes < 200) return 10;
        return 0;
    }

    public static String categoryFor(int maxNodes) {
        if (maxNodes < 20) return "small";
        if (maxNodes < 50) return "medium";
        if (maxNodes < 100) return "large";
        if (maxNodes < 200) return "very_large";
        return "huge";
    }

    @Override
    protected GedResult search(Graph before, Graph after, long startNanos) {
        int maxNodes = Math.max(before.nodeCount(), after.nodeCount());
        String category = categoryFor(maxNodes);
        int width = beamWidthFor(maxNodes);
        if (width == 0) {
            return new GreedyBipartiteMatcher(costs).search(before, after, startNanos).withSizeCategory(category);
        }

        boolean overBudget = false;
        try {
            GedResult r = beamSearch(width, timeBudget).search(before, after, startNanos);
            if (!r.timeout()) {
                return r.withMethod(METHOD).withSizeCategory(category);
            }
            overBudget = true;
            LOG.warn("beam search k={} exceeded {} on {} nodes, falling back to k=1", width, timeBudget, maxNodes);
        } catch (RuntimeException e) {
            LOG.warn("beam search k={} failed on {} nodes, falling back to k=1", width, maxNodes, e);
        }

        GedResult fallback = beamSearch(1, null).search(before, after, System.nanoTime());
        return fallback.withMethod(METHOD)
                .withSizeCategory(category + (overBudget ? "_timeout" : "_error"))
                .withTimeout(overBudget, elapsedMillis(startNanos));
    }

    protected BeamSearchGed beamSearch(int width, Duration budget) {
        return new BeamSearchGed(costs, width, BeamSearchGed.DEFAULT_NODE_THRESHOLD, budget);
    }
}
