package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 束搜索的图编辑距离。
 * <p>
 * 逐层展开：每层把束内所有状态的后继按 代价 + 剩余代价下界 排序，只保留前 k 个。
 * 束里始终保留"贪心路径"（每层取 代价 + 下界 最小的后继），
 * 所以束宽 k 的结果不会比束宽 1 差。
 * <p>
 * 可选的时间预算在每层开始时检查；超时后把当前束内状态贪心补全，取最好的并标记 timeout。
 */
public class BeamSearchGed extends AbstractGedCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(BeamSearchGed.class);

    public static final String METHOD = "beam_search";
    public static final int DEFAULT_BEAM_WIDTH = 10;
    public static final int DEFAULT_NODE_THRESHOLD = 200;

    private static final Comparator<SearchState> BY_TOTAL = Comparator.comparingDouble(SearchState::total);

    private final int beamWidth;
    private final int nodeThreshold;
    private final Duration timeBudget;

    public BeamSearchGed() {
        this(EditCosts.UNIT, DEFAULT_BEAM_WIDTH);
    }

    public BeamSearchGed(EditCosts costs, int beamWidth) {
        this(costs, beamWidth, DEFAULT_NODE_THRESHOLD, null);
    }

    /**
     * @param timeBudget 墙钟时间预算，null 表示不限
     */
    public BeamSearchGed(EditCosts costs, int beamWidth, int nodeThreshold, Duration timeBudget) {
        super(costs);
        if (beamWidth <= 0) {
            throw new IllegalArgumentException("beam width must be positive: " + beamWidth);
        }
        this.beamWidth = beamWidth;
        this.nodeThreshold = nodeThreshold;
        this.timeBudget = timeBudget;
    }

    public int beamWidth() {
        return beamWidth;
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    protected GedResult search(Graph before, Graph after, long startNanos) {
        if (Math.max(before.nodeCount(), after.nodeCount()) > nodeThreshold) {
            LOG.debug("{} nodes exceed beam search threshold {}, using greedy matching",
                    Math.max(before.nodeCount(), after.nodeCount()), nodeThreshold);
            return new GreedyBipartiteMatcher(costs).search(before, after, startNanos);
        }

        StateExpander expander = new StateExpander(before, after, costs, new SubstitutionCostCache(costs));
        SearchState initial = expander.initial();
        SearchState lineage = initial;
        List<SearchState> beam = new ArrayList<>(List.of(lineage));
        int iterations = 0;
        boolean timeout = false;

        while (!beam.get(0).isComplete()) {
            if (overBudget(startNanos)) {
                timeout = true;
                break;
            }
            iterations++;

            List<SearchState> next = new ArrayList<>();
            SearchState lineageChild = null;
            for (SearchState s : beam) {
                // 已完整的状态原样留到下一层
                List<SearchState> children = s.isComplete() ? List.of(s) : expander.expand(s, beamWidth);
                if (s == lineage) {
                    lineageChild = StateExpander.mostPromising(children);
                }
                next.addAll(children);
            }
            // List.sort 是稳定排序：相同时按生成顺序
            next.sort(BY_TOTAL);
            beam = new ArrayList<>(next.subList(0, Math.min(beamWidth, next.size())));
            if (!containsIdentity(beam, lineageChild)) {
                beam.set(beam.size() - 1, lineageChild);
            }
            lineage = lineageChild;
        }

        // 束内可能还有只差插入的状态（或超时留下的部分状态），补全后再比较；
        // 逐个替换的补全兜底，保证 distance <= max(|V1|, |V2|)·max(代价)
        SearchState best = expander.pairwiseComplete(initial);
        for (SearchState s : beam) {
            SearchState done = expander.greedyComplete(s);
            if (done.cost < best.cost) {
                best = done;
            }
        }
        if (timeout) {
            LOG.debug("beam search (k={}) ran out of its {} budget after {} levels", beamWidth, timeBudget, iterations);
        }
        return result(before, after, best.cost, METHOD, beamWidth, iterations, timeout, startNanos);
    }

    private boolean overBudget(long startNanos) {
        return timeBudget != null && System.nanoTime() - startNanos >= timeBudget.toNanos();
    }

    private static boolean containsIdentity(List<SearchState> states, SearchState target) {
        for (SearchState s : states) {
            if (s == target) return true;
        }
        return false;
    }
}
