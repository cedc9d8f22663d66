package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * A* 搜索的图编辑距离。
 * <p>
 * 按 f = g + h 出队，h 是 {@link StateExpander#lowerBound} 给出的下界；
 * 每个状态最多展开 fanOut 个替换候选。第一个出队的完整状态即为结果。
 * 达到迭代上限时，对 f 最小的开放状态做贪心补全，并标记 timeout。
 * 节点数超过阈值时直接退化为 {@link GreedyBipartiteMatcher}。
 */
public class AStarGed extends AbstractGedCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(AStarGed.class);

    public static final String METHOD = "a_star";
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;
    public static final int DEFAULT_FAN_OUT = 5;
    public static final int DEFAULT_NODE_THRESHOLD = 100;

    // f 小的先出；f 相同时更深的先出（更快到达完整状态），再按生成顺序
    private static final Comparator<SearchState> PRIORITY = Comparator
            .comparingDouble(SearchState::total)
            .thenComparing(Comparator.comparingInt((SearchState s) -> s.depth).reversed())
            .thenComparingLong(s -> s.sequence);

    private final int maxIterations;
    private final int fanOut;
    private final int nodeThreshold;

    public AStarGed() {
        this(EditCosts.UNIT, DEFAULT_MAX_ITERATIONS);
    }

    public AStarGed(EditCosts costs, int maxIterations) {
        this(costs, maxIterations, DEFAULT_FAN_OUT, DEFAULT_NODE_THRESHOLD);
    }

    public AStarGed(EditCosts costs, int maxIterations, int fanOut, int nodeThreshold) {
        super(costs);
        if (maxIterations <= 0 || fanOut <= 0) {
            throw new IllegalArgumentException("maxIterations and fanOut must be positive");
        }
        this.maxIterations = maxIterations;
        this.fanOut = fanOut;
        this.nodeThreshold = nodeThreshold;
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    protected GedResult search(Graph before, Graph after, long startNanos) {
        if (Math.max(before.nodeCount(), after.nodeCount()) > nodeThreshold) {
            LOG.debug("{} nodes exceed A* threshold {}, using greedy matching",
                    Math.max(before.nodeCount(), after.nodeCount()), nodeThreshold);
            return new GreedyBipartiteMatcher(costs).search(before, after, startNanos);
        }

        StateExpander expander = new StateExpander(before, after, costs, new SubstitutionCostCache(costs));
        SearchResult found = run(expander);
        return result(before, after, found.state().cost, METHOD, 0, found.iterations(), found.timeout(), startNanos);
    }

    SearchResult run(StateExpander expander) {
        PriorityQueue<SearchState> open = new PriorityQueue<>(PRIORITY);
        SearchState initial = expander.initial();
        open.add(initial);

        int iterations = 0;
        while (!open.isEmpty() && iterations < maxIterations) {
            iterations++;
            SearchState current = open.poll();
            if (current.isComplete()) {
                return new SearchResult(current, iterations, false);
            }
            open.addAll(expander.expand(current, fanOut));
        }

        // 迭代用完：取目前最好的开放状态贪心补全，再与从头贪心的结果比较
        SearchState fromInitial = expander.greedyComplete(initial);
        SearchState best = fromInitial;
        if (!open.isEmpty()) {
            SearchState fromOpen = expander.greedyComplete(open.peek());
            if (fromOpen.cost < best.cost) {
                best = fromOpen;
            }
        }
        LOG.debug("A* stopped after {} iterations, best cost {}", iterations, best.cost);
        return new SearchResult(best, iterations, true);
    }

    record SearchResult(SearchState state, int iterations, boolean timeout) {
    }
}
