package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;
import org.refactor.graphdiff.graph.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 大图的快速近似：两边节点按 (标签, 类型, id) 排序后贪心配对。
 * <p>
 * 对每个 G1 节点，只在游标之后的 {@value #WINDOW} 个未配对 G2 节点里找最便宜的替换；
 * 替换不比删除贵就替换，否则删除。剩余 G2 节点不少于剩余 G1 节点时，
 * 删除还会多出一次插入，这时和 删除 + 插入 比较。剩下的 G2 节点全部插入。
 */
public class GreedyBipartiteMatcher extends AbstractGedCalculator {

    public static final String METHOD = "greedy_bipartite";
    public static final int WINDOW = 10;

    private static final Comparator<Node> ORDER = Comparator.comparing(Node::label)
            .thenComparing(n -> n.type().name())
            .thenComparing(Node::id);

    public GreedyBipartiteMatcher(EditCosts costs) {
        super(costs);
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    protected GedResult search(Graph before, Graph after, long startNanos) {
        return result(before, after, distance(before, after), METHOD, 0, 1, false, startNanos);
    }

    double distance(Graph before, Graph after) {
        List<Node> left = new ArrayList<>(before.nodes());
        List<Node> right = new ArrayList<>(after.nodes());
        left.sort(ORDER);
        right.sort(ORDER);

        boolean[] used = new boolean[right.size()];
        int cursor = 0;
        int matched = 0;
        double total = 0.0;
        for (int i = 0; i < left.size(); i++) {
            Node a = left.get(i);
            while (cursor < right.size() && used[cursor]) {
                cursor++;
            }
            boolean forcesInsertion = right.size() - matched >= left.size() - i;
            double dropCost = costs.deletion() + (forcesInsertion ? costs.insertion() : 0.0);
            int best = -1;
            double bestCost = dropCost;
            int scanned = 0;
            for (int j = cursor; j < right.size() && scanned < WINDOW; j++) {
                if (used[j]) {
                    continue;
                }
                scanned++;
                double c = SubstitutionCostCache.substitutionCost(costs, a, right.get(j));
                if (best < 0 ? c <= bestCost : c < bestCost) {
                    best = j;
                    bestCost = c;
                }
            }
            if (best >= 0) {
                used[best] = true;
                matched++;
                total += bestCost;
            } else {
                total += costs.deletion();
            }
        }
        total += (right.size() - matched) * costs.insertion();
        return total;
    }
}
