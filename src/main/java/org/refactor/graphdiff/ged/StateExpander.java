package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;
import org.refactor.graphdiff.graph.Node;

import java.util.*;

/**
 * A* 和束搜索共用的后继生成规则。
 * <p>
 * 每一步取字典序最小的未映射 G1 节点 u：
 * <ul>
 *     <li>替换：按 (替换代价, id) 排序后的前 fanOut 个未映射 G2 节点</li>
 *     <li>删除：放在所有替换之后，因此同代价时优先替换</li>
 * </ul>
 * G1 节点用完后，一步插入剩余所有 G2 节点。
 */
final class StateExpander {

    private final Node[] nodes1;
    private final Node[] nodes2;
    private final int[] keys1;
    private final int[] keys2;
    private final int keyCount;
    private final EditCosts costs;
    private final SubstitutionCostCache cache;
    private long sequence = 0;

    StateExpander(Graph g1, Graph g2, EditCosts costs, SubstitutionCostCache cache) {
        this.costs = costs;
        this.cache = cache;
        this.nodes1 = sortedById(g1);
        this.nodes2 = sortedById(g2);

        // (类型, 标签) 相同的节点共享一个 key，用于下界里的"精确匹配"计数
        Map<String, Integer> keyIndex = new HashMap<>();
        this.keys1 = new int[nodes1.length];
        for (int i = 0; i < nodes1.length; i++) {
            keys1[i] = keyIndex.computeIfAbsent(keyOf(nodes1[i]), k -> keyIndex.size());
        }
        this.keys2 = new int[nodes2.length];
        for (int j = 0; j < nodes2.length; j++) {
            keys2[j] = keyIndex.computeIfAbsent(keyOf(nodes2[j]), k -> keyIndex.size());
        }
        this.keyCount = keyIndex.size();
    }

    SearchState initial() {
        BitSet u1 = new BitSet(nodes1.length);
        u1.set(0, nodes1.length);
        BitSet u2 = new BitSet(nodes2.length);
        u2.set(0, nodes2.length);
        return new SearchState(null, SearchState.NONE, SearchState.NONE, u1, u2, 0.0, lowerBound(u1, u2), 0, sequence++);
    }

    List<SearchState> expand(SearchState s, int fanOut) {
        if (s.unmapped1.isEmpty()) {
            if (s.unmapped2.isEmpty()) {
                return Collections.emptyList();
            }
            double g = s.cost + s.unmapped2.cardinality() * costs.insertion();
            BitSet empty = new BitSet();
            return List.of(new SearchState(s, SearchState.NONE, SearchState.NONE, empty, empty, g, 0.0, s.depth + 1, sequence++));
        }

        int u = s.unmapped1.nextSetBit(0);
        BitSet rest1 = (BitSet) s.unmapped1.clone();
        rest1.clear(u);

        List<Candidate> candidates = new ArrayList<>();
        for (int j = s.unmapped2.nextSetBit(0); j >= 0; j = s.unmapped2.nextSetBit(j + 1)) {
            candidates.add(new Candidate(j, cache.cost(nodes1[u], nodes2[j])));
        }
        // nodes2 按 id 排序，下标顺序即 id 顺序
        candidates.sort(Comparator.comparingDouble(Candidate::cost).thenComparingInt(Candidate::index));

        List<SearchState> children = new ArrayList<>(Math.min(fanOut, candidates.size()) + 1);
        for (int k = 0; k < candidates.size() && k < fanOut; k++) {
            Candidate c = candidates.get(k);
            BitSet rest2 = (BitSet) s.unmapped2.clone();
            rest2.clear(c.index());
            children.add(new SearchState(s, u, c.index(), rest1, rest2, s.cost + c.cost(),
                    lowerBound(rest1, rest2), s.depth + 1, sequence++));
        }
        children.add(new SearchState(s, u, SearchState.NONE, rest1, s.unmapped2, s.cost + costs.deletion(),
                lowerBound(rest1, s.unmapped2), s.depth + 1, sequence++));
        return children;
    }

    /**
     * 贪心补全：每步取 代价 + 下界 最小的后继，再与逐个替换的补全比较，取代价低的。
     * 逐个替换的补全最多付出 max(|V1|, |V2|) 次单步代价，结果不会超过这个上限。
     */
    SearchState greedyComplete(SearchState s) {
        SearchState current = s;
        while (!current.isComplete()) {
            current = mostPromising(expand(current, 1));
        }
        SearchState pairwise = pairwiseComplete(s);
        return pairwise.cost < current.cost ? pairwise : current;
    }

    /**
     * 只要还有未映射的 G2 节点就替换（取最便宜的一个），G2 用完后删除，G1 用完后插入。
     */
    SearchState pairwiseComplete(SearchState s) {
        SearchState current = s;
        while (!current.isComplete()) {
            // expand(_, 1) 的第一个后继：有 G2 可配时是替换，否则是删除或整体插入
            current = expand(current, 1).get(0);
        }
        return current;
    }

    /**
     * 代价 + 下界最小的后继；相同时取生成顺序靠前的。
     */
    static SearchState mostPromising(List<SearchState> states) {
        SearchState best = null;
        for (SearchState st : states) {
            if (best == null || st.total() < best.total()) {
                best = st;
            }
        }
        return best;
    }

    /**
     * 剩余代价下界：多出来的节点必须整体插入或删除；
     * 可配对的部分中，(类型, 标签) 无法精确匹配的至少付出半个替换代价。
     */
    double lowerBound(BitSet u1, BitSet u2) {
        int n1 = u1.cardinality();
        int n2 = u2.cardinality();
        double excess = n1 > n2 ? (n1 - n2) * costs.deletion() : (n2 - n1) * costs.insertion();
        int overlap = Math.min(n1, n2);
        if (overlap == 0) {
            return excess;
        }
        int[] counts = new int[keyCount];
        for (int i = u1.nextSetBit(0); i >= 0; i = u1.nextSetBit(i + 1)) {
            counts[keys1[i]]++;
        }
        int exact = 0;
        for (int j = u2.nextSetBit(0); j >= 0; j = u2.nextSetBit(j + 1)) {
            if (counts[keys2[j]] > 0) {
                counts[keys2[j]]--;
                exact++;
            }
        }
        double perPair = Math.min(costs.substitution() * 0.5, costs.insertion() + costs.deletion());
        return excess + (overlap - exact) * perPair;
    }

    /**
     * 还原完整的节点映射：G1 id -> G2 id，删除的节点映射到 null。
     */
    Map<String, String> mapping(SearchState s) {
        Deque<SearchState> path = new ArrayDeque<>();
        for (SearchState st = s; st != null; st = st.parent) {
            path.push(st);
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (SearchState st : path) {
            if (st.from != SearchState.NONE) {
                mapping.put(nodes1[st.from].id(), st.to == SearchState.NONE ? null : nodes2[st.to].id());
            }
        }
        return mapping;
    }

    int size1() {
        return nodes1.length;
    }

    int size2() {
        return nodes2.length;
    }

    private static Node[] sortedById(Graph g) {
        Node[] nodes = g.nodes().toArray(new Node[0]);
        Arrays.sort(nodes, Comparator.comparing(Node::id));
        return nodes;
    }

    private static String keyOf(Node n) {
        return n.type().name() + '\u0000' + n.label();
    }

    private record Candidate(int index, double cost) {
    }
}
