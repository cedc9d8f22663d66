package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Node;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 节点替换代价 + 有界 LRU 缓存。
 * <p>
 * 代价：类型和标签都相同为 0；只有类型相同为替换代价的一半；否则为完整替换代价。
 * 缓存以 (id1, id2) 为键，只在一次图对比较内有效，每次比较新建一个。
 * 单线程使用，不加锁。
 */
public class SubstitutionCostCache {

    public static final int DEFAULT_CAPACITY = 1 << 16;

    private final EditCosts costs;
    private final Map<NodePair, Double> cache;
    private long hits;
    private long misses;

    public SubstitutionCostCache(EditCosts costs) {
        this(costs, DEFAULT_CAPACITY);
    }

    public SubstitutionCostCache(EditCosts costs, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.costs = costs;
        // accessOrder = true：按访问顺序淘汰
        this.cache = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {

            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<NodePair, Double> eldest) {
                return size() > capacity;
            }
        };
    }

    public double cost(Node a, Node b) {
        NodePair key = new NodePair(a.id(), b.id());
        Double cached = cache.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        double c = substitutionCost(costs, a, b);
        cache.put(key, c);
        return c;
    }

    public static double substitutionCost(EditCosts costs, Node a, Node b) {
        if (a.type() == b.type()) {
            return a.label().equals(b.label()) ? 0.0 : costs.substitution() * 0.5;
        }
        return costs.substitution();
    }

    public int size() {
        return cache.size();
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    private record NodePair(String first, String second) {
    }
}
