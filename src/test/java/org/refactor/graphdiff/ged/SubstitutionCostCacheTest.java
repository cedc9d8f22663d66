package org.refactor.graphdiff.ged;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.graph.Node;
import org.refactor.graphdiff.graph.NodeType;

import static org.junit.jupiter.api.Assertions.*;

class SubstitutionCostCacheTest {

    private static final EditCosts COSTS = new EditCosts(1.0, 1.0, 0.8);

    @Test
    void costDependsOnTypeAndLabel() {
        Node a = new Node("a", NodeType.STATEMENT, "x = 1;");
        Node same = new Node("b", NodeType.STATEMENT, "x = 1;");
        Node relabelled = new Node("c", NodeType.STATEMENT, "x = 2;");
        Node retyped = new Node("d", NodeType.BRANCH, "x = 1;");

        assertEquals(0.0, SubstitutionCostCache.substitutionCost(COSTS, a, same), 1e-9);
        assertEquals(0.4, SubstitutionCostCache.substitutionCost(COSTS, a, relabelled), 1e-9);
        assertEquals(0.8, SubstitutionCostCache.substitutionCost(COSTS, a, retyped), 1e-9);
    }

    @Test
    void repeatedLookupsHitTheCache() {
        SubstitutionCostCache cache = new SubstitutionCostCache(COSTS);
        Node a = new Node("a", NodeType.STATEMENT, "x");
        Node b = new Node("b", NodeType.STATEMENT, "y");

        cache.cost(a, b);
        cache.cost(a, b);
        cache.cost(b, a);

        assertEquals(1, cache.hits());
        assertEquals(2, cache.misses());
        assertEquals(2, cache.size());
    }

    @Test
    void evictsLeastRecentlyUsedBeyondCapacity() {
        SubstitutionCostCache cache = new SubstitutionCostCache(COSTS, 2);
        Node a = new Node("a", NodeType.STATEMENT, "a");
        Node b = new Node("b", NodeType.STATEMENT, "b");
        Node c = new Node("c", NodeType.STATEMENT, "c");

        cache.cost(a, b);
        cache.cost(a, c);
        cache.cost(a, b);
        cache.cost(b, c);
        assertEquals(2, cache.size());

        cache.cost(a, b);
        assertEquals(2, cache.hits(), "a->b survived because it was touched last");
        cache.cost(a, c);
        assertEquals(2, cache.hits(), "a->c was evicted");
    }

    @Test
    void negativeCostsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EditCosts(-1.0, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new SubstitutionCostCache(COSTS, 0));
    }
}
