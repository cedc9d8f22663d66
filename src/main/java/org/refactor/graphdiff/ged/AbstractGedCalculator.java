package org.refactor.graphdiff.ged;

import org.refactor.graphdiff.graph.Graph;

import java.util.Objects;

/**
 * 公共部分：空图边界和结果组装。
 */
public abstract class AbstractGedCalculator implements GedCalculator {

    protected final EditCosts costs;

    protected AbstractGedCalculator(EditCosts costs) {
        this.costs = Objects.requireNonNull(costs, "costs");
    }

    public EditCosts costs() {
        return costs;
    }

    @Override
    public final GedResult compute(Graph before, Graph after) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        long start = System.nanoTime();
        // GED(∅, G) = |V|·ins，GED(G, ∅) = |V|·del
        if (before.isEmpty() || after.isEmpty()) {
            double d = after.nodeCount() * costs.insertion() + before.nodeCount() * costs.deletion();
            return result(before, after, d, method(), 0, 0, false, start);
        }
        return search(before, after, start);
    }

    protected abstract GedResult search(Graph before, Graph after, long startNanos);

    protected GedResult result(Graph before, Graph after, double distance, String method,
                               int beamWidth, int iterations, boolean timeout, long startNanos) {
        return new GedResult(
                distance,
                GedResult.normalize(distance, before.nodeCount(), after.nodeCount()),
                method,
                beamWidth,
                iterations,
                timeout,
                null,
                before.nodeCount(),
                after.nodeCount(),
                before.edgeCount(),
                after.edgeCount(),
                elapsedMillis(startNanos));
    }

    protected static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
