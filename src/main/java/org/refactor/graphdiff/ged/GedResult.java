package org.refactor.graphdiff.ged;

/**
 * 一次图编辑距离计算的结果。
 *
 * @param distance           编辑距离（近似值）
 * @param normalizedDistance distance / max(|V1|, |V2|)，两图都为空时为 0
 * @param method             实际使用的算法
 * @param beamWidth          束宽，非束搜索为 0
 * @param iterations         搜索迭代（出队 / 扩展层数）
 * @param timeout            是否因迭代上限或时间预算提前结束
 * @param sizeCategory       自适应选择器给出的规模分档，其他算法为 null
 */
public record GedResult(double distance,
                        double normalizedDistance,
                        String method,
                        int beamWidth,
                        int iterations,
                        boolean timeout,
                        String sizeCategory,
                        int nodesBefore,
                        int nodesAfter,
                        int edgesBefore,
                        int edgesAfter,
                        long elapsedMillis) {

    public static double normalize(double distance, int nodesBefore, int nodesAfter) {
        int max = Math.max(nodesBefore, nodesAfter);
        return max == 0 ? 0.0 : distance / max;
    }

    public GedResult withMethod(String newMethod) {
        return new GedResult(distance, normalizedDistance, newMethod, beamWidth, iterations, timeout,
                sizeCategory, nodesBefore, nodesAfter, edgesBefore, edgesAfter, elapsedMillis);
    }

    public GedResult withSizeCategory(String category) {
        return new GedResult(distance, normalizedDistance, method, beamWidth, iterations, timeout,
                category, nodesBefore, nodesAfter, edgesBefore, edgesAfter, elapsedMillis);
    }

    public GedResult withTimeout(boolean flag, long totalElapsedMillis) {
        return new GedResult(distance, normalizedDistance, method, beamWidth, iterations, flag,
                sizeCategory, nodesBefore, nodesAfter, edgesBefore, edgesAfter, totalElapsedMillis);
    }
}
