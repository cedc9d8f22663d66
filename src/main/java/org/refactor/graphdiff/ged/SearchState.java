package org.refactor.graphdiff.ged;

import java.util.BitSet;

/**
 * 搜索树上的一个部分映射。
 * <p>
 * 映射本身不复制，只记录父状态和本步操作（from -> to，to 为 -1 表示删除，
 * from 和 to 都为 -1 表示插入剩余全部节点）。未映射节点集合用位图表示，
 * 下标是节点在按 id 排序后的列表中的位置，创建后不再修改，可以在父子状态间共享。
 */
final class SearchState {

    static final int NONE = -1;

    final SearchState parent;
    final int from;
    final int to;
    final BitSet unmapped1;
    final BitSet unmapped2;
    final double cost;
    final double estimate;
    final int depth;
    final long sequence;

    SearchState(SearchState parent, int from, int to, BitSet unmapped1, BitSet unmapped2,
                double cost, double estimate, int depth, long sequence) {
        this.parent = parent;
        this.from = from;
        this.to = to;
        this.unmapped1 = unmapped1;
        this.unmapped2 = unmapped2;
        this.cost = cost;
        this.estimate = estimate;
        this.depth = depth;
        this.sequence = sequence;
    }

    boolean isComplete() {
        return unmapped1.isEmpty() && unmapped2.isEmpty();
    }

    double total() {
        return cost + estimate;
    }
}
