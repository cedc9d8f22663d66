package org.refactor.graphdiff.metrics;

import java.util.List;

/**
 * 有序树编辑距离（插入 / 删除 / 改标签，单位代价）的简化版本。
 * <p>
 * 只对齐同一层的子树：两棵树的根总是互相对应，标签不同时取
 * "改标签 + 子森林距离" 与 "整棵删除再整棵插入" 中较小的一个；
 * 子森林之间按序列编辑距离做动态规划，删除 / 插入一棵子树的代价是它的节点数。
 * 每对 (子树, 子树) 只会被计算一次，总工作量不超过 |T1|·|T2|。
 */
public final class TreeEditDistance {

    private TreeEditDistance() {
    }

    public static int distance(AstTree a, AstTree b) {
        if (a.label().equals(b.label())) {
            return forestDistance(a.children(), b.children());
        }
        int relabel = 1 + forestDistance(a.children(), b.children());
        return Math.min(relabel, a.size() + b.size());
    }

    static int forestDistance(List<AstTree> f1, List<AstTree> f2) {
        int m = f1.size();
        int n = f2.size();
        int[] prev = new int[n + 1];
        int[] cur = new int[n + 1];
        for (int j = 1; j <= n; j++) {
            prev[j] = prev[j - 1] + f2.get(j - 1).size();
        }
        for (int i = 1; i <= m; i++) {
            AstTree t1 = f1.get(i - 1);
            cur[0] = prev[0] + t1.size();
            for (int j = 1; j <= n; j++) {
                AstTree t2 = f2.get(j - 1);
                int match = prev[j - 1] + distance(t1, t2);
                int delete = prev[j] + t1.size();
                int insert = cur[j - 1] + t2.size();
                cur[j] = Math.min(match, Math.min(delete, insert));
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[n];
    }
}
