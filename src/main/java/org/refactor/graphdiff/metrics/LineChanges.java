package org.refactor.graphdiff.metrics;

import java.util.List;

/**
 * 行级增删统计：按最长公共子序列对齐两侧的行，没对上的就是删除 / 新增的行。
 * 行尾空白不参与比较。
 *
 * @param added   只在修改后出现的行数
 * @param deleted 只在修改前出现的行数
 */
public record LineChanges(int added, int deleted, int linesBefore, int linesAfter) {

    public static LineChanges between(String before, String after) {
        List<String> a = lines(before);
        List<String> b = lines(after);
        int common = longestCommonSubsequence(a, b);
        return new LineChanges(b.size() - common, a.size() - common, a.size(), b.size());
    }

    public int modified() {
        return added + deleted;
    }

    private static List<String> lines(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return source.lines().map(String::stripTrailing).toList();
    }

    static int longestCommonSubsequence(List<String> a, List<String> b) {
        int[] prev = new int[b.size() + 1];
        int[] cur = new int[b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            String x = a.get(i - 1);
            for (int j = 1; j <= b.size(); j++) {
                cur[j] = x.equals(b.get(j - 1)) ? prev[j - 1] + 1 : Math.max(prev[j], cur[j - 1]);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.size()];
    }
}
