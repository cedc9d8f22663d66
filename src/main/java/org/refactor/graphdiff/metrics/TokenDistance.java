package org.refactor.graphdiff.metrics;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import org.refactor.graphdiff.ParsedSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 词法记号序列和记号级编辑距离。
 */
public final class TokenDistance {

    private TokenDistance() {
    }

    /**
     * 源码的记号文本，不含空白和注释。
     * 片段被包装后才解析成功时，只保留原始代码所在行的记号；解析失败时按空白切分。
     */
    public static List<String> tokens(String source, ParsedSource parsed) {
        if (!parsed.isParsed()) {
            String trimmed = source == null ? "" : source.trim();
            return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
        }
        int firstLine = 1;
        int lastLine = Integer.MAX_VALUE;
        if (parsed.wrapping() != ParsedSource.Wrapping.NONE) {
            // 包装代码占第一行和最后一行
            firstLine = 2;
            lastLine = 1 + (int) source.lines().count();
        }
        List<String> result = new ArrayList<>();
        CompilationUnit unit = parsed.unit();
        if (unit.getTokenRange().isEmpty()) {
            return result;
        }
        for (JavaToken token : unit.getTokenRange().get()) {
            if (token.getCategory().isWhitespaceOrComment() || token.getKind() == JavaToken.Kind.EOF.getKind()) {
                continue;
            }
            int line = token.getRange().map(r -> r.begin.line).orElse(firstLine);
            if (line >= firstLine && line <= lastLine) {
                result.add(token.getText());
            }
        }
        return result;
    }

    /**
     * 两个序列的 Levenshtein 距离（插入 / 删除 / 替换各 1）。
     */
    public static int levenshtein(List<String> a, List<String> b) {
        if (a.size() < b.size()) {
            return levenshtein(b, a);
        }
        if (b.isEmpty()) {
            return a.size();
        }
        int[] prev = new int[b.size() + 1];
        int[] cur = new int[b.size() + 1];
        for (int j = 0; j <= b.size(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.size(); i++) {
            cur[0] = i;
            String x = a.get(i - 1);
            for (int j = 1; j <= b.size(); j++) {
                int substitute = prev[j - 1] + (x.equals(b.get(j - 1)) ? 0 : 1);
                cur[j] = Math.min(substitute, Math.min(prev[j] + 1, cur[j - 1] + 1));
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.size()];
    }
}
