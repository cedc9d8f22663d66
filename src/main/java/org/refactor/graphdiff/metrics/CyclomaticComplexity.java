package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.*;
import org.refactor.graphdiff.ParsedSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 每个方法 / 构造器的 McCabe 圈复杂度：1 + 判定点个数。
 * <p>
 * 判定点：if、while、do、for、foreach、catch、非 default 的 case、?:、&amp;&amp;、||、lambda。
 * 嵌套的匿名类方法单独计一份，同时也算进外层方法。
 *
 * @param perFunction 按源码顺序的各方法复杂度
 */
public record CyclomaticComplexity(List<Integer> perFunction) {

    public static final CyclomaticComplexity NONE = new CyclomaticComplexity(List.of());

    public static CyclomaticComplexity of(ParsedSource parsed) {
        if (!parsed.isParsed()) {
            return NONE;
        }
        List<Integer> values = new ArrayList<>();
        for (CallableDeclaration<?> callable : parsed.unit().findAll(CallableDeclaration.class)) {
            values.add(of(callable));
        }
        return new CyclomaticComplexity(List.copyOf(values));
    }

    public static int of(Node callable) {
        int[] complexity = {1};
        callable.walk(n -> {
            if (isDecisionPoint(n)) {
                complexity[0]++;
            }
        });
        return complexity[0];
    }

    private static boolean isDecisionPoint(Node n) {
        if (n instanceof IfStmt || n instanceof WhileStmt || n instanceof DoStmt
                || n instanceof ForStmt || n instanceof ForEachStmt || n instanceof CatchClause
                || n instanceof ConditionalExpr || n instanceof LambdaExpr) {
            return true;
        }
        if (n instanceof SwitchEntry entry) {
            return !entry.getLabels().isEmpty();
        }
        if (n instanceof BinaryExpr binary) {
            return binary.getOperator() == BinaryExpr.Operator.AND || binary.getOperator() == BinaryExpr.Operator.OR;
        }
        return false;
    }

    public int functions() {
        return perFunction.size();
    }

    public int total() {
        int sum = 0;
        for (int c : perFunction) {
            sum += c;
        }
        return sum;
    }

    public int max() {
        int max = 0;
        for (int c : perFunction) {
            max = Math.max(max, c);
        }
        return max;
    }

    public double average() {
        return perFunction.isEmpty() ? 0.0 : (double) total() / perFunction.size();
    }
}
