package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import org.refactor.graphdiff.ParsedSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Halstead 度量。
 * <pre>
 *   n1 / n2  不同运算符 / 运算数个数      N1 / N2  运算符 / 运算数出现次数
 *   词汇量 n = n1 + n2                   长度 N = N1 + N2
 *   体积 V = N·log2(n)                   难度 D = (n1 / 2)·(N2 / n2)       工作量 E = D·V
 * </pre>
 * 运算符：二元、一元、赋值运算符，以及方法 / 类声明、if、for、foreach、while、return；
 * 运算数：变量名和字面量。没有运算符或没有运算数时各项都为 0。
 */
public record HalsteadMetrics(int vocabulary, int length, double volume, double difficulty, double effort) {

    public static final HalsteadMetrics NONE = new HalsteadMetrics(0, 0, 0.0, 0.0, 0.0);

    public static HalsteadMetrics of(ParsedSource parsed) {
        if (!parsed.isParsed()) {
            return NONE;
        }
        List<String> operators = new ArrayList<>();
        List<String> operands = new ArrayList<>();
        parsed.unit().walk(n -> {
            if (n instanceof BinaryExpr binary) {
                operators.add(binary.getOperator().asString());
            } else if (n instanceof UnaryExpr unary) {
                operators.add(unary.getOperator().asString());
            } else if (n instanceof AssignExpr assign) {
                operators.add(assign.getOperator().asString());
            } else if (n instanceof MethodDeclaration || n instanceof ClassOrInterfaceDeclaration
                    || n instanceof IfStmt || n instanceof ForStmt || n instanceof ForEachStmt
                    || n instanceof WhileStmt || n instanceof ReturnStmt) {
                operators.add(n.getClass().getSimpleName());
            } else if (n instanceof NameExpr name) {
                operands.add(name.getNameAsString());
            } else if (n instanceof LiteralStringValueExpr literal) {
                operands.add(literal.getValue());
            } else if (n instanceof BooleanLiteralExpr bool) {
                operands.add(bool.toString());
            } else if (n instanceof NullLiteralExpr) {
                operands.add("null");
            }
        });
        return of(operators, operands);
    }

    static HalsteadMetrics of(List<String> operators, List<String> operands) {
        int n1 = new HashSet<>(operators).size();
        int n2 = new HashSet<>(operands).size();
        if (n1 == 0 || n2 == 0) {
            return NONE;
        }
        int bigN1 = operators.size();
        int bigN2 = operands.size();
        int n = n1 + n2;
        int length = bigN1 + bigN2;
        double volume = length * (Math.log(n) / Math.log(2));
        double difficulty = (n1 / 2.0) * ((double) bigN2 / n2);
        return new HalsteadMetrics(n, length, volume, difficulty, difficulty * volume);
    }
}
