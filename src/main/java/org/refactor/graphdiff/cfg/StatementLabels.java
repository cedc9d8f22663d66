package org.refactor.graphdiff.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.*;

/**
 * 语句 -> 节点标签。
 * <p>
 * CFG 和 DFG 共用这里的渲染规则，PDG 合并时才能靠"标签完全相同"把两边的语句节点对上。
 * 复合语句只渲染头部（条件、循环变量等），其余语句渲染全文并截断。
 */
public final class StatementLabels {

    public static final int MAX_LENGTH = 50;
    private static final int KEEP_LENGTH = 47;

    private StatementLabels() {
    }

    public static String of(Statement stmt) {
        if (stmt instanceof IfStmt s) {
            return truncate("if (" + s.getCondition() + ")");
        } else if (stmt instanceof WhileStmt s) {
            return truncate("while (" + s.getCondition() + ")");
        } else if (stmt instanceof DoStmt s) {
            return truncate("do while (" + s.getCondition() + ")");
        } else if (stmt instanceof ForStmt s) {
            String init = join(s.getInitialization());
            String compare = s.getCompare().map(Expression::toString).orElse("");
            String update = join(s.getUpdate());
            return truncate("for (" + init + "; " + compare + "; " + update + ")");
        } else if (stmt instanceof ForEachStmt s) {
            return truncate("for (" + s.getVariable() + " : " + s.getIterable() + ")");
        } else if (stmt instanceof SwitchStmt s) {
            return truncate("switch (" + s.getSelector() + ")");
        } else if (stmt instanceof TryStmt s) {
            return s.getResources().isEmpty() ? "try" : truncate("try (" + join(s.getResources()) + ")");
        } else if (stmt instanceof SynchronizedStmt s) {
            return truncate("synchronized (" + s.getExpression() + ")");
        } else if (stmt instanceof LocalClassDeclarationStmt s) {
            return truncate("class " + s.getClassDeclaration().getNameAsString());
        } else if (stmt instanceof LocalRecordDeclarationStmt s) {
            return truncate("record " + s.getRecordDeclaration().getNameAsString());
        } else if (stmt instanceof LabeledStmt s) {
            return truncate(s.getLabel() + ":");
        }
        return truncate(stmt.toString());
    }

    /**
     * 方法 / 构造器头，例如 {@code int f(int a, int b)}（不含修饰符和 throws）。
     */
    public static String header(CallableDeclaration<?> callable) {
        return truncate(callable.getDeclarationAsString(false, false, true));
    }

    public static String header(InitializerDeclaration initializer) {
        return initializer.isStatic() ? "static {}" : "{}";
    }

    public static String catchClause(CatchClause clause) {
        return truncate("catch (" + clause.getParameter() + ")");
    }

    /**
     * 字段声明没有 CFG 节点，DFG 用 "类型 名字 = 初值" 作为它的语句标签。
     */
    public static String field(VariableDeclarator declarator) {
        return truncate(declarator.getType() + " " + declarator);
    }

    public static String truncate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        if (flat.length() > MAX_LENGTH) {
            return flat.substring(0, KEEP_LENGTH) + "...";
        }
        return flat;
    }

    private static String join(Iterable<? extends Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node n : nodes) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(n);
        }
        return sb.toString();
    }
}
