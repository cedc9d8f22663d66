package org.refactor.graphdiff.dfg;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 表达式级别的变量定义 / 使用收集。
 * <p>
 * 按求值顺序回调：赋值先处理右侧再记录定义，复合赋值和自增自减先读后写。
 * 只按名字识别变量（不做符号解析），首字母大写且作为限定前缀出现的名字视为类型引用。
 */
public final class VarDefUseCollector {

    /**
     * 定义 / 使用事件的接收方。位置是源码中的 (行, 列)。
     */
    public interface AccessListener {
        void define(String variable, Position at, boolean param);

        void use(String variable, Position at);
    }

    private static final Comparator<Node> SOURCE_ORDER = Comparator.comparing(
            (Node n) -> n.getBegin().orElse(Position.HOME));

    private VarDefUseCollector() {
    }

    public static void collect(Node node, AccessListener listener) {
        // 1) 赋值：左值是简单名字时才算定义
        if (node instanceof AssignExpr assign) {
            Expression target = assign.getTarget();
            if (target instanceof NameExpr name) {
                if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
                    listener.use(name.getNameAsString(), begin(name));
                }
                collect(assign.getValue(), listener);
                listener.define(name.getNameAsString(), end(assign), false);
            } else {
                // a.b = ... / a[i] = ...：左侧里的名字都是读
                collect(target, listener);
                collect(assign.getValue(), listener);
            }
            return;
        }

        // 2) ++ / --
        if (node instanceof UnaryExpr unary && isIncrementOrDecrement(unary.getOperator())
                && unary.getExpression() instanceof NameExpr name) {
            listener.use(name.getNameAsString(), begin(name));
            listener.define(name.getNameAsString(), end(unary), false);
            return;
        }

        // 3) 局部变量声明：只有带初值的才算定义
        if (node instanceof VariableDeclarator vd) {
            vd.getInitializer().ifPresent(init -> {
                collect(init, listener);
                listener.define(vd.getNameAsString(), end(vd), false);
            });
            return;
        }

        // 4) lambda 参数
        if (node instanceof Parameter parameter) {
            listener.define(parameter.getNameAsString(), end(parameter), true);
            return;
        }

        // 5) 名字读取
        if (node instanceof NameExpr name) {
            if (!isTypeReference(name)) {
                listener.use(name.getNameAsString(), begin(name));
            }
            return;
        }

        // 匿名类体、类型节点里没有变量访问
        if (node instanceof BodyDeclaration<?> || node instanceof Type) {
            return;
        }

        List<Node> children = new ArrayList<>(node.getChildNodes());
        children.sort(SOURCE_ORDER);
        for (Node child : children) {
            collect(child, listener);
        }
    }

    /**
     * {@code Math.max(...)}、{@code System.out} 这类限定前缀是类型而不是变量。
     */
    static boolean isTypeReference(NameExpr name) {
        String id = name.getNameAsString();
        if (id.isEmpty() || !Character.isUpperCase(id.charAt(0))) {
            return false;
        }
        Node parent = name.getParentNode().orElse(null);
        if (parent instanceof FieldAccessExpr fa) {
            return fa.getScope() == name;
        }
        if (parent instanceof MethodCallExpr mc) {
            return mc.getScope().map(s -> s == name).orElse(false);
        }
        if (parent instanceof MethodReferenceExpr mr) {
            return mr.getScope() == name;
        }
        return false;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT
                || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT
                || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    static Position begin(Node node) {
        return node.getBegin().orElse(Position.HOME);
    }

    static Position end(Node node) {
        return node.getEnd().orElse(Position.HOME);
    }
}
