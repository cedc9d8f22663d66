package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import org.refactor.graphdiff.ParsedSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 只保留节点种类的 AST，树编辑距离的输入。
 * <p>
 * 标签是 JavaParser 节点的类名（{@code IfStmt}、{@code BinaryExpr}...），
 * 标识符和字面量的具体值不进标签，所以改名不算结构变化。
 */
public final class AstTree {

    public static final String PARSE_ERROR = "ParseError";

    private final String label;
    private final List<AstTree> children;
    private final int size;

    public AstTree(String label, List<AstTree> children) {
        this.label = label;
        this.children = Collections.unmodifiableList(children);
        int s = 1;
        for (AstTree child : children) {
            s += child.size;
        }
        this.size = s;
    }

    /**
     * 解析失败的一侧退化成单个 {@value #PARSE_ERROR} 节点。
     */
    public static AstTree of(ParsedSource parsed) {
        return parsed.isParsed() ? of(parsed.unit()) : new AstTree(PARSE_ERROR, List.of());
    }

    public static AstTree of(Node node) {
        List<AstTree> kids = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                kids.add(of(child));
            }
        }
        return new AstTree(node.getClass().getSimpleName(), kids);
    }

    public String label() {
        return label;
    }

    public List<AstTree> children() {
        return children;
    }

    /**
     * 子树节点总数（含自身）。
     */
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "AstTree(" + label + ", " + children.size() + " children)";
    }
}
