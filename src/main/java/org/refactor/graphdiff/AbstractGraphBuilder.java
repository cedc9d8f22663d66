package org.refactor.graphdiff;

import com.github.javaparser.ast.CompilationUnit;
import org.refactor.graphdiff.graph.Graph;

/**
 * 各类图构建器的公共骨架：先解析，解析失败则返回只含一个错误节点的图。
 *
 * @param <G> 产出的图类型
 */
public abstract class AbstractGraphBuilder<G extends Graph> {

    protected final SourceParser parser;

    protected AbstractGraphBuilder(SourceParser parser) {
        this.parser = parser;
    }

    public G build(String source, String name) {
        ParsedSource parsed = parser.parse(source);
        if (!parsed.isParsed()) {
            return errorGraph(name, parsed.error());
        }
        return build(parsed.unit(), name);
    }

    public abstract G build(CompilationUnit unit, String name);

    /**
     * 解析失败时的退化图：一个节点，标签就是错误信息。
     */
    protected abstract G errorGraph(String name, String error);
}
