package org.refactor.graphdiff.callgraph;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithExtends;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.refactor.graphdiff.AbstractGraphBuilder;
import org.refactor.graphdiff.ParsedSource;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 基于名字的调用图（不做类型解析）。
 * <p>
 * 两遍：
 * <ol>
 *     <li>登记所有类型和它们声明的方法 / 构造器，限定名为 {@code Type.method}
 *     （构造器为 {@code Type.<init>}，重载共用一个节点），类型 -> 方法连 inherit("defines")。</li>
 *     <li>遍历所有调用，调用方是最内层的方法；被调方按下面的规则求名字，
 *     查不到或有歧义的调用直接丢弃。</li>
 * </ol>
 * 被调方规则：
 * <ul>
 *     <li>{@code f()}：先找调用方所在类型的 {@code Type.f}，再按简单名 {@code f} 查找</li>
 *     <li>{@code Name.f()}：先找 {@code Name.f}（静态调用），再按简单名 {@code f} 查找（变量接收者）</li>
 *     <li>其他带接收者的调用（{@code this.f()}、{@code a.b().f()}）：简单名 {@code f}</li>
 *     <li>{@code new T()}：{@code T.<init>}</li>
 * </ul>
 * 简单名只有在恰好一个类型声明了它时才能解析。
 */
public class CallGraphBuilder extends AbstractGraphBuilder<CallGraph> {

    private static final Logger LOG = LoggerFactory.getLogger(CallGraphBuilder.class);

    public static final String CONSTRUCTOR = "<init>";

    public CallGraphBuilder() {
        this(new SourceParser());
    }

    public CallGraphBuilder(SourceParser parser) {
        super(parser);
    }

    @Override
    public CallGraph build(CompilationUnit unit, String name) {
        return build(List.of(unit), name);
    }

    /**
     * 多文件上下文：所有文件共享一张函数表，跨文件的调用也能连上。解析失败的文件跳过。
     *
     * @param files 路径 -> 源码
     */
    public CallGraph build(Map<String, String> files, String name) {
        List<CompilationUnit> units = new ArrayList<>();
        for (Map.Entry<String, String> file : files.entrySet()) {
            ParsedSource parsed = parser.parse(file.getValue());
            if (parsed.isParsed()) {
                units.add(parsed.unit());
            } else {
                LOG.warn("skipping {} in call graph '{}': {}", file.getKey(), name, parsed.error());
            }
        }
        return build(units, name);
    }

    public CallGraph build(List<CompilationUnit> units, String name) {
        CGContext ctx = new CGContext(name);
        for (CompilationUnit unit : units) {
            for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
                registerType(type, ctx);
            }
        }
        for (CompilationUnit unit : units) {
            for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
                registerSupertypes(type, ctx);
            }
        }
        for (CompilationUnit unit : units) {
            for (MethodCallExpr call : unit.findAll(MethodCallExpr.class)) {
                resolveCall(call, ctx);
            }
            for (ObjectCreationExpr creation : unit.findAll(ObjectCreationExpr.class)) {
                resolveCreation(creation, ctx);
            }
        }
        LOG.debug("call graph '{}': {} functions, {} calls", name, ctx.graph.functions().size(), ctx.graph.callCount());
        return ctx.graph;
    }

    @Override
    protected CallGraph errorGraph(String name, String error) {
        CallGraph g = new CallGraph(name);
        g.addNode(new Node("error", NodeType.FUNCTION, error));
        return g;
    }

    // ---------------------------------------------------------------- 第一遍

    private void registerType(TypeDeclaration<?> type, CGContext ctx) {
        String typeName = type.getNameAsString();
        Node classNode = new Node("class_" + typeName, NodeType.CLASS, typeName, lineAttrs(type));
        ctx.graph.addNode(classNode);
        ctx.types.add(typeName);

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (!(member instanceof CallableDeclaration<?> callable)) {
                continue;
            }
            String simple = callable instanceof ConstructorDeclaration ? CONSTRUCTOR : callable.getNameAsString();
            String qualified = typeName + "." + simple;

            Node fn = ctx.graph.function(qualified);
            if (fn == null) {
                Map<String, Object> attrs = lineAttrs(callable);
                attrs.put(Node.QUALIFIED_NAME, qualified);
                fn = new Node("method_" + qualified, callable.isStatic() ? NodeType.FUNCTION : NodeType.METHOD, qualified, attrs);
                ctx.graph.addFunction(qualified, fn);
            }
            ctx.link(new Edge(classNode.id(), fn.id(), EdgeType.INHERIT, "defines"));
            ctx.alias(simple, qualified);
        }
    }

    private void registerSupertypes(TypeDeclaration<?> type, CGContext ctx) {
        String from = "class_" + type.getNameAsString();
        if (type instanceof NodeWithExtends<?> withExtends) {
            for (ClassOrInterfaceType parent : withExtends.getExtendedTypes()) {
                linkSupertype(from, parent, "extends", ctx);
            }
        }
        if (type instanceof NodeWithImplements<?> withImplements) {
            for (ClassOrInterfaceType parent : withImplements.getImplementedTypes()) {
                linkSupertype(from, parent, "implements", ctx);
            }
        }
    }

    private void linkSupertype(String from, ClassOrInterfaceType parent, String label, CGContext ctx) {
        // 只连本次分析范围内声明过的类型
        String parentName = parent.getNameAsString();
        if (ctx.types.contains(parentName)) {
            ctx.link(new Edge(from, "class_" + parentName, EdgeType.INHERIT, label));
        }
    }

    // ---------------------------------------------------------------- 第二遍

    private void resolveCall(MethodCallExpr call, CGContext ctx) {
        Optional<String> caller = callerOf(call);
        if (caller.isEmpty()) {
            return;
        }

        String name = call.getNameAsString();
        List<String> candidates;
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty()) {
            String callerType = caller.get().substring(0, caller.get().lastIndexOf('.'));
            candidates = List.of(callerType + "." + name, name);
        } else if (scope.get() instanceof NameExpr receiver) {
            candidates = List.of(receiver.getNameAsString() + "." + name, name);
        } else {
            candidates = List.of(name);
        }

        for (String candidate : candidates) {
            String callee = ctx.resolve(candidate);
            if (callee != null) {
                ctx.graph.addCallEdge(caller.get(), callee);
                return;
            }
        }
    }

    private void resolveCreation(ObjectCreationExpr creation, CGContext ctx) {
        Optional<String> caller = callerOf(creation);
        if (caller.isEmpty()) {
            return;
        }
        String callee = creation.getType().getNameAsString() + "." + CONSTRUCTOR;
        if (ctx.graph.hasFunction(callee)) {
            ctx.graph.addCallEdge(caller.get(), callee);
        }
    }

    /**
     * 最内层的、已登记的方法 / 构造器的限定名。匿名类里的方法没有登记，调用被忽略。
     */
    private static Optional<String> callerOf(com.github.javaparser.ast.Node site) {
        com.github.javaparser.ast.Node current = site.getParentNode().orElse(null);
        while (current != null && !(current instanceof CallableDeclaration<?>)) {
            current = current.getParentNode().orElse(null);
        }
        if (current == null) {
            return Optional.empty();
        }
        CallableDeclaration<?> c = (CallableDeclaration<?>) current;
        Optional<com.github.javaparser.ast.Node> parent = c.getParentNode();
        if (parent.isEmpty() || !(parent.get() instanceof TypeDeclaration<?> owner)) {
            return Optional.empty();
        }
        String simple = c instanceof ConstructorDeclaration ? CONSTRUCTOR : c.getNameAsString();
        return Optional.of(owner.getNameAsString() + "." + simple);
    }

    private static Map<String, Object> lineAttrs(com.github.javaparser.ast.Node node) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        node.getBegin().ifPresent(p -> attrs.put(Node.LINE, p.line));
        return attrs;
    }

    /**
     * 一次构建的状态：图、已知类型、简单名别名表。
     */
    private static class CGContext {
        final CallGraph graph;
        final Set<String> types = new HashSet<>();
        // 简单名 -> 限定名；出现在多个类型里的简单名记为歧义
        final Map<String, String> aliases = new HashMap<>();
        final Set<String> ambiguous = new HashSet<>();

        CGContext(String name) {
            this.graph = new CallGraph(name);
        }

        void alias(String simple, String qualified) {
            String existing = aliases.putIfAbsent(simple, qualified);
            if (existing != null && !existing.equals(qualified)) {
                ambiguous.add(simple);
            }
        }

        String resolve(String candidate) {
            if (graph.hasFunction(candidate)) {
                return candidate;
            }
            if (candidate.indexOf('.') < 0 && !ambiguous.contains(candidate)) {
                return aliases.get(candidate);
            }
            return null;
        }

        void link(Edge edge) {
            if (!graph.hasEdge(edge)) {
                graph.addEdge(edge);
            }
        }
    }
}
