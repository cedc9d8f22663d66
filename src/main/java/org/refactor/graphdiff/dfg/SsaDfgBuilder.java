package org.refactor.graphdiff.dfg;

import com.github.javaparser.Position;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.*;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.graph.*;

import java.util.*;

/**
 * SSA 风格的 DFG：每次定义产生一个新版本，分支汇合处用 phi 节点合并版本。
 * <p>
 * 每个作用域维护两张表：单调递增的版本计数器（保证版本号不重复）和"当前版本"。
 * 分支从同一份当前版本快照出发，汇合时凡是各分支结果不一致的变量都生成 phi，
 * phi 取一个新版本并成为当前版本，后续使用就解析到 phi 而不是某个分支内的定义。
 * <p>
 * 不做支配边界计算：if / switch 汇合和 for 循环的进出口之外不放 phi，while / do 不放。
 */
public class SsaDfgBuilder extends AbstractDfgBuilder {

    public static final String IF_MERGE = "if_merge";
    public static final String SWITCH_MERGE = "switch_merge";
    public static final String FOR_LOOP = "for_loop";
    public static final String FOR_EXIT = "for_exit";

    public SsaDfgBuilder() {
        this(new SourceParser());
    }

    public SsaDfgBuilder(SourceParser parser) {
        super(parser);
    }

    @Override
    protected DfgContext newContext(String name) {
        return new SsaContext(name);
    }

    @Override
    protected int nextVersion(DfgContext ctx, Scope scope, String variable) {
        return versions(ctx, scope).next(variable);
    }

    @Override
    protected int currentVersion(DfgContext ctx, Scope scope, String variable) {
        return versions(ctx, scope).current(variable);
    }

    @Override
    protected String displayName(String variable, int version) {
        return variable + "_" + version;
    }

    @Override
    protected Node define(DfgContext ctx, String variable, Position at, boolean param) {
        Node node = super.define(ctx, variable, at, param);
        ((SsaContext) ctx).index(node);
        return node;
    }

    /**
     * 使用只连到同作用域、同版本、位置在前的那一个定义。
     */
    @Override
    protected void linkDefUses(DfgContext ctx) {
        SsaContext ssa = (SsaContext) ctx;
        for (List<String> useIds : ctx.graph.uses().values()) {
            for (String useId : useIds) {
                Node use = ctx.graph.getNode(useId);
                if (use.version() == 0) {
                    continue;
                }
                Node def = ssa.definition(use.scopeId(), use.variable(), use.version());
                if (def != null && precedes(def, use)) {
                    addDefUseEdge(ctx, def, use);
                }
            }
        }
    }

    // ---------------------------------------------------------------- 分支

    @Override
    protected void visitIf(IfStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getCondition(), listener(ctx));

        VersionTable table = versions(ctx, ctx.symbols.current());
        Map<String, Integer> before = table.snapshot();

        visitStatement(stmt.getThenStmt(), ctx);
        Map<String, Integer> thenOut = table.snapshot();

        table.restore(before);
        stmt.getElseStmt().ifPresent(e -> visitStatement(e, ctx));
        Map<String, Integer> elseOut = table.snapshot();

        merge(ctx, List.of(thenOut, elseOut), VarDefUseCollector.end(stmt), IF_MERGE);
    }

    @Override
    protected void visitSwitch(SwitchStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getSelector(), listener(ctx));

        VersionTable table = versions(ctx, ctx.symbols.current());
        Map<String, Integer> before = table.snapshot();
        List<Map<String, Integer>> outcomes = new ArrayList<>();
        boolean hasDefault = false;
        for (SwitchEntry entry : stmt.getEntries()) {
            hasDefault |= entry.getLabels().isEmpty();
            table.restore(before);
            for (Statement s : entry.getStatements()) {
                visitStatement(s, ctx);
            }
            outcomes.add(table.snapshot());
        }
        // 没有 default 时，"一个 case 都没命中" 也是一条路径
        if (!hasDefault) {
            outcomes.add(before);
        }
        merge(ctx, outcomes, VarDefUseCollector.end(stmt), SWITCH_MERGE);
    }

    private void merge(DfgContext ctx, List<Map<String, Integer>> outcomes, Position at, String context) {
        VersionTable table = versions(ctx, ctx.symbols.current());
        Set<String> variables = new TreeSet<>();
        for (Map<String, Integer> o : outcomes) {
            variables.addAll(o.keySet());
        }
        for (String var : variables) {
            Set<Integer> seen = new LinkedHashSet<>();
            for (Map<String, Integer> o : outcomes) {
                seen.add(o.getOrDefault(var, 0));
            }
            if (seen.size() == 1) {
                table.set(var, seen.iterator().next());
            } else {
                addPhi(ctx, var, at, context, seen);
            }
        }
    }

    // ---------------------------------------------------------------- 循环

    @Override
    protected void visitFor(ForStmt stmt, DfgContext ctx) {
        DfgContext.Anchor header = beginStatement(stmt, ctx);
        stmt.getInitialization().forEach(init -> VarDefUseCollector.collect(init, listener(ctx)));

        Set<String> loopVars = new LinkedHashSet<>();
        for (Expression init : stmt.getInitialization()) {
            loopVarsOf(init, loopVars);
        }
        Position entryAt = stmt.getInitialization().isEmpty()
                ? VarDefUseCollector.begin(stmt)
                : VarDefUseCollector.end(stmt.getInitialization().getLast().orElseThrow());
        VersionTable table = versions(ctx, ctx.symbols.current());
        for (String var : loopVars) {
            addPhi(ctx, var, entryAt, FOR_LOOP, Set.of(table.current(var)));
        }

        stmt.getCompare().ifPresent(c -> VarDefUseCollector.collect(c, listener(ctx)));
        visitStatement(stmt.getBody(), ctx);
        ctx.resume(header);
        stmt.getUpdate().forEach(u -> VarDefUseCollector.collect(u, listener(ctx)));

        for (String var : loopVars) {
            addPhi(ctx, var, VarDefUseCollector.end(stmt), FOR_EXIT, Set.of(table.current(var)));
        }
    }

    @Override
    protected void visitForEach(ForEachStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getIterable(), listener(ctx));
        VariableDeclarator loopVar = stmt.getVariableDeclarator();
        String var = loopVar.getNameAsString();
        Node def = define(ctx, var, VarDefUseCollector.end(loopVar), false);

        VersionTable table = versions(ctx, ctx.symbols.current());
        addPhi(ctx, var, VarDefUseCollector.end(loopVar), FOR_LOOP, Set.of(def.version()));
        visitStatement(stmt.getBody(), ctx);
        addPhi(ctx, var, VarDefUseCollector.end(stmt), FOR_EXIT, Set.of(table.current(var)));
    }

    private static void loopVarsOf(Expression init, Set<String> out) {
        if (init instanceof VariableDeclarationExpr vde) {
            for (VariableDeclarator vd : vde.getVariables()) {
                out.add(vd.getNameAsString());
            }
        } else if (init instanceof AssignExpr assign && assign.getTarget() instanceof NameExpr name) {
            out.add(name.getNameAsString());
        } else if (init instanceof UnaryExpr unary && unary.getExpression() instanceof NameExpr name) {
            out.add(name.getNameAsString());
        }
    }

    // ---------------------------------------------------------------- phi

    private Node addPhi(DfgContext ctx, String variable, Position at, String context, Set<Integer> incoming) {
        SsaContext ssa = (SsaContext) ctx;
        Scope scope = ctx.symbols.current();
        int version = versions(ctx, scope).next(variable);

        Map<String, Object> attrs = attributes(variable, at, scope, version);
        attrs.put(Node.PHI, true);
        attrs.put("phi_context", context);
        String label = "φ " + displayName(variable, version) + "@" + at.line + " (" + context + ")";
        Node phi = new Node(ctx.nextId(), NodeType.DEFINITION, label, attrs);
        ctx.graph.addDefinition(variable, phi);
        ssa.index(phi);

        // 参与合并的各版本定义 -> phi
        for (int v : incoming) {
            Node source = ssa.definition(scope.id(), variable, v);
            if (source != null) {
                ctx.graph.addEdge(new Edge(source.id(), phi.id(), EdgeType.DATA_FLOW, "phi"));
            }
        }
        return phi;
    }

    private static VersionTable versions(DfgContext ctx, Scope scope) {
        return ((SsaContext) ctx).versions.computeIfAbsent(scope.id(), k -> new VersionTable());
    }

    /**
     * 一个作用域的版本状态。
     */
    static final class VersionTable {
        private final Map<String, Integer> counters = new HashMap<>();
        private Map<String, Integer> current = new HashMap<>();

        int next(String variable) {
            int v = counters.merge(variable, 1, Integer::sum);
            current.put(variable, v);
            return v;
        }

        int current(String variable) {
            return current.getOrDefault(variable, 0);
        }

        void set(String variable, int version) {
            if (version == 0) {
                current.remove(variable);
            } else {
                current.put(variable, version);
            }
        }

        Map<String, Integer> snapshot() {
            return new HashMap<>(current);
        }

        void restore(Map<String, Integer> saved) {
            current = new HashMap<>(saved);
        }
    }

    private static final class SsaContext extends DfgContext {
        final Map<Integer, VersionTable> versions = new HashMap<>();
        // "scopeId:var:version" -> 定义节点（含 phi）
        private final Map<String, Node> definitions = new HashMap<>();

        SsaContext(String name) {
            super(name);
        }

        void index(Node def) {
            definitions.put(def.scopeId() + ":" + def.variable() + ":" + def.version(), def);
        }

        Node definition(int scopeId, String variable, int version) {
            return definitions.get(scopeId + ":" + variable + ":" + version);
        }
    }
}
