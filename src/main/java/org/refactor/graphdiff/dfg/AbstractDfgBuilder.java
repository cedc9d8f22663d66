package org.refactor.graphdiff.dfg;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.stmt.*;
import org.refactor.graphdiff.AbstractGraphBuilder;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.cfg.StatementLabels;
import org.refactor.graphdiff.graph.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据流图构建的公共遍历。
 * <p>
 * 先按源码顺序遍历所有类型成员，记录每个定义 / 使用节点（带作用域和位置），
 * 再由子类在 {@link #linkDefUses(DfgContext)} 中决定哪些定义连到哪些使用。
 * <p>
 * 节点和边：
 * <ul>
 *     <li>语句节点（标签与 CFG 一致）-> 定义节点：data_flow</li>
 *     <li>使用节点 -> 语句节点：data_flow</li>
 *     <li>定义节点 -> 使用节点：def_use</li>
 * </ul>
 */
public abstract class AbstractDfgBuilder extends AbstractGraphBuilder<DataFlowGraph> {

    protected AbstractDfgBuilder(SourceParser parser) {
        super(parser);
    }

    @Override
    public DataFlowGraph build(CompilationUnit unit, String name) {
        DfgContext ctx = newContext(name);
        for (TypeDeclaration<?> type : unit.getTypes()) {
            visitType(type, ctx);
        }
        linkDefUses(ctx);
        return ctx.graph;
    }

    @Override
    protected DataFlowGraph errorGraph(String name, String error) {
        DataFlowGraph g = new DataFlowGraph(name);
        g.addNode(new Node("d0", NodeType.VARIABLE, error));
        return g;
    }

    protected DfgContext newContext(String name) {
        return new DfgContext(name);
    }

    protected abstract void linkDefUses(DfgContext ctx);

    /**
     * 定义所得的版本号；不区分版本的实现返回 0。
     */
    protected abstract int nextVersion(DfgContext ctx, Scope scope, String variable);

    protected abstract int currentVersion(DfgContext ctx, Scope scope, String variable);

    /**
     * 变量在节点标签里的显示名。
     */
    protected abstract String displayName(String variable, int version);

    // ---------------------------------------------------------------- 声明

    protected void visitType(TypeDeclaration<?> type, DfgContext ctx) {
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof FieldDeclaration field) {
                visitField(field, ctx);
            } else if (member instanceof CallableDeclaration<?> callable) {
                visitCallable(callable, type, ctx);
            } else if (member instanceof InitializerDeclaration init) {
                ctx.symbols.enter("init_" + type.getNameAsString());
                visitStatement(init.getBody(), ctx);
                ctx.symbols.exit();
                ctx.endStatement();
            } else if (member instanceof TypeDeclaration<?> nested) {
                visitType(nested, ctx);
            }
        }
    }

    private void visitField(FieldDeclaration field, DfgContext ctx) {
        for (VariableDeclarator vd : field.getVariables()) {
            if (vd.getInitializer().isEmpty()) {
                continue;
            }
            ctx.beginStatement(StatementLabels.field(vd), lineOf(vd));
            VarDefUseCollector.collect(vd, listener(ctx));
            ctx.endStatement();
        }
    }

    private void visitCallable(CallableDeclaration<?> callable, TypeDeclaration<?> owner, DfgContext ctx) {
        String simpleName = callable instanceof ConstructorDeclaration ? "<init>" : callable.getNameAsString();
        ctx.symbols.enter("func_" + owner.getNameAsString() + "." + simpleName);

        ctx.beginStatement(StatementLabels.header(callable), lineOf(callable));
        for (Parameter p : callable.getParameters()) {
            define(ctx, p.getNameAsString(), VarDefUseCollector.end(p), true);
        }

        if (callable instanceof MethodDeclaration md) {
            md.getBody().ifPresent(body -> visitStatement(body, ctx));
        } else if (callable instanceof ConstructorDeclaration cd) {
            visitStatement(cd.getBody(), ctx);
        }

        ctx.endStatement();
        ctx.symbols.exit();
    }

    // ---------------------------------------------------------------- 语句

    protected void visitStatement(Statement stmt, DfgContext ctx) {
        if (stmt instanceof BlockStmt block) {
            for (Statement s : block.getStatements()) {
                visitStatement(s, ctx);
            }
        } else if (stmt instanceof IfStmt s) {
            visitIf(s, ctx);
        } else if (stmt instanceof SwitchStmt s) {
            visitSwitch(s, ctx);
        } else if (stmt instanceof ForStmt s) {
            visitFor(s, ctx);
        } else if (stmt instanceof ForEachStmt s) {
            visitForEach(s, ctx);
        } else if (stmt instanceof WhileStmt s) {
            beginStatement(s, ctx);
            VarDefUseCollector.collect(s.getCondition(), listener(ctx));
            visitStatement(s.getBody(), ctx);
        } else if (stmt instanceof DoStmt s) {
            visitStatement(s.getBody(), ctx);
            beginStatement(s, ctx);
            VarDefUseCollector.collect(s.getCondition(), listener(ctx));
        } else if (stmt instanceof TryStmt s) {
            visitTry(s, ctx);
        } else if (stmt instanceof LabeledStmt s) {
            visitStatement(s.getStatement(), ctx);
        } else if (stmt instanceof SynchronizedStmt s) {
            beginStatement(s, ctx);
            VarDefUseCollector.collect(s.getExpression(), listener(ctx));
            visitStatement(s.getBody(), ctx);
        } else if (stmt instanceof LocalClassDeclarationStmt s) {
            visitType(s.getClassDeclaration(), ctx);
        } else if (stmt instanceof LocalRecordDeclarationStmt s) {
            visitType(s.getRecordDeclaration(), ctx);
        } else if (!(stmt instanceof EmptyStmt)) {
            beginStatement(stmt, ctx);
            VarDefUseCollector.collect(stmt, listener(ctx));
        }
    }

    protected void visitIf(IfStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getCondition(), listener(ctx));
        visitStatement(stmt.getThenStmt(), ctx);
        stmt.getElseStmt().ifPresent(e -> visitStatement(e, ctx));
    }

    protected void visitSwitch(SwitchStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getSelector(), listener(ctx));
        for (SwitchEntry entry : stmt.getEntries()) {
            for (Statement s : entry.getStatements()) {
                visitStatement(s, ctx);
            }
        }
    }

    protected void visitFor(ForStmt stmt, DfgContext ctx) {
        DfgContext.Anchor header = beginStatement(stmt, ctx);
        stmt.getInitialization().forEach(init -> VarDefUseCollector.collect(init, listener(ctx)));
        stmt.getCompare().ifPresent(c -> VarDefUseCollector.collect(c, listener(ctx)));
        visitStatement(stmt.getBody(), ctx);
        ctx.resume(header);
        stmt.getUpdate().forEach(u -> VarDefUseCollector.collect(u, listener(ctx)));
    }

    protected void visitForEach(ForEachStmt stmt, DfgContext ctx) {
        beginStatement(stmt, ctx);
        VarDefUseCollector.collect(stmt.getIterable(), listener(ctx));
        VariableDeclarator loopVar = stmt.getVariableDeclarator();
        define(ctx, loopVar.getNameAsString(), VarDefUseCollector.end(loopVar), false);
        visitStatement(stmt.getBody(), ctx);
    }

    private void visitTry(TryStmt stmt, DfgContext ctx) {
        if (!stmt.getResources().isEmpty()) {
            beginStatement(stmt, ctx);
            stmt.getResources().forEach(r -> VarDefUseCollector.collect(r, listener(ctx)));
        }
        visitStatement(stmt.getTryBlock(), ctx);
        for (CatchClause clause : stmt.getCatchClauses()) {
            ctx.beginStatement(StatementLabels.catchClause(clause), lineOf(clause));
            Parameter p = clause.getParameter();
            define(ctx, p.getNameAsString(), VarDefUseCollector.end(p), true);
            visitStatement(clause.getBody(), ctx);
        }
        stmt.getFinallyBlock().ifPresent(f -> visitStatement(f, ctx));
    }

    protected DfgContext.Anchor beginStatement(Statement stmt, DfgContext ctx) {
        return ctx.beginStatement(StatementLabels.of(stmt), lineOf(stmt));
    }

    // ---------------------------------------------------------------- 节点

    protected VarDefUseCollector.AccessListener listener(DfgContext ctx) {
        return new VarDefUseCollector.AccessListener() {
            @Override
            public void define(String variable, Position at, boolean param) {
                AbstractDfgBuilder.this.define(ctx, variable, at, param);
            }

            @Override
            public void use(String variable, Position at) {
                AbstractDfgBuilder.this.use(ctx, variable, at);
            }
        };
    }

    protected Node define(DfgContext ctx, String variable, Position at, boolean param) {
        Scope scope = ctx.symbols.current();
        int version = nextVersion(ctx, scope, variable);
        String label = "def " + displayName(variable, version) + "@" + at.line + (param ? " (param)" : "");
        Map<String, Object> attrs = attributes(variable, at, scope, version);
        if (param) {
            attrs.put(Node.PARAM, true);
        }
        Node node = new Node(ctx.nextId(), NodeType.DEFINITION, label, attrs);
        ctx.graph.addDefinition(variable, node);

        String anchor = ctx.anchorId();
        if (anchor != null) {
            ctx.graph.addEdge(new Edge(anchor, node.id(), EdgeType.DATA_FLOW, "writes"));
        }
        return node;
    }

    protected Node use(DfgContext ctx, String variable, Position at) {
        Scope scope = ctx.symbols.current();
        int version = currentVersion(ctx, scope, variable);
        String label = "use " + displayName(variable, version) + "@" + at.line;
        Node node = new Node(ctx.nextId(), NodeType.USE, label, attributes(variable, at, scope, version));
        ctx.graph.addUse(variable, node);

        String anchor = ctx.anchorId();
        if (anchor != null) {
            ctx.graph.addEdge(new Edge(node.id(), anchor, EdgeType.DATA_FLOW, "reads"));
        }
        return node;
    }

    protected static Map<String, Object> attributes(String variable, Position at, Scope scope, int version) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(Node.VARIABLE, variable);
        attrs.put(Node.LINE, at.line);
        attrs.put(Node.COLUMN, at.column);
        attrs.put(Node.SCOPE, scope.name());
        attrs.put(Node.SCOPE_ID, scope.id());
        attrs.put(Node.VERSION, version);
        return attrs;
    }

    /**
     * 源码位置上 a 严格先于 b。
     */
    protected static boolean precedes(Node a, Node b) {
        if (a.line() != b.line()) {
            return a.line() < b.line();
        }
        return a.column() < b.column();
    }

    protected static void addDefUseEdge(DfgContext ctx, Node def, Node use) {
        Edge edge = new Edge(def.id(), use.id(), EdgeType.DEF_USE, use.variable());
        if (!ctx.graph.hasEdge(edge)) {
            ctx.graph.addEdge(edge);
        }
    }

    protected static int lineOf(com.github.javaparser.ast.Node node) {
        return node.getBegin().map(p -> p.line).orElse(-1);
    }
}
