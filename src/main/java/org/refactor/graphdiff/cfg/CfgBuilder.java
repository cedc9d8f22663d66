package org.refactor.graphdiff.cfg;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.stmt.*;
import org.refactor.graphdiff.AbstractGraphBuilder;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.graph.*;

import java.util.*;

/**
 * 构建控制流图 (CFG)。
 * <p>
 * 采用 AST Visitor：每个 visit 接收一组待连接的前驱出口，返回执行完该语句后的出口集合，
 * 语句创建的第一个节点负责把这些前驱连上。出口带着边类型，
 * 这样 if 的真假分支、循环的退出边都能在连接时打上正确的类型。
 * <p>
 * return / break / continue / throw 只是普通节点，不做跳转传播。
 */
public class CfgBuilder extends AbstractGraphBuilder<ControlFlowGraph> {

    public static final String ENTRY_LABEL = "entry";
    public static final String EXIT_LABEL = "exit";
    public static final String MERGE_LABEL = "merge";
    public static final String AFTER_LOOP_LABEL = "after_loop";

    public CfgBuilder() {
        this(new SourceParser());
    }

    public CfgBuilder(SourceParser parser) {
        super(parser);
    }

    /**
     * 整个编译单元：entry -> 每个方法头 -> 方法体 -> exit。
     */
    @Override
    public ControlFlowGraph build(CompilationUnit unit, String name) {
        CFGContext ctx = new CFGContext(name);
        Node entry = ctx.add(NodeType.ENTRY, ENTRY_LABEL, -1, Collections.emptyList());
        ctx.graph.setEntryId(entry.id());

        List<Exit> fromEntry = List.of(Exit.of(entry));
        List<BodyDeclaration<?>> members = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            collectExecutableMembers(type, members);
        }

        List<Exit> pending = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            pending.addAll(visitMember(member, ctx, fromEntry));
        }
        if (members.isEmpty()) {
            pending.addAll(fromEntry);
        }

        finish(ctx, pending);
        return ctx.graph;
    }

    /**
     * 单个方法 / 构造器的 CFG。
     */
    public ControlFlowGraph buildMethod(CallableDeclaration<?> callable, String name) {
        CFGContext ctx = new CFGContext(name);
        Node entry = ctx.add(NodeType.ENTRY, ENTRY_LABEL, -1, Collections.emptyList());
        ctx.graph.setEntryId(entry.id());
        finish(ctx, visitMember(callable, ctx, List.of(Exit.of(entry))));
        return ctx.graph;
    }

    @Override
    protected ControlFlowGraph errorGraph(String name, String error) {
        ControlFlowGraph g = new ControlFlowGraph(name);
        g.addNode(new Node("n0", NodeType.STATEMENT, error));
        g.setEntryId("n0");
        g.addExitId("n0");
        return g;
    }

    // 类型顶层（含成员类型）的方法、构造器、初始化块，按源码顺序深度优先
    private static void collectExecutableMembers(TypeDeclaration<?> type, List<BodyDeclaration<?>> out) {
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof CallableDeclaration<?> || member instanceof InitializerDeclaration) {
                out.add(member);
            } else if (member instanceof TypeDeclaration<?> nested) {
                collectExecutableMembers(nested, out);
            }
        }
    }

    private void finish(CFGContext ctx, List<Exit> pending) {
        Node exit = ctx.add(NodeType.EXIT, EXIT_LABEL, -1, distinct(pending));
        ctx.graph.addExitId(exit.id());
    }

    private List<Exit> visitMember(BodyDeclaration<?> member, CFGContext ctx, List<Exit> prev) {
        String label;
        Optional<BlockStmt> body;
        if (member instanceof MethodDeclaration md) {
            label = StatementLabels.header(md);
            body = md.getBody();
        } else if (member instanceof ConstructorDeclaration cd) {
            label = StatementLabels.header(cd);
            body = Optional.of(cd.getBody());
        } else if (member instanceof InitializerDeclaration init) {
            label = StatementLabels.header(init);
            body = Optional.of(init.getBody());
        } else {
            return prev;
        }

        Node header = ctx.add(NodeType.STATEMENT, label, lineOf(member), prev);
        List<Exit> afterHeader = List.of(Exit.of(header));
        // 抽象方法 / 接口方法没有方法体，只留一个方法头节点
        return body.map(b -> visit(b, ctx, afterHeader)).orElse(afterHeader);
    }

    private List<Exit> visit(Statement stmt, CFGContext ctx, List<Exit> prev) {
        if (stmt instanceof BlockStmt block) {
            return visitBlock(block.getStatements(), ctx, prev);
        } else if (stmt instanceof IfStmt ifStmt) {
            return visitIf(ifStmt, ctx, prev);
        } else if (stmt instanceof WhileStmt whileStmt) {
            return visitLoop(whileStmt, whileStmt.getBody(), ctx, prev);
        } else if (stmt instanceof ForStmt forStmt) {
            return visitLoop(forStmt, forStmt.getBody(), ctx, prev);
        } else if (stmt instanceof ForEachStmt forEachStmt) {
            return visitLoop(forEachStmt, forEachStmt.getBody(), ctx, prev);
        } else if (stmt instanceof DoStmt doStmt) {
            return visitLoop(doStmt, doStmt.getBody(), ctx, prev);
        } else if (stmt instanceof SwitchStmt switchStmt) {
            return visitSwitch(switchStmt, ctx, prev);
        } else if (stmt instanceof TryStmt tryStmt) {
            return visitTry(tryStmt, ctx, prev);
        } else if (stmt instanceof LabeledStmt labeled) {
            return visit(labeled.getStatement(), ctx, prev);
        } else if (stmt instanceof SynchronizedStmt sync) {
            Node node = ctx.add(NodeType.STATEMENT, StatementLabels.of(sync), lineOf(sync), prev);
            return visit(sync.getBody(), ctx, List.of(Exit.of(node)));
        } else if (stmt instanceof EmptyStmt) {
            return prev;
        }
        // 普通语句、return/break/continue/throw、局部类声明：一个节点
        Node node = ctx.add(NodeType.STATEMENT, StatementLabels.of(stmt), lineOf(stmt), prev);
        return List.of(Exit.of(node));
    }

    private List<Exit> visitBlock(List<Statement> statements, CFGContext ctx, List<Exit> prev) {
        List<Exit> current = prev;
        for (Statement s : statements) {
            current = visit(s, ctx, current);
        }
        return current;
    }

    private List<Exit> visitIf(IfStmt stmt, CFGContext ctx, List<Exit> prev) {
        Node branch = ctx.add(NodeType.BRANCH, StatementLabels.of(stmt), lineOf(stmt), prev);

        List<Exit> exits = new ArrayList<>(
                visit(stmt.getThenStmt(), ctx, List.of(new Exit(branch.id(), EdgeType.TRUE_BRANCH))));
        List<Exit> elseEntry = List.of(new Exit(branch.id(), EdgeType.FALSE_BRANCH));
        if (stmt.getElseStmt().isPresent()) {
            exits.addAll(visit(stmt.getElseStmt().get(), ctx, elseEntry));
        } else {
            // 没有 else：条件为假时直接到汇合点
            exits.addAll(elseEntry);
        }

        Node merge = ctx.add(NodeType.STATEMENT, MERGE_LABEL, lineOf(stmt), exits);
        return List.of(Exit.of(merge));
    }

    private List<Exit> visitLoop(Statement loop, Statement body, CFGContext ctx, List<Exit> prev) {
        Node header = ctx.add(NodeType.LOOP, StatementLabels.of(loop), lineOf(loop), prev);

        List<Exit> bodyExits = visit(body, ctx, List.of(new Exit(header.id(), EdgeType.TRUE_BRANCH)));
        // 回边：循环体的出口回到循环头
        for (Exit exit : bodyExits) {
            ctx.link(exit, header.id());
        }

        Node after = ctx.add(NodeType.STATEMENT, AFTER_LOOP_LABEL, lineOf(loop),
                List.of(new Exit(header.id(), EdgeType.FALSE_BRANCH)));
        return List.of(Exit.of(after));
    }

    private List<Exit> visitSwitch(SwitchStmt stmt, CFGContext ctx, List<Exit> prev) {
        Node branch = ctx.add(NodeType.BRANCH, StatementLabels.of(stmt), lineOf(stmt), prev);
        List<Exit> caseEntry = List.of(new Exit(branch.id(), EdgeType.TRUE_BRANCH));

        List<Exit> exits = new ArrayList<>();
        boolean hasDefault = false;
        // 不建模 fall-through：每个 case 都从 switch 节点独立进入
        for (SwitchEntry entry : stmt.getEntries()) {
            if (entry.getLabels().isEmpty()) {
                hasDefault = true;
            }
            exits.addAll(visitBlock(entry.getStatements(), ctx, caseEntry));
        }
        if (!hasDefault) {
            exits.add(new Exit(branch.id(), EdgeType.FALSE_BRANCH));
        }

        Node merge = ctx.add(NodeType.STATEMENT, MERGE_LABEL, lineOf(stmt), exits);
        return List.of(Exit.of(merge));
    }

    private List<Exit> visitTry(TryStmt stmt, CFGContext ctx, List<Exit> prev) {
        List<Exit> start = prev;
        if (!stmt.getResources().isEmpty()) {
            Node resources = ctx.add(NodeType.STATEMENT, StatementLabels.of(stmt), lineOf(stmt), prev);
            start = List.of(Exit.of(resources));
        }

        // try 块和每个 catch 都从同一组前驱出发
        List<Exit> exits = new ArrayList<>(visit(stmt.getTryBlock(), ctx, start));
        for (CatchClause clause : stmt.getCatchClauses()) {
            Node handler = ctx.add(NodeType.STATEMENT, StatementLabels.catchClause(clause), lineOf(clause), start);
            exits.addAll(visit(clause.getBody(), ctx, List.of(Exit.of(handler))));
        }

        if (stmt.getFinallyBlock().isPresent()) {
            return visit(stmt.getFinallyBlock().get(), ctx, distinct(exits));
        }
        return distinct(exits);
    }

    private static int lineOf(com.github.javaparser.ast.Node node) {
        return node.getBegin().map(p -> p.line).orElse(-1);
    }

    private static List<Exit> distinct(List<Exit> exits) {
        return new ArrayList<>(new LinkedHashSet<>(exits));
    }

    /**
     * 待连接的出口：节点 id + 连出去时用的边类型。
     */
    private record Exit(String nodeId, EdgeType edgeType) {
        static Exit of(Node node) {
            return new Exit(node.id(), EdgeType.CONTROL_FLOW);
        }
    }

    /**
     * CFG 构建的上下文：正在构建的图和节点编号。
     */
    private static class CFGContext {
        final ControlFlowGraph graph;
        int counter = 0;

        CFGContext(String name) {
            this.graph = new ControlFlowGraph(name);
        }

        Node add(NodeType type, String label, int line, List<Exit> preds) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            if (line >= 0) {
                attrs.put(Node.LINE, line);
            }
            Node node = new Node("n" + counter++, type, StatementLabels.truncate(label), attrs);
            graph.addNode(node);
            for (Exit p : preds) {
                link(p, node.id());
            }
            return node;
        }

        void link(Exit from, String to) {
            Edge edge = new Edge(from.nodeId(), to, from.edgeType());
            if (!graph.hasEdge(edge)) {
                graph.addEdge(edge);
            }
        }
    }
}
