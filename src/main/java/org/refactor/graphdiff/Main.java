package org.refactor.graphdiff;

import org.refactor.graphdiff.analysis.*;
import org.refactor.graphdiff.callgraph.CallGraphBuilder;
import org.refactor.graphdiff.cfg.CfgBuilder;
import org.refactor.graphdiff.dfg.AbstractDfgBuilder;
import org.refactor.graphdiff.dfg.DfgBuilder;
import org.refactor.graphdiff.dfg.SsaDfgBuilder;
import org.refactor.graphdiff.graph.ControlFlowGraph;
import org.refactor.graphdiff.graph.DataFlowGraph;
import org.refactor.graphdiff.graph.Graph;
import org.refactor.graphdiff.merge.GraphMerger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口。
 * <pre>
 *   Main &lt;before.java&gt; &lt;after.java&gt; [&lt;before.java&gt; &lt;after.java&gt; ...] [key=value ...]
 *   Main graph &lt;cfg|dfg|call_graph|pdg|cpg&gt; &lt;file.java&gt; [key=value ...]
 * </pre>
 * key=value 覆盖 graph-diff.properties 中的配置；额外支持 {@code out=<file>} 把报告写到文件。
 * 结果以 JSON 输出到 stdout，日志走 stderr。
 */
public class Main {

    private static final String OUT = "out";
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws IOException {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return 进程退出码：0 成功，{@value #EXIT_USAGE} 参数错误
     */
    static int run(String[] args, PrintStream stdout, PrintStream stderr) throws IOException {
        if (args.length == 0) {
            usage(stderr);
            return EXIT_USAGE;
        }

        List<String> files = new ArrayList<>();
        AnalyzerOptions options = AnalyzerOptions.load();
        Path out = null;
        boolean graphMode = "graph".equals(args[0]);
        MetricKind graphKind = null;
        try {
            for (int i = graphMode ? 1 : 0; i < args.length; i++) {
                String arg = args[i];
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    String key = arg.substring(0, eq);
                    String value = arg.substring(eq + 1);
                    if (OUT.equals(key)) {
                        out = Path.of(value);
                    } else {
                        options.apply(key, value);
                    }
                } else {
                    files.add(arg);
                }
            }
            if (graphMode ? files.size() != 2 : files.isEmpty() || files.size() % 2 != 0) {
                throw new IllegalArgumentException(graphMode
                        ? "graph mode takes a kind and one file"
                        : "expected before/after file pairs, got " + files.size() + " file(s)");
            }
            if (graphMode) {
                graphKind = MetricKind.fromKey(files.get(0));
                if (!graphKind.isGraph()) {
                    throw new IllegalArgumentException("not a graph kind: " + graphKind.key());
                }
            }
        } catch (IllegalArgumentException e) {
            stderr.println("error: " + e.getMessage());
            usage(stderr);
            return EXIT_USAGE;
        }

        Object result = graphMode
                ? buildGraph(graphKind, Path.of(files.get(1)), options).toRecord()
                : compare(files, options);

        if (out != null) {
            ReportJson.write(result, out);
        } else {
            stdout.println(ReportJson.toJson(result));
        }
        return 0;
    }

    private static Object compare(List<String> files, AnalyzerOptions options) throws IOException {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(options);
        List<SourcePair> pairs = new ArrayList<>();
        for (int i = 0; i < files.size(); i += 2) {
            Path before = Path.of(files.get(i));
            Path after = Path.of(files.get(i + 1));
            pairs.add(new SourcePair(after.toString(), Files.readString(before), Files.readString(after)));
        }
        if (pairs.size() == 1) {
            SourcePair p = pairs.get(0);
            return analyzer.analyze(p.path(), p.before(), p.after());
        }
        return new BatchAnalyzer(analyzer).analyzeAll(pairs);
    }

    private static Graph buildGraph(MetricKind kind, Path file, AnalyzerOptions options) throws IOException {
        String source = Files.readString(file);
        String name = file.toString();
        SourceParser parser = new SourceParser();
        CfgBuilder cfgBuilder = new CfgBuilder(parser);
        AbstractDfgBuilder dfgBuilder = options.isSsaDfg() ? new SsaDfgBuilder(parser) : new DfgBuilder(parser);
        CallGraphBuilder callGraphBuilder = new CallGraphBuilder(parser);
        GraphMerger merger = new GraphMerger();

        switch (kind) {
            case CFG:
                return cfgBuilder.build(source, name);
            case DFG:
                return dfgBuilder.build(source, name);
            case CALL_GRAPH:
                return callGraphBuilder.build(source, name);
            case PDG: {
                ControlFlowGraph cfg = cfgBuilder.build(source, name);
                DataFlowGraph dfg = dfgBuilder.build(source, name);
                return merger.toPdg(cfg, dfg, name);
            }
            default: {
                ControlFlowGraph cfg = cfgBuilder.build(source, name);
                DataFlowGraph dfg = dfgBuilder.build(source, name);
                return merger.toCpg(cfg, dfg, callGraphBuilder.build(source, name), name);
            }
        }
    }

    private static void usage(PrintStream err) {
        err.println("usage: Main <before.java> <after.java> [<before.java> <after.java> ...] [key=value ...]");
        err.println("       Main graph <cfg|dfg|call_graph|pdg|cpg> <file.java> [key=value ...]");
    }
}
