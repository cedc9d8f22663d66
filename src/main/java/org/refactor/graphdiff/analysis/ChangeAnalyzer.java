package org.refactor.graphdiff.analysis;

import org.refactor.graphdiff.ParsedSource;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.callgraph.CallGraphBuilder;
import org.refactor.graphdiff.cfg.CfgBuilder;
import org.refactor.graphdiff.dfg.AbstractDfgBuilder;
import org.refactor.graphdiff.dfg.DfgBuilder;
import org.refactor.graphdiff.dfg.SsaDfgBuilder;
import org.refactor.graphdiff.ged.GedCalculator;
import org.refactor.graphdiff.graph.*;
import org.refactor.graphdiff.merge.GraphMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 比较同一段代码修改前后的各类程序图。
 * <p>
 * 每一侧的 CFG / DFG / 调用图只构建一次，供 PDG、CPG 复用。
 * 每种度量都有独立的失败边界：一种失败只把它自己记为 -1，不影响其他种类。
 * 非图度量（AST、行、记号、复杂度等）共用每一侧缓存的解析结果，见 {@link CodeMetrics}。
 * PDG / CPG 合并失败时改用 {@link WeightedGedEstimator} 的加权估计。
 * <p>
 * 构建器和合并器都是无状态的，同一个 ChangeAnalyzer 可以在多个线程里同时使用。
 */
public class ChangeAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeAnalyzer.class);

    private final AnalyzerOptions options;
    private final SourceParser parser;
    private final CfgBuilder cfgBuilder;
    private final AbstractDfgBuilder dfgBuilder;
    private final CallGraphBuilder callGraphBuilder;
    private final GraphMerger merger;

    public ChangeAnalyzer(AnalyzerOptions options) {
        this(options, new SourceParser());
    }

    public ChangeAnalyzer(AnalyzerOptions options, SourceParser parser) {
        this(options, parser,
                new CfgBuilder(parser),
                options.isSsaDfg() ? new SsaDfgBuilder(parser) : new DfgBuilder(parser),
                new CallGraphBuilder(parser),
                new GraphMerger());
    }

    public ChangeAnalyzer(AnalyzerOptions options, CfgBuilder cfgBuilder, AbstractDfgBuilder dfgBuilder,
                          CallGraphBuilder callGraphBuilder, GraphMerger merger) {
        this(options, new SourceParser(), cfgBuilder, dfgBuilder, callGraphBuilder, merger);
    }

    public ChangeAnalyzer(AnalyzerOptions options, SourceParser parser, CfgBuilder cfgBuilder,
                          AbstractDfgBuilder dfgBuilder, CallGraphBuilder callGraphBuilder, GraphMerger merger) {
        this.options = options;
        this.parser = parser;
        this.cfgBuilder = cfgBuilder;
        this.dfgBuilder = dfgBuilder;
        this.callGraphBuilder = callGraphBuilder;
        this.merger = merger;
    }

    public AnalyzerOptions options() {
        return options;
    }

    public ComparisonReport analyze(String path, String before, String after) {
        long start = System.nanoTime();
        Side b = new Side(path + "@before", before);
        Side a = new Side(path + "@after", after);

        // 计算过的结果（包括只为加权估计而算、不输出的分量）
        Map<MetricKind, MetricRecord> computed = new EnumMap<>(MetricKind.class);
        Map<String, MetricRecord> metrics = new LinkedHashMap<>();
        for (MetricKind kind : options.getKinds()) {
            metrics.put(kind.key(), record(kind, b, a, computed, path));
        }
        return new ComparisonReport(path, metrics, (System.nanoTime() - start) / 1_000_000L);
    }

    /**
     * 整个比较都没能进行时（例如批处理任务本身异常）的报告：所有请求的种类都记为失败。
     */
    public ComparisonReport failedReport(String path, Throwable cause) {
        Map<String, MetricRecord> metrics = new LinkedHashMap<>();
        for (MetricKind kind : options.getKinds()) {
            metrics.put(kind.key(), MetricRecord.failed(kind, describe(cause)));
        }
        return new ComparisonReport(path, metrics, 0L);
    }

    private MetricRecord record(MetricKind kind, Side before, Side after,
                                Map<MetricKind, MetricRecord> computed, String path) {
        MetricRecord existing = computed.get(kind);
        if (existing != null) {
            return existing;
        }
        long start = System.nanoTime();
        MetricRecord r;
        try {
            r = measure(kind, before, after, computed, path);
        } catch (RuntimeException e) {
            LOG.warn("{} metric failed for {}", kind.key(), path, e);
            r = MetricRecord.failed(kind, describe(e));
        }
        r.elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        computed.put(kind, r);
        return r;
    }

    private MetricRecord measure(MetricKind kind, Side before, Side after,
                                 Map<MetricKind, MetricRecord> computed, String path) {
        if (!kind.isGraph()) {
            return CodeMetrics.measure(kind, before.source, before.parsed(), after.source, after.parsed());
        }
        GedCalculator calculator = options.newCalculator();
        switch (kind) {
            case CFG: {
                ControlFlowGraph g1 = before.cfg();
                ControlFlowGraph g2 = after.cfg();
                return MetricRecord.of(kind, calculator.compute(g1, g2));
            }
            case DFG: {
                DataFlowGraph g1 = before.dfg();
                DataFlowGraph g2 = after.dfg();
                return MetricRecord.of(kind, calculator.compute(g1, g2))
                        .count("def_use_chains", g1.defUseChains().size(), g2.defUseChains().size())
                        .count("variables", g1.variables().size(), g2.variables().size())
                        .count("phi_nodes", g1.phiNodes().size(), g2.phiNodes().size());
            }
            case CALL_GRAPH: {
                CallGraph g1 = before.callGraph();
                CallGraph g2 = after.callGraph();
                return MetricRecord.of(kind, calculator.compute(g1, g2))
                        .count("functions", g1.functions().size(), g2.functions().size())
                        .count("calls", g1.callCount(), g2.callCount());
            }
            case PDG: {
                ControlFlowGraph c1 = before.cfg();
                ControlFlowGraph c2 = after.cfg();
                DataFlowGraph d1 = before.dfg();
                DataFlowGraph d2 = after.dfg();
                ProgramDependenceGraph g1;
                ProgramDependenceGraph g2;
                try {
                    g1 = merger.toPdg(c1, d1, before.name);
                    g2 = merger.toPdg(c2, d2, after.name);
                } catch (RuntimeException e) {
                    LOG.warn("PDG merge failed for {}, using weighted estimate", path, e);
                    return weighted(kind, before, after, computed, path, false);
                }
                return MetricRecord.of(kind, calculator.compute(g1, g2))
                        .count("control_edges", g1.controlEdges().size(), g2.controlEdges().size())
                        .count("data_edges", g1.dataEdges().size(), g2.dataEdges().size());
            }
            case CPG: {
                ControlFlowGraph c1 = before.cfg();
                ControlFlowGraph c2 = after.cfg();
                DataFlowGraph d1 = before.dfg();
                DataFlowGraph d2 = after.dfg();
                CallGraph k1 = before.callGraph();
                CallGraph k2 = after.callGraph();
                CodePropertyGraph g1;
                CodePropertyGraph g2;
                try {
                    g1 = merger.toCpg(c1, d1, k1, before.name);
                    g2 = merger.toCpg(c2, d2, k2, after.name);
                } catch (RuntimeException e) {
                    LOG.warn("CPG merge failed for {}, using weighted estimate", path, e);
                    return weighted(kind, before, after, computed, path, true);
                }
                return MetricRecord.of(kind, calculator.compute(g1, g2))
                        .count("control_edges", g1.controlEdges().size(), g2.controlEdges().size())
                        .count("data_edges", g1.dataEdges().size(), g2.dataEdges().size())
                        .count("structure_edges", g1.structureEdges().size(), g2.structureEdges().size());
            }
            default:
                throw new IllegalStateException("unhandled metric kind " + kind);
        }
    }

    private MetricRecord weighted(MetricKind kind, Side before, Side after,
                                  Map<MetricKind, MetricRecord> computed, String path, boolean withCallGraph) {
        MetricRecord cfg = record(MetricKind.CFG, before, after, computed, path);
        MetricRecord dfg = record(MetricKind.DFG, before, after, computed, path);
        MetricRecord cg = withCallGraph ? record(MetricKind.CALL_GRAPH, before, after, computed, path) : null;
        if (cfg.isFailed() || dfg.isFailed() || (cg != null && cg.isFailed())) {
            return MetricRecord.failed(kind, "merge failed and a component metric is unavailable");
        }
        return WeightedGedEstimator.estimate(kind, cfg, dfg, cg);
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * 比较的一侧：源码和按需构建、构建后缓存的图。
     */
    private final class Side {
        final String name;
        final String source;
        private ControlFlowGraph cfg;
        private DataFlowGraph dfg;
        private CallGraph callGraph;
        private ParsedSource parsed;

        Side(String name, String source) {
            this.name = name;
            this.source = source;
        }

        ControlFlowGraph cfg() {
            if (cfg == null) {
                cfg = cfgBuilder.build(source, name);
            }
            return cfg;
        }

        DataFlowGraph dfg() {
            if (dfg == null) {
                dfg = dfgBuilder.build(source, name);
            }
            return dfg;
        }

        CallGraph callGraph() {
            if (callGraph == null) {
                callGraph = callGraphBuilder.build(source, name);
            }
            return callGraph;
        }

        ParsedSource parsed() {
            if (parsed == null) {
                parsed = parser.parse(source);
            }
            return parsed;
        }
    }
}
