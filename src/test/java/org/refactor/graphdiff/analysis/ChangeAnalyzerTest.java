package org.refactor.graphdiff.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.refactor.graphdiff.SourceParser;
import org.refactor.graphdiff.callgraph.CallGraphBuilder;
import org.refactor.graphdiff.cfg.CfgBuilder;
import org.refactor.graphdiff.dfg.SsaDfgBuilder;
import org.refactor.graphdiff.ged.HybridGed;
import org.refactor.graphdiff.graph.*;
import org.refactor.graphdiff.merge.GraphMerger;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeAnalyzerTest {

    static final String PLAIN = "int f(int a, int b) { return a + b; }";
    static final String GUARDED = "int f(int a, int b) {\n"
            + "    if (b == 0) return 0;\n"
            + "    return a + b;\n"
            + "}";

    private static ChangeAnalyzer analyzerWith(AnalyzerOptions options, CfgBuilder cfg, GraphMerger merger) {
        SourceParser parser = new SourceParser();
        return new ChangeAnalyzer(options, cfg, new SsaDfgBuilder(parser), new CallGraphBuilder(parser), merger);
    }

    @ParameterizedTest
    @EnumSource(GedStrategy.class)
    void identicalCodeHasZeroDistanceEverywhere(GedStrategy strategy) {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(AnalyzerOptions.defaults().setStrategy(strategy));

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, PLAIN);

        assertEquals(List.of("cfg", "dfg", "call_graph", "pdg", "cpg", "ast", "loc", "token", "cyclomatic",
                        "halstead", "variable_scope", "type_changes", "exception_handling"),
                List.copyOf(report.metrics().keySet()));
        for (MetricRecord r : report.metrics().values()) {
            assertFalse(r.isFailed(), r.kind + ": " + r.error);
            assertEquals(0.0, r.distance, 1e-9, r.kind);
            assertEquals(r.nodesBefore, r.nodesAfter, r.kind);
        }
    }

    @Test
    void addedGuardGrowsControlAndDataFlow() {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(AnalyzerOptions.defaults());

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, GUARDED);

        MetricRecord cfg = report.metric(MetricKind.CFG);
        assertTrue(cfg.distance > 0);
        assertEquals(cfg.nodesBefore + 3, cfg.nodesAfter, "branch, early return and merge");
        assertEquals("small", cfg.sizeCategory);
        assertEquals(HybridGed.METHOD, cfg.method);

        MetricRecord dfg = report.metric(MetricKind.DFG);
        assertTrue(dfg.distance > 0);
        assertEquals(dfg.count("def_use_chains_before") + 1, dfg.count("def_use_chains_after"), "new use of b");
        assertEquals(2, dfg.count("variables_after"));

        MetricRecord calls = report.metric(MetricKind.CALL_GRAPH);
        assertEquals(0.0, calls.distance, 1e-9);
        assertEquals(1, calls.count("functions_after"));

        assertTrue(report.metric(MetricKind.PDG).distance > 0);
        assertTrue(report.metric(MetricKind.CPG).count("structure_edges_after") > 0);
    }

    @Test
    void addedGuardShowsUpInSourceLevelMetrics() {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(AnalyzerOptions.defaults());

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, GUARDED);

        MetricRecord ast = report.metric(MetricKind.AST);
        assertEquals(CodeMetrics.TREE_EDIT_DISTANCE, ast.method);
        assertTrue(ast.nodesAfter > ast.nodesBefore);
        assertTrue(ast.distance >= ast.nodesAfter - ast.nodesBefore, "at least the inserted nodes");

        MetricRecord cyclomatic = report.metric(MetricKind.CYCLOMATIC);
        assertEquals(1.0, cyclomatic.distance, 1e-9);
        assertEquals(0.5, cyclomatic.normalizedDistance, 1e-9);
        assertEquals(1, cyclomatic.count("delta_total"));
        assertEquals(2, cyclomatic.count("total_complexity_after"));

        MetricRecord tokens = report.metric(MetricKind.TOKEN);
        assertEquals(CodeMetrics.LEVENSHTEIN, tokens.method);
        assertEquals(9, tokens.distance, 1e-9, "if ( b == 0 ) return 0 ;");
        assertEquals(tokens.count("tokens_before") + 9, tokens.count("tokens_after"));

        MetricRecord loc = report.metric(MetricKind.LOC);
        assertEquals(1, loc.count("lines_before"));
        assertEquals(4, loc.count("lines_after"));
        assertTrue(loc.distance > 0);

        assertEquals(0.0, report.metric(MetricKind.EXCEPTION_HANDLING).distance, 1e-9);
        assertEquals(0.0, report.metric(MetricKind.VARIABLE_SCOPE).distance, 1e-9);
    }

    @Test
    void unparseableAfterSideIsMeasuredNotFailed() {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(AnalyzerOptions.defaults());

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, "}}} not java {{{");

        MetricRecord cfg = report.metric(MetricKind.CFG);
        assertFalse(cfg.isFailed());
        assertEquals(1, cfg.nodesAfter);
        assertTrue(cfg.distance > 0);
    }

    @Test
    void failingMetricDoesNotAbortSiblings() {
        CfgBuilder broken = new CfgBuilder() {
            @Override
            public ControlFlowGraph build(String source, String name) {
                throw new IllegalStateException("cfg exploded");
            }
        };
        ChangeAnalyzer analyzer = analyzerWith(AnalyzerOptions.defaults(), broken, new GraphMerger());

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, GUARDED);

        MetricRecord cfg = report.metric(MetricKind.CFG);
        assertTrue(cfg.isFailed());
        assertEquals(MetricRecord.FAILED, cfg.distance);
        assertEquals(MetricRecord.FAILED, cfg.normalizedDistance);
        assertTrue(cfg.error.contains("cfg exploded"), cfg.error);

        assertFalse(report.metric(MetricKind.DFG).isFailed());
        assertTrue(report.metric(MetricKind.DFG).distance > 0);
        assertFalse(report.metric(MetricKind.CALL_GRAPH).isFailed());
        assertTrue(report.metric(MetricKind.PDG).isFailed(), "PDG needs the CFG");
    }

    @Test
    void mergeFailureFallsBackToWeightedEstimate() {
        GraphMerger broken = new GraphMerger() {
            @Override
            public ProgramDependenceGraph toPdg(ControlFlowGraph cfg, DataFlowGraph dfg, String name) {
                throw new GraphInvariantException("merge exploded");
            }

            @Override
            public CodePropertyGraph toCpg(ControlFlowGraph cfg, DataFlowGraph dfg, CallGraph callGraph, String name) {
                throw new GraphInvariantException("merge exploded");
            }
        };
        ChangeAnalyzer analyzer = analyzerWith(AnalyzerOptions.defaults(), new CfgBuilder(), broken);

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, GUARDED);

        MetricRecord cfg = report.metric(MetricKind.CFG);
        MetricRecord dfg = report.metric(MetricKind.DFG);
        MetricRecord calls = report.metric(MetricKind.CALL_GRAPH);
        MetricRecord pdg = report.metric(MetricKind.PDG);
        MetricRecord cpg = report.metric(MetricKind.CPG);
        assertEquals(WeightedGedEstimator.METHOD, pdg.method);
        assertEquals(WeightedGedEstimator.combine(cfg.distance, dfg.distance), pdg.distance, 1e-9);
        assertEquals(WeightedGedEstimator.METHOD, cpg.method);
        assertEquals(pdg.distance + calls.distance, cpg.distance, 1e-9);
    }

    @Test
    void weightedEstimateComputesHiddenComponents() {
        GraphMerger broken = new GraphMerger() {
            @Override
            public ProgramDependenceGraph toPdg(ControlFlowGraph cfg, DataFlowGraph dfg, String name) {
                throw new GraphInvariantException("merge exploded");
            }
        };
        AnalyzerOptions options = AnalyzerOptions.defaults().setKinds(EnumSet.of(MetricKind.PDG));
        ChangeAnalyzer analyzer = analyzerWith(options, new CfgBuilder(), broken);

        ComparisonReport report = analyzer.analyze("F.java", PLAIN, GUARDED);

        assertEquals(List.of("pdg"), List.copyOf(report.metrics().keySet()));
        MetricRecord pdg = report.metric(MetricKind.PDG);
        assertEquals(WeightedGedEstimator.METHOD, pdg.method);
        assertTrue(pdg.distance > 0);
    }

    @Test
    void basicDfgCanBeSelected() {
        AnalyzerOptions options = AnalyzerOptions.defaults().setSsaDfg(false).setKinds(EnumSet.of(MetricKind.DFG));
        ChangeAnalyzer analyzer = new ChangeAnalyzer(options);

        ComparisonReport report = analyzer.analyze("F.java", GUARDED, GUARDED);

        MetricRecord dfg = report.metric(MetricKind.DFG);
        assertEquals(0, dfg.count("phi_nodes_after"));
        assertEquals(3, dfg.count("def_use_chains_after"));
    }

    @Test
    void failedReportMarksEveryRequestedKind() {
        ChangeAnalyzer analyzer = new ChangeAnalyzer(AnalyzerOptions.defaults().setKinds(EnumSet.of(MetricKind.CFG, MetricKind.CPG)));

        ComparisonReport report = analyzer.failedReport("F.java", new IllegalStateException("worker died"));

        assertEquals(2, report.metrics().size());
        assertTrue(report.metrics().values().stream().allMatch(MetricRecord::isFailed));
        assertEquals("IllegalStateException: worker died", report.metric(MetricKind.CPG).error);
    }
}
