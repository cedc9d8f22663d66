package org.refactor.graphdiff.analysis;

import org.junit.jupiter.api.Test;
import org.refactor.graphdiff.ged.AStarGed;
import org.refactor.graphdiff.ged.BeamSearchGed;
import org.refactor.graphdiff.ged.EditCosts;
import org.refactor.graphdiff.ged.HybridGed;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerOptionsTest {

    @Test
    void bundledPropertiesMatchDefaults() {
        AnalyzerOptions loaded = AnalyzerOptions.load();

        assertEquals(GedStrategy.HYBRID, loaded.getStrategy());
        assertEquals(EditCosts.UNIT, loaded.getCosts());
        assertEquals(10, loaded.getBeamWidth());
        assertEquals(10_000, loaded.getAStarMaxIterations());
        assertEquals(Duration.ofSeconds(120), loaded.getTimeBudget());
        assertTrue(loaded.isSsaDfg());
        assertEquals(EnumSet.allOf(MetricKind.class), loaded.getKinds());
        assertEquals(4, loaded.getThreads());
    }

    @Test
    void keyValueOverrides() {
        AnalyzerOptions options = AnalyzerOptions.defaults()
                .apply(AnalyzerOptions.STRATEGY, "a_star")
                .apply(AnalyzerOptions.COST_SUBSTITUTE, "0.5")
                .apply(AnalyzerOptions.TIME_BUDGET_SECONDS, "1.5")
                .apply(AnalyzerOptions.METRICS, "cfg, DFG")
                .apply(AnalyzerOptions.SSA_DFG, "false");

        assertEquals(GedStrategy.A_STAR, options.getStrategy());
        assertEquals(new EditCosts(1.0, 1.0, 0.5), options.getCosts());
        assertEquals(Duration.ofMillis(1500), options.getTimeBudget());
        assertEquals(EnumSet.of(MetricKind.CFG, MetricKind.DFG), options.getKinds());
        assertFalse(options.isSsaDfg());
    }

    @Test
    void propertiesAreAppliedInBulk() {
        Properties props = new Properties();
        props.setProperty(AnalyzerOptions.BEAM_WIDTH, "3");
        props.setProperty(AnalyzerOptions.THREADS, "2");

        AnalyzerOptions options = AnalyzerOptions.defaults().applyAll(props);

        assertEquals(3, options.getBeamWidth());
        assertEquals(2, options.getThreads());
    }

    @Test
    void calculatorFollowsStrategy() {
        AnalyzerOptions options = AnalyzerOptions.defaults();

        assertEquals(HybridGed.METHOD, options.newCalculator().method());
        assertEquals(BeamSearchGed.METHOD, options.setStrategy(GedStrategy.BEAM).newCalculator().method());
        assertEquals(AStarGed.METHOD, options.setStrategy(GedStrategy.A_STAR).newCalculator().method());
    }

    @Test
    void rejectsBadInput() {
        AnalyzerOptions options = AnalyzerOptions.defaults();

        assertThrows(IllegalArgumentException.class, () -> options.apply("ged.unknown", "1"));
        assertThrows(IllegalArgumentException.class, () -> options.apply(AnalyzerOptions.BEAM_WIDTH, "wide"));
        assertThrows(IllegalArgumentException.class, () -> options.apply(AnalyzerOptions.BEAM_WIDTH, "0"));
        assertThrows(IllegalArgumentException.class, () -> options.apply(AnalyzerOptions.COST_INSERT, "-1"));
        assertThrows(IllegalArgumentException.class, () -> options.apply(AnalyzerOptions.STRATEGY, "dijkstra"));
        assertThrows(IllegalArgumentException.class, () -> options.apply(AnalyzerOptions.METRICS, "ast"));
        assertEquals(BeamSearchGed.DEFAULT_BEAM_WIDTH, options.getBeamWidth(), "failed updates leave options untouched");
    }
}
