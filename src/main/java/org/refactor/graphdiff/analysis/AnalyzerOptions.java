package org.refactor.graphdiff.analysis;

import org.refactor.graphdiff.ged.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.*;

/**
 * 分析配置。
 * <p>
 * 默认值写在代码里；classpath 上的 {@value #RESOURCE} 可以覆盖默认值，
 * 命令行的 {@code key=value} 再覆盖它。setter 返回 this，便于链式调用。
 */
public class AnalyzerOptions {

    public static final String RESOURCE = "graph-diff.properties";

    public static final String STRATEGY = "ged.strategy";
    public static final String BEAM_WIDTH = "ged.beam-width";
    public static final String A_STAR_MAX_ITERATIONS = "ged.a-star.max-iterations";
    public static final String TIME_BUDGET_SECONDS = "ged.time-budget-seconds";
    public static final String COST_INSERT = "ged.cost.insert";
    public static final String COST_DELETE = "ged.cost.delete";
    public static final String COST_SUBSTITUTE = "ged.cost.substitute";
    public static final String SSA_DFG = "dfg.ssa";
    public static final String METRICS = "metrics";
    public static final String THREADS = "batch.threads";

    private GedStrategy strategy = GedStrategy.HYBRID;
    private EditCosts costs = EditCosts.UNIT;
    private int beamWidth = BeamSearchGed.DEFAULT_BEAM_WIDTH;
    private int aStarMaxIterations = AStarGed.DEFAULT_MAX_ITERATIONS;
    private Duration timeBudget = HybridGed.DEFAULT_TIME_BUDGET;
    private boolean ssaDfg = true;
    private EnumSet<MetricKind> kinds = EnumSet.allOf(MetricKind.class);
    private int threads = 4;

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions();
    }

    /**
     * 默认值 + classpath 上的配置文件（不存在时只用默认值）。
     */
    public static AnalyzerOptions load() {
        AnalyzerOptions options = new AnalyzerOptions();
        try (InputStream in = AnalyzerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                options.applyAll(props);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
        return options;
    }

    public AnalyzerOptions applyAll(Properties props) {
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            apply(key, props.getProperty(key));
        }
        return this;
    }

    /**
     * 应用一项配置；未知的 key 或非法的值抛 {@link IllegalArgumentException}。
     */
    public AnalyzerOptions apply(String key, String value) {
        String v = value.trim();
        try {
            switch (key) {
                case STRATEGY -> setStrategy(GedStrategy.fromKey(v));
                case BEAM_WIDTH -> setBeamWidth(Integer.parseInt(v));
                case A_STAR_MAX_ITERATIONS -> setAStarMaxIterations(Integer.parseInt(v));
                case TIME_BUDGET_SECONDS -> setTimeBudget(Duration.ofMillis((long) (Double.parseDouble(v) * 1000)));
                case COST_INSERT -> setCosts(new EditCosts(Double.parseDouble(v), costs.deletion(), costs.substitution()));
                case COST_DELETE -> setCosts(new EditCosts(costs.insertion(), Double.parseDouble(v), costs.substitution()));
                case COST_SUBSTITUTE -> setCosts(new EditCosts(costs.insertion(), costs.deletion(), Double.parseDouble(v)));
                case SSA_DFG -> setSsaDfg(Boolean.parseBoolean(v));
                case METRICS -> setKinds(parseKinds(v));
                case THREADS -> setThreads(Integer.parseInt(v));
                default -> throw new IllegalArgumentException("unknown option: " + key);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + key + ": " + value, e);
        }
        return this;
    }

    private static Set<MetricKind> parseKinds(String csv) {
        Set<MetricKind> result = EnumSet.noneOf(MetricKind.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                result.add(MetricKind.fromKey(part));
            }
        }
        return result;
    }

    /**
     * 按当前策略新建一个 GED 计算器。
     */
    public GedCalculator newCalculator() {
        return switch (strategy) {
            case A_STAR -> new AStarGed(costs, aStarMaxIterations);
            case BEAM -> new BeamSearchGed(costs, beamWidth, BeamSearchGed.DEFAULT_NODE_THRESHOLD, timeBudget);
            case HYBRID -> new HybridGed(costs, timeBudget);
        };
    }

    public GedStrategy getStrategy() {
        return strategy;
    }

    public AnalyzerOptions setStrategy(GedStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy);
        return this;
    }

    public EditCosts getCosts() {
        return costs;
    }

    public AnalyzerOptions setCosts(EditCosts costs) {
        this.costs = Objects.requireNonNull(costs);
        return this;
    }

    public int getBeamWidth() {
        return beamWidth;
    }

    public AnalyzerOptions setBeamWidth(int beamWidth) {
        if (beamWidth <= 0) {
            throw new IllegalArgumentException("beam width must be positive: " + beamWidth);
        }
        this.beamWidth = beamWidth;
        return this;
    }

    public int getAStarMaxIterations() {
        return aStarMaxIterations;
    }

    public AnalyzerOptions setAStarMaxIterations(int aStarMaxIterations) {
        if (aStarMaxIterations <= 0) {
            throw new IllegalArgumentException("A* iteration cap must be positive: " + aStarMaxIterations);
        }
        this.aStarMaxIterations = aStarMaxIterations;
        return this;
    }

    public Duration getTimeBudget() {
        return timeBudget;
    }

    public AnalyzerOptions setTimeBudget(Duration timeBudget) {
        if (timeBudget.isNegative()) {
            throw new IllegalArgumentException("time budget must not be negative: " + timeBudget);
        }
        this.timeBudget = timeBudget;
        return this;
    }

    public boolean isSsaDfg() {
        return ssaDfg;
    }

    public AnalyzerOptions setSsaDfg(boolean ssaDfg) {
        this.ssaDfg = ssaDfg;
        return this;
    }

    public Set<MetricKind> getKinds() {
        return Collections.unmodifiableSet(kinds);
    }

    public AnalyzerOptions setKinds(Set<MetricKind> kinds) {
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("at least one metric kind is required");
        }
        this.kinds = EnumSet.copyOf(kinds);
        return this;
    }

    public int getThreads() {
        return threads;
    }

    public AnalyzerOptions setThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("thread count must be positive: " + threads);
        }
        this.threads = threads;
        return this;
    }
}
