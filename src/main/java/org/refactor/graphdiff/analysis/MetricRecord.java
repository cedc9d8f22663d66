package org.refactor.graphdiff.analysis;

import org.refactor.graphdiff.ged.GedResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一种度量的比较结果（JSON 输出用，字段公开）。
 * <p>
 * 图度量的 nodes / edges 是两侧程序图的规模；AST 度量里是两侧 AST 的节点数和树边数。
 * <p>
 * 计算失败时 distance 和 normalizedDistance 为 -1，error 记录原因。
 */
public class MetricRecord {

    public static final double FAILED = -1.0;

    public String kind;
    public double distance;
    public double normalizedDistance;
    public String method;
    public int nodesBefore;
    public int nodesAfter;
    public int edgesBefore;
    public int edgesAfter;
    // 各度量特有的计数，例如 def_use_chains_before、functions_after、try_blocks_delta
    public Map<String, Integer> counts = new LinkedHashMap<>();
    // 非整数的附加值（复杂度变化等），没有时为 null
    public Map<String, Double> values;
    // 名字集合的变化（新增 / 删除的类型等），没有时为 null
    public Map<String, List<String>> names;
    public int beamWidth;
    public int iterations;
    public boolean timeout;
    public String sizeCategory;
    public long elapsedMs;
    public String error;

    public static MetricRecord of(MetricKind kind, GedResult result) {
        MetricRecord r = new MetricRecord();
        r.kind = kind.key();
        r.distance = result.distance();
        r.normalizedDistance = result.normalizedDistance();
        r.method = result.method();
        r.nodesBefore = result.nodesBefore();
        r.nodesAfter = result.nodesAfter();
        r.edgesBefore = result.edgesBefore();
        r.edgesAfter = result.edgesAfter();
        r.beamWidth = result.beamWidth();
        r.iterations = result.iterations();
        r.timeout = result.timeout();
        r.sizeCategory = result.sizeCategory();
        r.elapsedMs = result.elapsedMillis();
        return r;
    }

    public static MetricRecord failed(MetricKind kind, String error) {
        MetricRecord r = new MetricRecord();
        r.kind = kind.key();
        r.distance = FAILED;
        r.normalizedDistance = FAILED;
        r.error = error;
        return r;
    }

    public boolean isFailed() {
        return error != null;
    }

    public MetricRecord count(String name, int before, int after) {
        counts.put(name + "_before", before);
        counts.put(name + "_after", after);
        return this;
    }

    public MetricRecord put(String key, int value) {
        counts.put(key, value);
        return this;
    }

    public int count(String key) {
        return counts.getOrDefault(key, 0);
    }

    public MetricRecord value(String key, double value) {
        if (values == null) {
            values = new LinkedHashMap<>();
        }
        values.put(key, value);
        return this;
    }

    public double value(String key) {
        return values == null ? 0.0 : values.getOrDefault(key, 0.0);
    }

    public MetricRecord names(String key, List<String> list) {
        if (names == null) {
            names = new LinkedHashMap<>();
        }
        names.put(key, List.copyOf(list));
        return this;
    }

    public List<String> names(String key) {
        return names == null ? List.of() : names.getOrDefault(key, List.of());
    }
}
