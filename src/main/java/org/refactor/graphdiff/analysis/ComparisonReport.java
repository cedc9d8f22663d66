package org.refactor.graphdiff.analysis;

import java.util.Map;

/**
 * 一对 before / after 源码的全部度量结果，键为 {@link MetricKind#key()}。
 */
public record ComparisonReport(String path, Map<String, MetricRecord> metrics, long elapsedMs) {

    public MetricRecord metric(MetricKind kind) {
        return metrics.get(kind.key());
    }
}
