package org.refactor.graphdiff.graph;

import java.util.List;
import java.util.Map;

/**
 * 图的纯数据快照，用于 JSON 输出。
 */
public record GraphRecord(String name, List<NodeRecord> nodes, List<EdgeRecord> edges) {

    public record NodeRecord(String id, String type, String label, Map<String, Object> attributes) {
    }

    public record EdgeRecord(String source, String target, String type, String label, Map<String, Object> attributes) {
    }
}
