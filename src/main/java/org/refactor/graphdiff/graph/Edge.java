package org.refactor.graphdiff.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 有向边。相等性由 (source, target, type) 决定，
 * 因此同一对节点之间允许存在类型不同的平行边。
 */
public record Edge(String source, String target, EdgeType type, String label, Map<String, Object> attributes) {

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(type, "type");
        label = label == null ? "" : label;
        attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Edge(String source, String target, EdgeType type) {
        this(source, target, type, "", Collections.emptyMap());
    }

    public Edge(String source, String target, EdgeType type, String label) {
        this(source, target, type, label, Collections.emptyMap());
    }

    /**
     * 复制一条边并替换端点（合并图时重映射节点 id 用）。
     */
    public Edge reconnect(String newSource, String newTarget) {
        return new Edge(newSource, newTarget, type, label, attributes);
    }

    public Edge withType(EdgeType newType, Map<String, Object> extraAttributes) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.putAll(extraAttributes);
        return new Edge(source, target, newType, label, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge other)) return false;
        return source.equals(other.source) && target.equals(other.target) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, type);
    }

    @Override
    public String toString() {
        return source + " -" + type.wireName() + "-> " + target;
    }
}
