package org.refactor.graphdiff.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 图中的一个节点。
 * <p>
 * 相等性只看 id：同一张图里 id 唯一，label / attributes 不参与比较。
 * 各类节点特有的信息（行号、变量名、SSA 版本号、作用域、是否 phi 等）
 * 放在 attributes 中，通过下面的类型化访问器读取。
 */
public record Node(String id, NodeType type, String label, Map<String, Object> attributes) {

    public static final String LINE = "line";
    public static final String COLUMN = "column";
    public static final String VARIABLE = "var_name";
    public static final String VERSION = "version";
    public static final String SCOPE = "scope";
    public static final String SCOPE_ID = "scope_id";
    public static final String PHI = "is_phi";
    public static final String PARAM = "is_param";
    public static final String QUALIFIED_NAME = "qualified_name";

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        label = label == null ? "" : label;
        attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Node(String id, NodeType type, String label) {
        this(id, type, label, Collections.emptyMap());
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    // 没有行号时返回 -1（与解析器拿不到位置时的约定一致）
    public int line() {
        return intAttribute(LINE, -1);
    }

    public int column() {
        return intAttribute(COLUMN, -1);
    }

    public int version() {
        return intAttribute(VERSION, 0);
    }

    public int scopeId() {
        return intAttribute(SCOPE_ID, -1);
    }

    public String variable() {
        Object v = attributes.get(VARIABLE);
        return v == null ? null : v.toString();
    }

    public String scope() {
        Object v = attributes.get(SCOPE);
        return v == null ? null : v.toString();
    }

    public boolean isPhi() {
        return Boolean.TRUE.equals(attributes.get(PHI));
    }

    public boolean isParam() {
        return Boolean.TRUE.equals(attributes.get(PARAM));
    }

    private int intAttribute(String key, int fallback) {
        Object v = attributes.get(key);
        return v instanceof Number n ? n.intValue() : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Node(" + id + ", " + type.wireName() + ", " + label + ")";
    }
}
