package org.refactor.graphdiff.graph;

import java.util.*;

/**
 * 通用有向图：节点表 + 边列表 + 邻接表。
 * <p>
 * 节点按插入顺序保存，重复 add 同一个 id 会覆盖旧节点；
 * 边的两个端点必须已经存在，否则抛 {@link GraphInvariantException}。
 */
public class Graph {

    private final String name;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    // 邻接表：id -> 后继 id 列表
    private final Map<String, List<String>> adjacency = new HashMap<>();

    public Graph(String name) {
        this.name = name == null ? "" : name;
    }

    public String name() {
        return name;
    }

    public void addNode(Node node) {
        nodes.put(node.id(), node);
        adjacency.computeIfAbsent(node.id(), k -> new ArrayList<>());
    }

    public void addEdge(Edge edge) {
        if (!nodes.containsKey(edge.source())) {
            throw new GraphInvariantException("edge source '" + edge.source() + "' is not a node of graph '" + name + "'");
        }
        if (!nodes.containsKey(edge.target())) {
            throw new GraphInvariantException("edge target '" + edge.target() + "' is not a node of graph '" + name + "'");
        }
        edges.add(edge);
        adjacency.get(edge.source()).add(edge.target());
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean hasEdge(Edge edge) {
        return edges.contains(edge);
    }

    /**
     * @return 节点，不存在时返回 null
     */
    public Node getNode(String id) {
        return nodes.get(id);
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<String> successors(String id) {
        List<String> succ = adjacency.get(id);
        return succ == null ? Collections.emptyList() : Collections.unmodifiableList(succ);
    }

    // 前驱没有单独建索引，线性扫描边表
    public List<String> predecessors(String id) {
        List<String> preds = new ArrayList<>();
        for (Edge e : edges) {
            if (e.target().equals(id)) {
                preds.add(e.source());
            }
        }
        return preds;
    }

    public List<Edge> incomingEdges(String id) {
        List<Edge> result = new ArrayList<>();
        for (Edge e : edges) {
            if (e.target().equals(id)) result.add(e);
        }
        return result;
    }

    public List<Edge> outgoingEdges(String id) {
        List<Edge> result = new ArrayList<>();
        for (Edge e : edges) {
            if (e.source().equals(id)) result.add(e);
        }
        return result;
    }

    public List<Node> nodesOfType(NodeType type) {
        List<Node> result = new ArrayList<>();
        for (Node n : nodes.values()) {
            if (n.type() == type) result.add(n);
        }
        return result;
    }

    public int countEdges(EdgeType type) {
        int count = 0;
        for (Edge e : edges) {
            if (e.type() == type) count++;
        }
        return count;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public GraphSize size() {
        return new GraphSize(nodes.size(), edges.size());
    }

    public GraphRecord toRecord() {
        List<GraphRecord.NodeRecord> nodeRecords = new ArrayList<>();
        for (Node n : nodes.values()) {
            nodeRecords.add(new GraphRecord.NodeRecord(n.id(), n.type().wireName(), n.label(), n.attributes()));
        }
        List<GraphRecord.EdgeRecord> edgeRecords = new ArrayList<>();
        for (Edge e : edges) {
            edgeRecords.add(new GraphRecord.EdgeRecord(e.source(), e.target(), e.type().wireName(), e.label(), e.attributes()));
        }
        return new GraphRecord(name, nodeRecords, edgeRecords);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ", nodes=" + nodes.size() + ", edges=" + edges.size() + ")";
    }
}
