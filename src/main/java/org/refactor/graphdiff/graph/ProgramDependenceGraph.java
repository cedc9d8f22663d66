package org.refactor.graphdiff.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序依赖图：控制依赖边和数据依赖边分开记录。
 */
public class ProgramDependenceGraph extends Graph {

    private final List<Edge> controlEdges = new ArrayList<>();
    private final List<Edge> dataEdges = new ArrayList<>();

    public ProgramDependenceGraph(String name) {
        super(name);
    }

    public void addControlEdge(Edge edge) {
        addEdge(edge);
        controlEdges.add(edge);
    }

    public void addDataEdge(Edge edge) {
        addEdge(edge);
        dataEdges.add(edge);
    }

    public List<Edge> controlEdges() {
        return Collections.unmodifiableList(controlEdges);
    }

    public List<Edge> dataEdges() {
        return Collections.unmodifiableList(dataEdges);
    }
}
