package org.refactor.graphdiff.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码属性图：PDG 再并入调用图的结构边（call / inherit）。
 */
public class CodePropertyGraph extends ProgramDependenceGraph {

    private final List<Edge> structureEdges = new ArrayList<>();

    public CodePropertyGraph(String name) {
        super(name);
    }

    public void addStructureEdge(Edge edge) {
        addEdge(edge);
        structureEdges.add(edge);
    }

    public List<Edge> structureEdges() {
        return Collections.unmodifiableList(structureEdges);
    }
}
