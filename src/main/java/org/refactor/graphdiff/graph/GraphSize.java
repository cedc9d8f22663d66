package org.refactor.graphdiff.graph;

public record GraphSize(int nodes, int edges) {
}
