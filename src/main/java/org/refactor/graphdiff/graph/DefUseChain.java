package org.refactor.graphdiff.graph;

public record DefUseChain(String definitionId, String useId, String variable) {
}
