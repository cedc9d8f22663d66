package org.refactor.graphdiff.analysis;

/**
 * 一次变更：同一文件修改前后的源码。
 */
public record SourcePair(String path, String before, String after) {
}
