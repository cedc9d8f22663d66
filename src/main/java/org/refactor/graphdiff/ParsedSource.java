package org.refactor.graphdiff;

import com.github.javaparser.ast.CompilationUnit;

import java.util.Optional;

/**
 * 一次解析的结果：要么是编译单元，要么是一条错误信息。
 *
 * @param unit    解析成功时的 AST 根节点
 * @param error   解析失败时的说明，形如 {@code ParseError: ... (line N)}
 * @param wrapping 代码被包成了什么形式才解析成功
 */
public record ParsedSource(CompilationUnit unit, String error, Wrapping wrapping) {

    public enum Wrapping {
        /** 原样就是完整的编译单元 */
        NONE,
        /** 包成类体（方法 / 字段片段） */
        CLASS_BODY,
        /** 包成方法体（语句片段） */
        METHOD_BODY
    }

    public static ParsedSource success(CompilationUnit unit, Wrapping wrapping) {
        return new ParsedSource(unit, null, wrapping);
    }

    public static ParsedSource failure(String error) {
        return new ParsedSource(null, error, null);
    }

    public boolean isParsed() {
        return unit != null;
    }

    public Optional<CompilationUnit> compilationUnit() {
        return Optional.ofNullable(unit);
    }
}
