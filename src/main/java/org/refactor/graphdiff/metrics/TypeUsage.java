package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import org.refactor.graphdiff.ParsedSource;

import java.util.*;

/**
 * 显式类型的使用情况。
 * <ul>
 *     <li>typedParameters：写明类型的参数（不含未标类型的 lambda 参数和 {@code var}）</li>
 *     <li>returnTypes：返回值不是 void 的方法</li>
 *     <li>typedVariables：写明类型的字段和局部变量（不含 {@code var}）</li>
 *     <li>typeNames：以上位置出现的类型简单名，数组取元素类型，泛型只取原始类型名</li>
 * </ul>
 */
public record TypeUsage(int typedParameters, int returnTypes, int typedVariables, Set<String> typeNames) {

    public static final TypeUsage NONE = new TypeUsage(0, 0, 0, Set.of());

    public static TypeUsage of(ParsedSource parsed) {
        if (!parsed.isParsed()) {
            return NONE;
        }
        int[] params = {0};
        int[] returns = {0};
        int[] variables = {0};
        Set<String> names = new TreeSet<>();
        parsed.unit().walk(n -> {
            if (n instanceof Parameter p && isExplicit(p.getType())) {
                params[0]++;
                names.add(simpleName(p.getType()));
            } else if (n instanceof MethodDeclaration m && !m.getType().isVoidType()) {
                returns[0]++;
                names.add(simpleName(m.getType()));
            } else if (n instanceof VariableDeclarator v && isExplicit(v.getType())) {
                variables[0]++;
                names.add(simpleName(v.getType()));
            }
        });
        return new TypeUsage(params[0], returns[0], variables[0], Collections.unmodifiableSet(names));
    }

    private static boolean isExplicit(Type type) {
        return !type.isUnknownType() && !type.isVarType();
    }

    private static String simpleName(Type type) {
        Type element = type.getElementType();
        return element instanceof ClassOrInterfaceType c ? c.getNameAsString() : element.asString();
    }

    public Changes changesTo(TypeUsage after) {
        Set<String> added = new TreeSet<>(after.typeNames);
        added.removeAll(typeNames);
        Set<String> removed = new TreeSet<>(typeNames);
        removed.removeAll(after.typeNames);
        return new Changes(
                after.typedParameters - typedParameters,
                after.returnTypes - returnTypes,
                after.typedVariables - typedVariables,
                List.copyOf(added),
                List.copyOf(removed));
    }

    public record Changes(int typedParametersDelta, int returnTypesDelta, int typedVariablesDelta,
                          List<String> newTypes, List<String> removedTypes) {

        public int total() {
            return Math.abs(typedParametersDelta) + Math.abs(returnTypesDelta) + Math.abs(typedVariablesDelta)
                    + newTypes.size() + removedTypes.size();
        }
    }
}
