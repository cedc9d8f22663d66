package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import org.refactor.graphdiff.ParsedSource;

import java.util.*;

/**
 * 变量作用域：每个类型的字段，每个方法（{@code 类型.方法名}，重载合并）的局部变量。
 *
 * @param fields 类型名 -> 字段名
 * @param locals 方法限定名 -> 局部变量名
 */
public record VariableScopes(Map<String, Set<String>> fields, Map<String, Set<String>> locals) {

    public static final VariableScopes NONE = new VariableScopes(Map.of(), Map.of());

    public static VariableScopes of(ParsedSource parsed) {
        if (!parsed.isParsed()) {
            return NONE;
        }
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        Map<String, Set<String>> locals = new LinkedHashMap<>();
        for (TypeDeclaration<?> type : parsed.unit().findAll(TypeDeclaration.class)) {
            String typeName = type.getNameAsString();
            Set<String> names = fields.computeIfAbsent(typeName, k -> new LinkedHashSet<>());
            for (FieldDeclaration field : type.getFields()) {
                field.getVariables().forEach(v -> names.add(v.getNameAsString()));
            }
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof CallableDeclaration<?> callable) {
                    Set<String> vars = locals.computeIfAbsent(typeName + "." + callable.getNameAsString(),
                            k -> new LinkedHashSet<>());
                    for (VariableDeclarator v : callable.findAll(VariableDeclarator.class)) {
                        // 方法体里匿名类的字段不算局部变量
                        if (!(v.getParentNode().orElse(null) instanceof FieldDeclaration)) {
                            vars.add(v.getNameAsString());
                        }
                    }
                }
            }
        }
        return new VariableScopes(fields, locals);
    }

    public int fieldCount() {
        return fields.values().stream().mapToInt(Set::size).sum();
    }

    public int localCount() {
        return locals.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * 与修改后版本比较。
     * <ul>
     *     <li>local_to_field：方法不再声明某个局部变量，而所在类型新增了同名字段</li>
     *     <li>field_to_local：类型去掉了某个字段，而它的某个方法新声明了同名局部变量</li>
     *     <li>new_fields / removed_fields：各类型新增 / 删除的字段</li>
     * </ul>
     */
    public Changes changesTo(VariableScopes after) {
        int localToField = 0;
        for (Map.Entry<String, Set<String>> method : locals.entrySet()) {
            Set<String> afterLocals = after.locals.get(method.getKey());
            if (afterLocals == null) {
                continue;
            }
            String type = ownerOf(method.getKey());
            Set<String> fieldsBefore = fields.getOrDefault(type, Set.of());
            Set<String> fieldsAfter = after.fields.getOrDefault(type, Set.of());
            for (String v : method.getValue()) {
                if (!afterLocals.contains(v) && fieldsAfter.contains(v) && !fieldsBefore.contains(v)) {
                    localToField++;
                }
            }
        }

        int fieldToLocal = 0;
        int newFields = 0;
        int removedFields = 0;
        Set<String> types = new LinkedHashSet<>(fields.keySet());
        types.addAll(after.fields.keySet());
        for (String type : types) {
            Set<String> b = fields.getOrDefault(type, Set.of());
            Set<String> a = after.fields.getOrDefault(type, Set.of());
            for (String v : a) {
                if (!b.contains(v)) {
                    newFields++;
                }
            }
            for (String v : b) {
                if (!a.contains(v)) {
                    removedFields++;
                    if (after.fields.containsKey(type) && becameLocal(type, v, after)) {
                        fieldToLocal++;
                    }
                }
            }
        }
        return new Changes(localToField, fieldToLocal, newFields, removedFields);
    }

    private boolean becameLocal(String type, String variable, VariableScopes after) {
        for (Map.Entry<String, Set<String>> method : after.locals.entrySet()) {
            if (ownerOf(method.getKey()).equals(type) && method.getValue().contains(variable)
                    && !locals.getOrDefault(method.getKey(), Set.of()).contains(variable)) {
                return true;
            }
        }
        return false;
    }

    private static String ownerOf(String method) {
        return method.substring(0, method.lastIndexOf('.'));
    }

    public record Changes(int localToField, int fieldToLocal, int newFields, int removedFields) {

        public int total() {
            return localToField + fieldToLocal + newFields + removedFields;
        }
    }
}
