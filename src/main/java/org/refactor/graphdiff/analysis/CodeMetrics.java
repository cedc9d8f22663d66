package org.refactor.graphdiff.analysis;

import org.refactor.graphdiff.ParsedSource;
import org.refactor.graphdiff.metrics.*;

import java.util.List;

/**
 * 非图度量：把 metrics 包里的统计结果整理成 {@link MetricRecord}。
 * <p>
 * distance 是变化量的大小，normalizedDistance 是它相对两侧规模的比例：
 * <pre>
 *   ast                 树编辑距离 / max(AST 节点数)
 *   loc                 增删行数 / (两侧行数之和)
 *   token               记号编辑距离 / max(记号数)
 *   cyclomatic          |总复杂度变化| / max(总复杂度)
 *   halstead            |难度变化| / max(难度)
 *   variable_scope      作用域变化数 / (两侧字段数 + 局部变量数)
 *   type_changes        类型变化数 / (两侧显式类型位置数 + 类型名数)
 *   exception_handling  异常处理变化数 / (两侧 try + catch + 捕获类型数)
 * </pre>
 * 解析失败的一侧按"没有任何结构"统计（AST 为单个错误节点，记号按空白切分），不视为失败。
 */
final class CodeMetrics {

    static final String TREE_EDIT_DISTANCE = "tree_edit_distance";
    static final String LEVENSHTEIN = "levenshtein";
    static final String LINE_LCS = "line_lcs";
    static final String DELTA = "delta";

    private CodeMetrics() {
    }

    static MetricRecord measure(MetricKind kind, String beforeSource, ParsedSource before,
                                String afterSource, ParsedSource after) {
        switch (kind) {
            case AST:
                return ast(before, after);
            case LOC:
                return loc(beforeSource, afterSource);
            case TOKEN:
                return token(beforeSource, before, afterSource, after);
            case CYCLOMATIC:
                return cyclomatic(before, after);
            case HALSTEAD:
                return halstead(before, after);
            case VARIABLE_SCOPE:
                return variableScope(before, after);
            case TYPE_CHANGES:
                return typeChanges(before, after);
            case EXCEPTION_HANDLING:
                return exceptionHandling(before, after);
            default:
                throw new IllegalArgumentException(kind.key() + " is a graph metric");
        }
    }

    private static MetricRecord ast(ParsedSource before, ParsedSource after) {
        AstTree t1 = AstTree.of(before);
        AstTree t2 = AstTree.of(after);
        int distance = TreeEditDistance.distance(t1, t2);
        MetricRecord r = record(MetricKind.AST, TREE_EDIT_DISTANCE, distance, Math.max(t1.size(), t2.size()));
        r.nodesBefore = t1.size();
        r.nodesAfter = t2.size();
        r.edgesBefore = t1.size() - 1;
        r.edgesAfter = t2.size() - 1;
        return r.put("ast_size_delta", Math.abs(t2.size() - t1.size()));
    }

    private static MetricRecord loc(String before, String after) {
        LineChanges lines = LineChanges.between(before, after);
        return record(MetricKind.LOC, LINE_LCS, lines.modified(), lines.linesBefore() + lines.linesAfter())
                .put("added", lines.added())
                .put("deleted", lines.deleted())
                .put("modified", lines.modified())
                .count("lines", lines.linesBefore(), lines.linesAfter());
    }

    private static MetricRecord token(String beforeSource, ParsedSource before, String afterSource, ParsedSource after) {
        List<String> t1 = TokenDistance.tokens(beforeSource, before);
        List<String> t2 = TokenDistance.tokens(afterSource, after);
        int distance = TokenDistance.levenshtein(t1, t2);
        return record(MetricKind.TOKEN, LEVENSHTEIN, distance, Math.max(t1.size(), t2.size()))
                .count("tokens", t1.size(), t2.size())
                .value("token_change_ratio", (double) distance / Math.max(t1.size(), 1));
    }

    private static MetricRecord cyclomatic(ParsedSource before, ParsedSource after) {
        CyclomaticComplexity c1 = CyclomaticComplexity.of(before);
        CyclomaticComplexity c2 = CyclomaticComplexity.of(after);
        int deltaTotal = c2.total() - c1.total();
        return record(MetricKind.CYCLOMATIC, DELTA, Math.abs(deltaTotal), Math.max(c1.total(), c2.total()))
                .count("functions", c1.functions(), c2.functions())
                .count("total_complexity", c1.total(), c2.total())
                .put("delta_total", deltaTotal)
                .put("delta_max", c2.max() - c1.max())
                .value("delta_average", c2.average() - c1.average());
    }

    private static MetricRecord halstead(ParsedSource before, ParsedSource after) {
        HalsteadMetrics h1 = HalsteadMetrics.of(before);
        HalsteadMetrics h2 = HalsteadMetrics.of(after);
        double delta = h2.difficulty() - h1.difficulty();
        return record(MetricKind.HALSTEAD, DELTA, Math.abs(delta), Math.max(h1.difficulty(), h2.difficulty()))
                .count("vocabulary", h1.vocabulary(), h2.vocabulary())
                .count("length", h1.length(), h2.length())
                .value("difficulty_before", h1.difficulty())
                .value("difficulty_after", h2.difficulty())
                .value("delta_difficulty", delta)
                .value("delta_volume", h2.volume() - h1.volume())
                .value("delta_effort", h2.effort() - h1.effort());
    }

    private static MetricRecord variableScope(ParsedSource before, ParsedSource after) {
        VariableScopes s1 = VariableScopes.of(before);
        VariableScopes s2 = VariableScopes.of(after);
        VariableScopes.Changes changes = s1.changesTo(s2);
        int size = s1.fieldCount() + s1.localCount() + s2.fieldCount() + s2.localCount();
        return record(MetricKind.VARIABLE_SCOPE, DELTA, changes.total(), size)
                .count("fields", s1.fieldCount(), s2.fieldCount())
                .count("locals", s1.localCount(), s2.localCount())
                .put("local_to_field", changes.localToField())
                .put("field_to_local", changes.fieldToLocal())
                .put("new_fields", changes.newFields())
                .put("removed_fields", changes.removedFields())
                .put("total_scope_changes", changes.total());
    }

    private static MetricRecord typeChanges(ParsedSource before, ParsedSource after) {
        TypeUsage u1 = TypeUsage.of(before);
        TypeUsage u2 = TypeUsage.of(after);
        TypeUsage.Changes changes = u1.changesTo(u2);
        int size = u1.typedParameters() + u1.returnTypes() + u1.typedVariables() + u1.typeNames().size()
                + u2.typedParameters() + u2.returnTypes() + u2.typedVariables() + u2.typeNames().size();
        return record(MetricKind.TYPE_CHANGES, DELTA, changes.total(), size)
                .put("typed_parameters_delta", changes.typedParametersDelta())
                .put("return_types_delta", changes.returnTypesDelta())
                .put("typed_variables_delta", changes.typedVariablesDelta())
                .put("total_type_changes", changes.total())
                .names("new_types", changes.newTypes())
                .names("removed_types", changes.removedTypes());
    }

    private static MetricRecord exceptionHandling(ParsedSource before, ParsedSource after) {
        ExceptionHandling e1 = ExceptionHandling.of(before);
        ExceptionHandling e2 = ExceptionHandling.of(after);
        ExceptionHandling.Changes changes = e1.changesTo(e2);
        int size = e1.tryBlocks() + e1.catchClauses() + e1.caughtTypes().size()
                + e2.tryBlocks() + e2.catchClauses() + e2.caughtTypes().size();
        return record(MetricKind.EXCEPTION_HANDLING, DELTA, changes.total(), size)
                .put("try_blocks_delta", changes.tryBlocksDelta())
                .put("catch_clauses_delta", changes.catchClausesDelta())
                .put("exception_specificity_change", changes.specificityChange())
                .put("finally_blocks_delta", changes.finallyBlocksDelta())
                .put("throw_statements_delta", changes.throwStatementsDelta())
                .put("total_exception_changes", changes.total())
                .names("new_exception_types", changes.newTypes())
                .names("removed_exception_types", changes.removedTypes());
    }

    private static MetricRecord record(MetricKind kind, String method, double distance, double scale) {
        MetricRecord r = new MetricRecord();
        r.kind = kind.key();
        r.method = method;
        r.distance = distance;
        r.normalizedDistance = scale > 0 ? distance / scale : 0.0;
        return r;
    }
}
