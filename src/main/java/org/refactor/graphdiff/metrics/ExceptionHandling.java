package org.refactor.graphdiff.metrics;

import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnionType;
import org.refactor.graphdiff.ParsedSource;

import java.util.*;

/**
 * 异常处理结构的统计。catch 的是 {@code Exception} 或 {@code Throwable} 时算作"宽泛捕获"。
 *
 * @param caughtTypes 所有 catch 子句捕获的异常类型简单名（多重捕获拆开）
 */
public record ExceptionHandling(int tryBlocks, int catchClauses, Set<String> caughtTypes,
                                int genericCatches, int finallyBlocks, int throwStatements) {

    public static final ExceptionHandling NONE = new ExceptionHandling(0, 0, Set.of(), 0, 0, 0);

    private static final Set<String> GENERIC = Set.of("Exception", "Throwable");

    public static ExceptionHandling of(ParsedSource parsed) {
        if (!parsed.isParsed()) {
            return NONE;
        }
        int[] tries = {0};
        int[] catches = {0};
        int[] generic = {0};
        int[] finallies = {0};
        int[] throwsCount = {0};
        Set<String> types = new TreeSet<>();
        parsed.unit().walk(n -> {
            if (n instanceof TryStmt tryStmt) {
                tries[0]++;
                catches[0] += tryStmt.getCatchClauses().size();
                if (tryStmt.getFinallyBlock().isPresent()) {
                    finallies[0]++;
                }
            } else if (n instanceof CatchClause clause) {
                boolean wide = false;
                for (String name : caughtNames(clause.getParameter().getType())) {
                    types.add(name);
                    wide |= GENERIC.contains(name);
                }
                if (wide) {
                    generic[0]++;
                }
            } else if (n instanceof ThrowStmt) {
                throwsCount[0]++;
            }
        });
        return new ExceptionHandling(tries[0], catches[0], Collections.unmodifiableSet(types),
                generic[0], finallies[0], throwsCount[0]);
    }

    private static List<String> caughtNames(Type type) {
        List<String> names = new ArrayList<>();
        if (type instanceof UnionType union) {
            union.getElements().forEach(t -> names.add(simpleName(t)));
        } else {
            names.add(simpleName(type));
        }
        return names;
    }

    private static String simpleName(Type type) {
        return type instanceof ClassOrInterfaceType c ? c.getNameAsString() : type.asString();
    }

    public Changes changesTo(ExceptionHandling after) {
        Set<String> added = new TreeSet<>(after.caughtTypes);
        added.removeAll(caughtTypes);
        Set<String> removed = new TreeSet<>(caughtTypes);
        removed.removeAll(after.caughtTypes);
        return new Changes(
                after.tryBlocks - tryBlocks,
                after.catchClauses - catchClauses,
                List.copyOf(added),
                List.copyOf(removed),
                after.genericCatches - genericCatches,
                after.finallyBlocks - finallyBlocks,
                after.throwStatements - throwStatements);
    }

    /**
     * @param specificityChange 宽泛捕获个数的变化，负数表示捕获变得更具体
     */
    public record Changes(int tryBlocksDelta, int catchClausesDelta, List<String> newTypes, List<String> removedTypes,
                          int specificityChange, int finallyBlocksDelta, int throwStatementsDelta) {

        public int total() {
            return Math.abs(tryBlocksDelta) + Math.abs(catchClausesDelta) + newTypes.size() + removedTypes.size();
        }
    }
}
