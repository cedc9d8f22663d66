package org.refactor.graphdiff.dfg;

/**
 * 符号表中的一层作用域。id 在一次构建内唯一，同名（重载）函数也不会冲突。
 */
public final class Scope {

    public static final String MODULE = "module";

    private final int id;
    private final String name;
    private final Scope parent;

    Scope(int id, String name, Scope parent) {
        this.id = id;
        this.name = name;
        this.parent = parent;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Scope parent() {
        return parent;
    }

    public boolean isModule() {
        return parent == null;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
