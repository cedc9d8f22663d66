package org.refactor.graphdiff.dfg;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 作用域栈。栈底永远是 module 作用域（类型层面的字段定义放在这里）。
 */
final class SymbolTable {

    private final Deque<Scope> stack = new ArrayDeque<>();
    private final Scope module;
    private int nextId = 0;

    SymbolTable() {
        module = new Scope(nextId++, Scope.MODULE, null);
        stack.push(module);
    }

    Scope enter(String name) {
        Scope scope = new Scope(nextId++, name, stack.peek());
        stack.push(scope);
        return scope;
    }

    void exit() {
        if (stack.peek() == module) {
            throw new IllegalStateException("cannot exit module scope");
        }
        stack.pop();
    }

    Scope current() {
        return stack.peek();
    }

    Scope module() {
        return module;
    }
}
