package org.refactor.graphdiff.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 调用图：限定名 -> 函数节点，调用边按 (caller, callee) 去重。
 */
public class CallGraph extends Graph {

    private final Map<String, Node> functions = new LinkedHashMap<>();

    public CallGraph(String name) {
        super(name);
    }

    public void addFunction(String qualifiedName, Node node) {
        addNode(node);
        functions.put(qualifiedName, node);
    }

    public Node function(String qualifiedName) {
        return functions.get(qualifiedName);
    }

    public boolean hasFunction(String qualifiedName) {
        return functions.containsKey(qualifiedName);
    }

    public Map<String, Node> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * @return 新加了边返回 true，重复调用返回 false
     */
    public boolean addCallEdge(String callerQualified, String calleeQualified) {
        Node caller = functions.get(callerQualified);
        Node callee = functions.get(calleeQualified);
        if (caller == null || callee == null) {
            throw new GraphInvariantException("call edge between unknown functions: " + callerQualified + " -> " + calleeQualified);
        }
        Edge edge = new Edge(caller.id(), callee.id(), EdgeType.CALL, "calls");
        if (hasEdge(edge)) {
            return false;
        }
        addEdge(edge);
        return true;
    }

    public int callCount() {
        return countEdges(EdgeType.CALL);
    }
}
