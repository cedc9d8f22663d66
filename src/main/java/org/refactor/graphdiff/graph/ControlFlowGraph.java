package org.refactor.graphdiff.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 控制流图：额外记录入口节点和出口节点。
 */
public class ControlFlowGraph extends Graph {

    private String entryId;
    private final List<String> exitIds = new ArrayList<>();

    public ControlFlowGraph(String name) {
        super(name);
    }

    public String entryId() {
        return entryId;
    }

    public void setEntryId(String entryId) {
        this.entryId = entryId;
    }

    public List<String> exitIds() {
        return Collections.unmodifiableList(exitIds);
    }

    public void addExitId(String id) {
        if (!exitIds.contains(id)) {
            exitIds.add(id);
        }
    }
}
