package org.refactor.graphdiff.ged;

/**
 * 节点编辑代价。边不计代价（编辑距离只在节点上计算）。
 */
public record EditCosts(double insertion, double deletion, double substitution) {

    public static final EditCosts UNIT = new EditCosts(1.0, 1.0, 1.0);

    public EditCosts {
        if (insertion < 0 || deletion < 0 || substitution < 0
                || Double.isNaN(insertion) || Double.isNaN(deletion) || Double.isNaN(substitution)) {
            throw new IllegalArgumentException("edit costs must be non-negative: "
                    + insertion + ", " + deletion + ", " + substitution);
        }
    }

    public double max() {
        return Math.max(insertion, Math.max(deletion, substitution));
    }
}
