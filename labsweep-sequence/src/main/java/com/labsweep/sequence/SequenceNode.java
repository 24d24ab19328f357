package com.labsweep.sequence;

/**
 * One sweep node: a parameter name and the expression producing its values, at a fixed depth.
 * Nodes are created and owned by a {@link SequenceStore}; the parent is held as the parent's
 * store id ({@link #NO_PARENT} for roots), never as a reference. Ids are never reused.
 */
public final class SequenceNode {

    /** Parent id of a root node. */
    public static final int NO_PARENT = -1;

    private final int id;
    private final int level;
    private final int parentId;
    private String parameter;
    private String expression;

    SequenceNode(int id, int level, int parentId, String parameter, String expression) {
        this.id = id;
        this.level = level;
        this.parentId = parentId;
        this.parameter = parameter;
        this.expression = expression;
    }

    /** Stable id, unique within the owning store for its whole lifetime. */
    public int getId() {
        return id;
    }

    /** Depth; 0 for roots, parent level + 1 otherwise. */
    public int getLevel() {
        return level;
    }

    public int getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public String getParameter() {
        return parameter;
    }

    public String getExpression() {
        return expression;
    }

    void set(NodeField field, String value) {
        switch (field) {
            case PARAMETER -> parameter = value;
            case EXPRESSION -> expression = value;
        }
    }

    /** Snapshot of this node's content. */
    public SequenceEntry toEntry() {
        return new SequenceEntry(level, parameter, expression);
    }

    @Override
    public String toString() {
        return "SequenceNode{id=" + id + ", level=" + level + ", parameter='" + parameter
                + "', expression='" + expression + "'}";
    }
}
