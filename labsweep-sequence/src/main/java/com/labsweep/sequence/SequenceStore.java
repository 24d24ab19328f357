package com.labsweep.sequence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered forest of sweep nodes held as one flat list in pre-order. Tree shape is implied by levels
 * and list position; each node refers to its parent by id. Every structural edit keeps the list a
 * valid pre-order traversal and keeps every node within {@code maxDepth} levels.
 * <p>
 * Not thread-safe; callers serialize edits and expansions themselves.
 */
public final class SequenceStore {

    private static final Logger log = LoggerFactory.getLogger(SequenceStore.class);

    /** Default maximum depth: levels 0 to 9. */
    public static final int DEFAULT_MAX_DEPTH = 10;

    private final int maxDepth;
    private final List<SequenceNode> nodes = new ArrayList<>();
    private final Map<Integer, SequenceNode> byId = new HashMap<>();
    private int nextId;

    public SequenceStore() {
        this(DEFAULT_MAX_DEPTH);
    }

    /** @param maxDepth number of levels allowed (nodes live at levels {@code 0..maxDepth-1}); must be positive */
    public SequenceStore(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** Adds a node with an empty expression. */
    public NodePosition add(String parameter, SequenceNode parent) {
        return add(parameter, "", parent);
    }

    /**
     * Inserts a new node right after the end of {@code parent}'s subtree, or as the last root when
     * {@code parent} is null.
     *
     * @return the new node and its index among its parent's children
     * @throws DepthLimitExceededException when the node would be at level {@code maxDepth} or deeper
     */
    public NodePosition add(String parameter, String expression, SequenceNode parent) {
        requireField(NodeField.PARAMETER, parameter);
        requireField(NodeField.EXPRESSION, expression);
        int level;
        int insertAt;
        if (parent == null) {
            level = 0;
            insertAt = nodes.size();
        } else {
            int parentPos = position(parent);
            level = parent.getLevel() + 1;
            insertAt = subtreeEnd(parentPos);
        }
        if (level >= maxDepth) {
            throw new DepthLimitExceededException(level, maxDepth);
        }
        SequenceNode node = new SequenceNode(nextId++, level, parent == null ? SequenceNode.NO_PARENT : parent.getId(),
                parameter, expression);
        nodes.add(insertAt, node);
        byId.put(node.getId(), node);
        log.debug("Node added | id={} | level={} | parameter={} | position={}", node.getId(), level, parameter, insertAt);
        return new NodePosition(node, indexAmongSiblings(node));
    }

    /** Direct children of {@code parent} in order; the roots when {@code parent} is null. */
    public List<SequenceNode> children(SequenceNode parent) {
        int start = parent == null ? 0 : position(parent) + 1;
        int level = parent == null ? -1 : parent.getLevel();
        List<SequenceNode> children = new ArrayList<>();
        for (int i = start; i < nodes.size(); i++) {
            SequenceNode n = nodes.get(i);
            if (n.getLevel() <= level) break;
            if (n.getLevel() == level + 1) children.add(n);
        }
        return children;
    }

    /** Child {@code index} of {@code parent} (a root when {@code parent} is null), if it exists. */
    public Optional<SequenceNode> childAt(SequenceNode parent, int index) {
        List<SequenceNode> children = children(parent);
        return index >= 0 && index < children.size() ? Optional.of(children.get(index)) : Optional.empty();
    }

    /** Index of {@code node} among its parent's children, or among the roots. */
    public int indexAmongSiblings(SequenceNode node) {
        position(node);
        return children(byId.get(node.getParentId())).indexOf(node);
    }

    /** The parent of {@code node} with the parent's own sibling index; {@code (null, -1)} for roots. */
    public NodePosition parentOf(SequenceNode node) {
        position(node);
        return positionOf(byId.get(node.getParentId()));
    }

    /**
     * Removes {@code node} and all its descendants, deepest first.
     *
     * @return the former parent with its sibling index, {@code (null, -1)} when a root was removed
     */
    public NodePosition remove(SequenceNode node) {
        position(node);
        for (SequenceNode child : children(node)) {
            remove(child);
        }
        SequenceNode parent = byId.get(node.getParentId());
        nodes.remove(position(node));
        byId.remove(node.getId());
        log.debug("Node removed | id={} | level={} | parameter={}", node.getId(), node.getLevel(), node.getParameter());
        return positionOf(parent);
    }

    /** Changes the parameter or expression of {@code node}; level and position never change. */
    public void setField(SequenceNode node, NodeField field, String value) {
        position(node);
        Objects.requireNonNull(field, "field");
        requireField(field, value);
        node.set(field, value);
    }

    /** Node with {@code id}, if it is still in the store. */
    public Optional<SequenceNode> findById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public SequenceNode get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** All nodes in pre-order. */
    public List<SequenceNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    /** Content snapshot in pre-order; two stores with equal entries describe the same sweep. */
    public List<SequenceEntry> entries() {
        return nodes.stream().map(SequenceNode::toEntry).toList();
    }

    /** Removes every node. Ids are not reused afterwards. */
    public void clear() {
        nodes.clear();
        byId.clear();
    }

    /** Whether {@code node} currently belongs to this store. */
    public boolean contains(SequenceNode node) {
        return node != null && byId.get(node.getId()) == node;
    }

    private NodePosition positionOf(SequenceNode node) {
        return node == null ? NodePosition.NONE : new NodePosition(node, indexAmongSiblings(node));
    }

    /** First list index after the subtree rooted at {@code pos}. */
    private int subtreeEnd(int pos) {
        int level = nodes.get(pos).getLevel();
        int i = pos + 1;
        while (i < nodes.size() && nodes.get(i).getLevel() > level) {
            i++;
        }
        return i;
    }

    private int position(SequenceNode node) {
        Objects.requireNonNull(node, "node");
        if (!contains(node)) {
            throw new IllegalArgumentException("Node is not in this store: " + node);
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) return i;
        }
        throw new IllegalStateException("Node indexed but not listed: " + node);
    }

    /** Rejects text the line format cannot represent. */
    static void requireField(NodeField field, String value) {
        Objects.requireNonNull(value, field.name().toLowerCase());
        if (value.indexOf('"') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(field.name().toLowerCase()
                    + " must not contain a double quote or line break: " + value);
        }
    }
}
