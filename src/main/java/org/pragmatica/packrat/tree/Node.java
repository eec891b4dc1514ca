package org.pragmatica.packrat.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.packrat.error.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Node of the concrete syntax tree.
 *
 * <p>A node is either a leaf carrying a text span or an interior node carrying an
 * ordered list of children. Nodes whose name starts with a colon are anonymous: they
 * carry no grammar-level name and may be flattened into their parent.
 *
 * <p>Concatenating the text of all leaves in depth-first order reproduces exactly the
 * part of the document the node covers.
 */
public final class Node {
    public static final String ZOMBIE_TAG = "ZOMBIE__";
    public static final String EMPTY_TAG = ":EMPTY";

    /**
     * Shared result of disposable parsers that matched nothing or dropped their content.
     * It never receives a position and must never end up in a returned tree.
     */
    public static final Node EMPTY = new Node(EMPTY_TAG, "");

    private String name;
    private String text;
    private List<Node> children;
    private int length = -1;
    private int pos = -1;
    private List<Diagnostic> errors = List.of();

    private Node(String name, String text) {
        this.name = name;
        this.text = text;
        this.children = List.of();
    }

    private Node(String name, List<Node> children) {
        this.name = name;
        this.text = null;
        this.children = ImmutableList.copyOf(children);
    }

    public static Node leaf(String name, String text) {
        return new Node(name, text);
    }

    public static Node branch(String name, List<Node> children) {
        if (children.isEmpty()) {
            return new Node(name, "");
        }
        return new Node(name, children);
    }

    public static Node branch(String name, Node... children) {
        return branch(name, List.of(children));
    }

    /**
     * Creates a node with the same result and diagnostics as {@code template}, i.e. its
     * children or its text, under a different name.
     */
    public static Node renamed(String name, Node template) {
        var node = template.isLeaf()
                   ? new Node(name, template.text)
                   : new Node(name, template.children);
        if (!template.errors.isEmpty()) {
            node.errors = new ArrayList<>(template.errors);
        }
        return node;
    }

    public static Node zombie(String text) {
        return new Node(ZOMBIE_TAG, text);
    }

    // === Structure ===

    public String name() {
        return name;
    }

    public boolean isAnonymous() {
        return !name.isEmpty() && name.charAt(0) == ':';
    }

    public boolean isZombie() {
        return ZOMBIE_TAG.equals(name);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public List<Node> children() {
        return children;
    }

    /**
     * Leaf text, or the empty string for interior nodes.
     */
    public String text() {
        return text == null ? "" : text;
    }

    /**
     * True if the node has children or non-empty text.
     */
    public boolean hasResult() {
        return !children.isEmpty() || !text.isEmpty();
    }

    /**
     * Replaces the result of this node by a text. Only used while a node is still
     * under construction by the parser that created it.
     */
    public void setText(String newText) {
        checkMutable();
        this.text = newText;
        this.children = List.of();
        this.length = -1;
    }

    /**
     * Replaces the result of this node by a list of children. Only used while a node is
     * still under construction by the parser that created it.
     */
    public void setChildren(List<Node> newChildren) {
        checkMutable();
        if (newChildren.isEmpty()) {
            setText("");
            return;
        }
        this.text = null;
        this.children = ImmutableList.copyOf(newChildren);
        this.length = -1;
    }

    private void checkMutable() {
        if (this == EMPTY) {
            throw new IllegalStateException("The shared empty node must not be modified");
        }
    }

    public Optional<Node> pick(String childName) {
        for (var child : children) {
            if (child.name.equals(childName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    // === Content ===

    /**
     * Number of characters this node covers. Computed lazily and cached.
     */
    public int length() {
        if (length < 0) {
            if (children.isEmpty()) {
                length = text.length();
            } else {
                int sum = 0;
                for (var child : children) {
                    sum += child.length();
                }
                length = sum;
            }
        }
        return length;
    }

    /**
     * Concatenated text of all leaves.
     */
    public String content() {
        if (children.isEmpty()) {
            return text;
        }
        var sb = new StringBuilder(length());
        collectContent(sb);
        return sb.toString();
    }

    private void collectContent(StringBuilder sb) {
        if (children.isEmpty()) {
            sb.append(text);
        } else {
            for (var child : children) {
                child.collectContent(sb);
            }
        }
    }

    // === Position ===

    public int pos() {
        return pos;
    }

    public boolean hasPos() {
        return pos >= 0;
    }

    /**
     * Assigns the document position once. Children without a position receive
     * positions derived from their predecessors, also when this node's position
     * has been assigned before.
     *
     * @throws IllegalStateException if a different position has already been assigned
     */
    public Node withPos(int position) {
        checkArgument(position >= 0, "Negative position %s", position);
        if (this == EMPTY) {
            return this;
        }
        if (pos >= 0 && pos != position) {
            throw new IllegalStateException("Position " + pos + " of node " + name
                                            + " cannot be reassigned to " + position);
        }
        pos = position;
        int offset = position;
        for (var child : children) {
            if (child.pos < 0) {
                child.withPos(offset);
            } else {
                offset = child.pos;
            }
            offset += child.length();
        }
        return this;
    }

    /**
     * Assigns the position unless one has already been assigned.
     */
    public Node ensurePos(int position) {
        if (this != EMPTY && pos < 0) {
            withPos(position);
        }
        return this;
    }

    // === Diagnostics ===

    public List<Diagnostic> errors() {
        return errors;
    }

    public void addError(Diagnostic diagnostic) {
        checkMutable();
        if (errors.isEmpty()) {
            errors = new ArrayList<>(2);
        }
        errors.add(diagnostic);
    }

    // === Traversal ===

    /**
     * Depth-first pre-order list of this node and all descendants.
     */
    public List<Node> descendants() {
        var result = new ArrayList<Node>();
        collectDescendants(result);
        return result;
    }

    private void collectDescendants(List<Node> result) {
        result.add(this);
        for (var child : children) {
            child.collectDescendants(result);
        }
    }

    /**
     * Compact S-expression, e.g. {@code (number (:RegExp "3") (fraction ".14"))}.
     */
    public String asSxpr() {
        var sb = new StringBuilder();
        appendSxpr(sb);
        return sb.toString();
    }

    private void appendSxpr(StringBuilder sb) {
        sb.append('(').append(name);
        if (children.isEmpty()) {
            sb.append(" \"").append(escape(text)).append('"');
        } else {
            for (var child : children) {
                sb.append(' ');
                child.appendSxpr(sb);
            }
        }
        sb.append(')');
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public String toString() {
        return content();
    }
}
