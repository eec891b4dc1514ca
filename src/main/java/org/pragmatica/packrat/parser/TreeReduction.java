package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Policy by which a combining parser builds its node from the results of its children.
 *
 * <pre>
 * NO_TREE_REDUCTION  (root (:Series (:Text "A") (:Text "B")))
 * FLATTEN            (root (:Text "A") (:Text "B"))
 * MERGE_TREETOPS     (root "AB")
 * MERGE_LEAVES       (root (:Text "AB") (important "C"))
 * </pre>
 */
public enum TreeReduction {
    /**
     * Children are wrapped verbatim.
     */
    NO_TREE_REDUCTION,
    /**
     * Anonymous children are replaced by their own children, anonymous empty children are dropped.
     */
    FLATTEN,
    /**
     * Like {@link #FLATTEN}; a result consisting of anonymous leaves only is merged into one leaf.
     */
    MERGE_TREETOPS,
    /**
     * Like {@link #FLATTEN}; adjacent anonymous leaves are merged.
     */
    MERGE_LEAVES;

    public static final TreeReduction DEFAULT = FLATTEN;

    /**
     * Sets this policy on every combining parser reachable from {@code root}.
     */
    public <P extends Parser> P applyTo(P root) {
        root.apply(context -> {
            if (context.get(context.size() - 1) instanceof CombinedParser combined) {
                combined.setReduction(this);
            }
            return false;
        });
        return root;
    }

    /**
     * Node for a single child result, {@code null} if the child did not produce one.
     */
    Node single(CombinedParser parser, Node node) {
        if (this == NO_TREE_REDUCTION) {
            if (parser.dropsContent()) {
                return Node.EMPTY;
            }
            return node == null || node == Node.EMPTY
                   ? Node.leaf(parser.nodeName(), "")
                   : Node.branch(parser.nodeName(), node);
        }
        if (node != null) {
            if (parser.isDisposable()) {
                return parser.dropsContent() ? Node.EMPTY : node;
            }
            if (node.isAnonymous()) {
                return Node.renamed(parser.nodeName(), node);
            }
            return Node.branch(parser.nodeName(), node);
        }
        return emptyResult(parser);
    }

    /**
     * Node for the results of several children in document order.
     */
    Node many(CombinedParser parser, List<Node> results) {
        if (parser.dropsContent()) {
            return Node.EMPTY;
        }
        if (this == NO_TREE_REDUCTION) {
            var children = new ArrayList<Node>(results.size());
            for (var child : results) {
                if (child != Node.EMPTY) {
                    children.add(child);
                }
            }
            return Node.branch(parser.nodeName(), children);
        }
        if (results.size() == 1) {
            return single(parser, results.get(0));
        }
        if (results.isEmpty()) {
            return emptyResult(parser);
        }
        return switch (this) {
            case MERGE_TREETOPS -> mergeTreetops(parser, results);
            case MERGE_LEAVES -> mergeLeaves(parser, results);
            default -> flatten(parser, results);
        };
    }

    private static Node flatten(CombinedParser parser, List<Node> results) {
        var nr = new ArrayList<Node>(results.size());
        for (var child : results) {
            boolean anonymous = child.isAnonymous();
            if (!child.isLeaf() && anonymous) {
                nr.addAll(child.children());
            } else if (child.hasResult() || !anonymous) {
                nr.add(child);
            }
        }
        if (!nr.isEmpty() || !parser.isDisposable()) {
            return Node.branch(parser.nodeName(), nr);
        }
        return Node.EMPTY;
    }

    private static Node mergeTreetops(CombinedParser parser, List<Node> results) {
        var nr = new ArrayList<Node>(results.size());
        boolean merge = true;
        for (var child : results) {
            if (child.isAnonymous()) {
                if (!child.isLeaf()) {
                    nr.addAll(child.children());
                    for (var grandchild : child.children()) {
                        if (!grandchild.isLeaf() || !grandchild.isAnonymous()) {
                            merge = false;
                            break;
                        }
                    }
                } else if (child.hasResult()) {
                    nr.add(child);
                }
            } else {
                nr.add(child);
                merge = false;
            }
        }
        if (nr.isEmpty()) {
            return emptyResult(parser);
        }
        if (merge) {
            var sb = new StringBuilder();
            for (var node : nr) {
                sb.append(node.text());
            }
            if (sb.length() > 0 || !parser.isDisposable()) {
                return Node.leaf(parser.nodeName(), sb.toString());
            }
            return Node.EMPTY;
        }
        return Node.branch(parser.nodeName(), nr);
    }

    private static Node mergeLeaves(CombinedParser parser, List<Node> results) {
        var nr = new ArrayList<Node>(results.size());
        for (var child : results) {
            if (child.isAnonymous()) {
                if (!child.isLeaf()) {
                    nr.addAll(child.children());
                } else if (child.hasResult()) {
                    nr.add(child);
                }
            } else {
                nr.add(child);
            }
        }
        if (nr.isEmpty()) {
            return emptyResult(parser);
        }
        var merged = new ArrayList<Node>(nr.size());
        boolean tailIsAnonymousLeaf = false;
        for (var node : nr) {
            boolean headIsAnonymousLeaf = node.isLeaf() && node.isAnonymous();
            if (tailIsAnonymousLeaf && headIsAnonymousLeaf) {
                var last = merged.remove(merged.size() - 1);
                var joined = Node.leaf(last.name(), last.text() + node.text());
                last.errors().forEach(joined::addError);
                node.errors().forEach(joined::addError);
                merged.add(joined);
            } else {
                merged.add(node);
            }
            tailIsAnonymousLeaf = headIsAnonymousLeaf;
        }
        if (merged.size() > 1) {
            return Node.branch(parser.nodeName(), merged);
        }
        if (tailIsAnonymousLeaf) {
            var text = merged.get(0).text();
            if (!text.isEmpty() || !parser.isDisposable()) {
                return Node.leaf(parser.nodeName(), text);
            }
            return Node.EMPTY;
        }
        return Node.branch(parser.nodeName(), merged.get(0));
    }

    private static Node emptyResult(CombinedParser parser) {
        return parser.isDisposable() ? Node.EMPTY : Node.leaf(parser.nodeName(), "");
    }
}
