package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.List;

/**
 * Base class of parsers that call other parsers and combine their results.
 */
public abstract class CombinedParser extends Parser {
    private TreeReduction reduction = TreeReduction.DEFAULT;

    public TreeReduction reduction() {
        return reduction;
    }

    void setReduction(TreeReduction reduction) {
        this.reduction = reduction;
    }

    /**
     * Node for the result of a single child, which may be {@code null} for no result.
     */
    protected Node returnValue(Node node) {
        return reduction.single(this, node);
    }

    protected Node returnValues(List<Node> results) {
        return reduction.many(this, results);
    }

    /**
     * Name, type and position in the grammar, for error reports.
     */
    public String locationInfo(String symbol) {
        return (name().isEmpty() ? "_" : name()) + ptype() + " in definition of \"" + symbol + "\" as " + this;
    }
}
