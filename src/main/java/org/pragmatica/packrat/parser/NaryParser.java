package org.pragmatica.packrat.parser;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Combining parser with one or more children.
 */
public abstract class NaryParser extends CombinedParser {
    protected final List<Parser> parsers;

    protected NaryParser(List<Parser> parsers) {
        checkArgument(!parsers.isEmpty(), "Cannot initialize %s with zero parsers", getClass().getSimpleName());
        this.parsers = ImmutableList.copyOf(parsers);
    }

    public List<Parser> parsers() {
        return parsers;
    }

    @Override
    public List<Parser> subParsers() {
        return parsers;
    }

    @Override
    protected Object signatureKey() {
        var key = new ArrayList<Object>(parsers.size() + 2);
        key.add(getClass().getSimpleName());
        key.add(reduction());
        for (var p : parsers) {
            key.add(p.signature());
        }
        return key;
    }
}
