package com.neptune.query.api.split;

import java.util.List;
import java.util.Objects;

import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;

/**
 * One cell of a runs x attributes grid split: every run in {@code runs} paired with every
 * attribute in {@code attributes}. Both lists are views over the caller's input.
 */
public final class RunAttributeBatch {

    private final List<RunIdentifier> runs;
    private final List<AttributeDefinition> attributes;

    public RunAttributeBatch(List<RunIdentifier> runs, List<AttributeDefinition> attributes) {
        this.runs = runs;
        this.attributes = attributes;
    }

    public List<RunIdentifier> getRuns() {
        return runs;
    }

    public List<AttributeDefinition> getAttributes() {
        return attributes;
    }

    /** Number of run/attribute pairs covered by this cell. */
    public int size() {
        return runs.size() * attributes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunAttributeBatch)) {
            return false;
        }
        RunAttributeBatch that = (RunAttributeBatch) o;
        return runs.equals(that.runs) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runs, attributes);
    }

    @Override
    public String toString() {
        return "(" + runs.size() + " runs x " + attributes.size() + " attributes)";
    }
}
