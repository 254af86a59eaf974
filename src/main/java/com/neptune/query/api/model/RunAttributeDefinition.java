package com.neptune.query.api.model;

import java.util.Objects;

/**
 * The atomic unit of work: one attribute of one run. Used as a map key throughout.
 */
public final class RunAttributeDefinition implements SizeEstimable, Comparable<RunAttributeDefinition> {

    private final RunIdentifier runIdentifier;
    private final AttributeDefinition attributeDefinition;

    public RunAttributeDefinition(RunIdentifier runIdentifier, AttributeDefinition attributeDefinition) {
        this.runIdentifier = Objects.requireNonNull(runIdentifier, "runIdentifier");
        this.attributeDefinition = Objects.requireNonNull(attributeDefinition, "attributeDefinition");
    }

    public RunIdentifier getRunIdentifier() {
        return runIdentifier;
    }

    public AttributeDefinition getAttributeDefinition() {
        return attributeDefinition;
    }

    /**
     * Series requests address runs by a request id outside the size budget, so only the
     * attribute path counts.
     */
    @Override
    public int estimatedSizeBytes() {
        return attributeDefinition.estimatedSizeBytes();
    }

    @Override
    public int compareTo(RunAttributeDefinition other) {
        int byRun = runIdentifier.compareTo(other.runIdentifier);
        return byRun != 0 ? byRun : attributeDefinition.compareTo(other.attributeDefinition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunAttributeDefinition)) {
            return false;
        }
        RunAttributeDefinition that = (RunAttributeDefinition) o;
        return runIdentifier.equals(that.runIdentifier) && attributeDefinition.equals(that.attributeDefinition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runIdentifier, attributeDefinition);
    }

    @Override
    public String toString() {
        return runIdentifier + "#" + attributeDefinition;
    }
}
