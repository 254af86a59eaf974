package com.neptune.query.api.model;

/**
 * A scalar attribute value of one run.
 */
public final class AttributeValue {

    private final RunAttributeDefinition definition;
    private final Object value;

    public AttributeValue(RunAttributeDefinition definition, Object value) {
        this.definition = definition;
        this.value = value;
    }

    public RunAttributeDefinition getDefinition() {
        return definition;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return definition + "=" + value;
    }
}
