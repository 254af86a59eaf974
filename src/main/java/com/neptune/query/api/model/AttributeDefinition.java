package com.neptune.query.api.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Name and value kind of an attribute. Two definitions are equal when both fields match.
 */
public final class AttributeDefinition implements SizeEstimable, Comparable<AttributeDefinition> {

    private final String name;
    private final AttributeType type;

    public AttributeDefinition(String name, AttributeType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public AttributeType getType() {
        return type;
    }

    @Override
    public int estimatedSizeBytes() {
        return name.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public int compareTo(AttributeDefinition other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : type.compareTo(other.type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeDefinition)) {
            return false;
        }
        AttributeDefinition that = (AttributeDefinition) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getWireName();
    }
}
