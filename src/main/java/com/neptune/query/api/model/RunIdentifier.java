package com.neptune.query.api.model;

import java.util.Objects;

/**
 * Composite key naming one tracked run: the project it lives in plus its system id.
 */
public final class RunIdentifier implements SizeEstimable, Comparable<RunIdentifier> {

    /** Sys ids are short opaque keys; every id is budgeted at the same size. */
    public static final int ESTIMATED_SIZE_BYTES = 50;

    private final String projectIdentifier;
    private final String sysId;

    public RunIdentifier(String projectIdentifier, String sysId) {
        this.projectIdentifier = Objects.requireNonNull(projectIdentifier, "projectIdentifier");
        this.sysId = Objects.requireNonNull(sysId, "sysId");
    }

    public String getProjectIdentifier() {
        return projectIdentifier;
    }

    public String getSysId() {
        return sysId;
    }

    @Override
    public int estimatedSizeBytes() {
        return ESTIMATED_SIZE_BYTES;
    }

    @Override
    public int compareTo(RunIdentifier other) {
        int byProject = projectIdentifier.compareTo(other.projectIdentifier);
        return byProject != 0 ? byProject : sysId.compareTo(other.sysId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunIdentifier)) {
            return false;
        }
        RunIdentifier that = (RunIdentifier) o;
        return projectIdentifier.equals(that.projectIdentifier) && sysId.equals(that.sysId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectIdentifier, sysId);
    }

    @Override
    public String toString() {
        return projectIdentifier + "/" + sysId;
    }
}
