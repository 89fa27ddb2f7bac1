package com.sheetdoc.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dependency edges of one cell, both lists sorted.
 */
public class DependencyRecord {

    private final List<String> dependsOn;
    private final List<String> dependents;

    public DependencyRecord(List<String> dependsOn, List<String> dependents) {
        this.dependsOn = Collections.unmodifiableList(dependsOn);
        this.dependents = Collections.unmodifiableList(dependents);
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public List<String> getDependents() {
        return dependents;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return dependsOn.isEmpty() && dependents.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DependencyRecord)) {
            return false;
        }
        DependencyRecord that = (DependencyRecord) o;
        return dependsOn.equals(that.dependsOn) && dependents.equals(that.dependents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dependsOn, dependents);
    }
}
