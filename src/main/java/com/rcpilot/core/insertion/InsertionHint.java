package com.rcpilot.core.insertion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Explicit placement for one annotation: a function name or a literal 1-based
 * line number, and whether the annotation goes before or after that point.
 */
public final class InsertionHint {

    public enum Position { BEFORE, AFTER }

    private final String   location;
    private final Position position;

    @JsonCreator
    public InsertionHint(@JsonProperty("location") String location,
                         @JsonProperty("position") Position position) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Hint location must not be blank");
        }
        this.location = location.trim();
        this.position = position != null ? position : Position.BEFORE;
    }

    public static InsertionHint before(String location) {
        return new InsertionHint(location, Position.BEFORE);
    }

    public static InsertionHint after(String location) {
        return new InsertionHint(location, Position.AFTER);
    }

    public String   getLocation() { return location; }
    public Position getPosition() { return position; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InsertionHint)) return false;
        InsertionHint that = (InsertionHint) o;
        return location.equals(that.location) && position == that.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, position);
    }

    @Override
    public String toString() {
        return position.name().toLowerCase() + " " + location;
    }
}
