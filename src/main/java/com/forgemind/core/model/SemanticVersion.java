package com.forgemind.core.model;

import com.forgemind.core.error.ValidationException;

/**
 * {@code MAJOR.MINOR.PATCH} version with natural ordering.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new ValidationException("Version must not be null");
        }
        String[] parts = text.trim().split("\\.");
        if (parts.length != 3) {
            throw new ValidationException("Version must be MAJOR.MINOR.PATCH: " + text);
        }
        try {
            return new SemanticVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new ValidationException("Version must be numeric: " + text);
        }
    }

    public SemanticVersion nextMinor() {
        return new SemanticVersion(major, minor + 1, 0);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
