package edu.kit.kastel.vads.syntaxversion.version;

import java.util.Comparator;

/// A grammar revision, identified by its major and minor number.
public record Version(int major, int minor) implements Comparable<Version> {

    private static final Comparator<Version> ORDER =
        Comparator.comparingInt(Version::major).thenComparingInt(Version::minor);

    public Version {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("version components must not be negative: " + major + "." + minor);
        }
    }

    public static Version of(int major, int minor) {
        return new Version(major, minor);
    }

    /// Parses `major.minor`. Further components such as a micro number (`3.12.4`) are ignored.
    public static Version parse(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length < 2) {
            throw new IllegalArgumentException("expected a version of the form major.minor but got '" + text + "'");
        }
        try {
            return new Version(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected a version of the form major.minor but got '" + text + "'", e);
        }
    }

    public static Version max(Version a, Version b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    public boolean isAfter(Version other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return this.major + "." + this.minor;
    }
}
