package edu.kit.kastel.vads.syntaxversion.version;

import java.util.Objects;

/// The versions from `low` through `high` inclusive whose grammar accepts a tree.
/// A range with `low == high` produced by a pin means the syntax proves exactly that version.
public record VersionRange(Version low, Version high) {

    public VersionRange {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (low.isAfter(high)) {
            throw new IllegalArgumentException("inverted version range " + low + "-" + high);
        }
    }

    public static VersionRange exactly(Version version) {
        return new VersionRange(version, version);
    }

    public boolean isExact() {
        return this.low.equals(this.high);
    }

    public boolean contains(Version version) {
        return version.isAtLeast(this.low) && this.high.isAtLeast(version);
    }

    @Override
    public String toString() {
        return isExact() ? this.low.toString() : this.low + "-" + this.high;
    }
}
