package edu.kit.kastel.vads.syntaxversion.version;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionRangeTest {

    private final VersionRange range = new VersionRange(Version.of(3, 6), Version.of(3, 11));

    @Test
    void whenCreating_givenInvertedBounds_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
            () -> new VersionRange(Version.of(3, 12), Version.of(3, 11)));
    }

    @Test
    void whenCreating_givenNullBound_shouldThrowException() {
        assertThrows(NullPointerException.class, () -> new VersionRange(null, Version.of(3, 11)));
    }

    @Test
    void whenCheckingContains_givenBounds_shouldBeInclusive() {
        assertTrue(range.contains(Version.of(3, 6)));
        assertTrue(range.contains(Version.of(3, 8)));
        assertTrue(range.contains(Version.of(3, 11)));
    }

    @Test
    void whenCheckingContains_givenOutsideVersion_shouldReturnFalse() {
        assertFalse(range.contains(Version.of(3, 5)));
        assertFalse(range.contains(Version.of(3, 12)));
    }

    @Test
    void whenCheckingExact_givenSingleVersion_shouldReturnTrue() {
        assertTrue(VersionRange.exactly(Version.of(3, 12)).isExact());
        assertFalse(range.isExact());
    }

    @Test
    void whenFormatting_shouldCollapseExactRange() {
        assertEquals("3.6-3.11", range.toString());
        assertEquals("2.7", VersionRange.exactly(Version.of(2, 7)).toString());
    }
}
