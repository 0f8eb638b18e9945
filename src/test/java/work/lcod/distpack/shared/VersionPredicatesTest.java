package work.lcod.distpack.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class VersionPredicatesTest {
    @Test
    void patchLevelDoesNotAffectMinimum() {
        assertTrue(VersionPredicates.meetsMinimum("3.13.1", "3.13"));
    }

    @Test
    void olderMinorFailsMinimum() {
        assertFalse(VersionPredicates.meetsMinimum("3.9.9", "3.13"));
        assertFalse(VersionPredicates.meetsMinimum("3.9.1", "3.13"));
    }

    @Test
    void minorComparesNumerically() {
        assertTrue(VersionPredicates.meetsMinimum("3.10", "3.9"));
        assertTrue(VersionPredicates.meetsMaximum("3.9.5", "3.10"));
        assertFalse(VersionPredicates.meetsMaximum("3.11.0", "3.10"));
    }

    @Test
    void preReleaseSuffixIsIgnored() {
        assertTrue(VersionPredicates.meetsMinimum("3.14.0a3", "3.14"));
        assertEquals("3.14", VersionPredicates.majorMinor("3.14rc1"));
    }

    @Test
    void rejectsMalformedVersions() {
        assertThrows(IllegalArgumentException.class, () -> VersionPredicates.meetsMinimum("3", "3.9"));
        assertThrows(IllegalArgumentException.class, () -> VersionPredicates.meetsMinimum("", "3.9"));
        assertThrows(IllegalArgumentException.class, () -> VersionPredicates.majorMinor("three.nine"));
    }
}
