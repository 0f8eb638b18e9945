package work.lcod.distpack.shared;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TargetPatternsTest {
    @Test
    void requiresFullMatch() {
        assertTrue(TargetPatterns.matchesAny("x86_64-unknown-linux-gnu", List.of(".*-linux-.*")));
        assertFalse(TargetPatterns.matchesAny("x86_64-unknown-linux-gnu", List.of("linux")));
    }

    @Test
    void emptyRestrictionNeverMatches() {
        assertFalse(TargetPatterns.matchesAny("x86_64-unknown-linux-gnu", List.of()));
    }

    @Test
    void missingTargetsApplyEverywhere() {
        assertTrue(TargetPatterns.appliesTo("aarch64-apple-darwin", List.of()));
        assertFalse(TargetPatterns.appliesTo("aarch64-apple-darwin", List.of(".*-linux-.*")));
    }

    @Test
    void rejectsInvalidRegex() {
        assertThrows(IllegalArgumentException.class, () -> TargetPatterns.checkSyntax("x86_64-(linux"));
    }

    @Test
    void tripleClassification() {
        assertTrue(TargetTriple.of("aarch64-apple-darwin").isApple());
        assertTrue(TargetTriple.of("x86_64-unknown-linux-musl").isMusl());
        assertFalse(TargetTriple.of("x86_64-unknown-linux-gnu").isMusl());
        assertThrows(IllegalArgumentException.class, () -> TargetTriple.of("x86_64 linux"));
    }
}
