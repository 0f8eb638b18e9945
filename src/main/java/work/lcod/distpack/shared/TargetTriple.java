package work.lcod.distpack.shared;

import java.util.List;
import java.util.Objects;

/**
 * Opaque {@code arch-vendor-os[-abi]} identifier. Platform questions are answered with regex
 * full matches only.
 */
public record TargetTriple(String value) {
    private static final List<String> APPLE = List.of(".*-apple-.*");
    private static final List<String> MUSL = List.of(".*-linux-musl.*");

    public TargetTriple {
        Objects.requireNonNull(value, "value");
        if (value.isBlank() || value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid target triple: '" + value + "'");
        }
    }

    public static TargetTriple of(String value) {
        return new TargetTriple(value);
    }

    public boolean matches(List<String> patterns) {
        return TargetPatterns.matchesAny(value, patterns);
    }

    public boolean isApple() {
        return matches(APPLE);
    }

    public boolean isMusl() {
        return matches(MUSL);
    }

    @Override
    public String toString() {
        return value;
    }
}
