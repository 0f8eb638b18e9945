package work.lcod.distpack.shared;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Independent build flags joined with {@code +} (e.g. {@code pgo+lto}).
 */
public final class BuildOptions {
    public enum Flag {
        DEBUG,
        NOOPT,
        PGO,
        LTO,
        STATIC,
        FREETHREADED;

        public String token() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Set<Flag> flags;

    private BuildOptions(Set<Flag> flags) {
        this.flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags));
    }

    public static BuildOptions of(Flag... flags) {
        var set = EnumSet.noneOf(Flag.class);
        Collections.addAll(set, flags);
        return new BuildOptions(set);
    }

    public static BuildOptions parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Build options must not be empty");
        }
        var set = EnumSet.noneOf(Flag.class);
        for (String token : raw.trim().split("\\+")) {
            try {
                set.add(Flag.valueOf(token.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported build option: " + token);
            }
        }
        return new BuildOptions(set);
    }

    public boolean has(Flag flag) {
        return flags.contains(flag);
    }

    public Set<Flag> flags() {
        return flags;
    }

    @Override
    public String toString() {
        if (flags.isEmpty()) {
            return Flag.NOOPT.token();
        }
        return flags.stream().map(Flag::token).collect(Collectors.joining("+"));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BuildOptions options && options.flags.equals(flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }
}
