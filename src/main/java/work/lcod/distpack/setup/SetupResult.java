package work.lcod.distpack.setup;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.lcod.distpack.shared.AtomicFiles;

/**
 * Everything the native build front-end consumes from synthesis.
 *
 * @param setupLocal content of {@code Modules/Setup.local}
 * @param makeData Makefile supplement (per-object cflags and variant rules)
 * @param sidecars sidecar file name -> original directive text, one per non-primary variant
 * @param disabled modules listed in the {@code *disabled*} section
 * @param ignored modules skipped because the runtime version is outside their range
 */
public record SetupResult(
    List<SetupDirective> directives,
    String setupLocal,
    String makeData,
    SortedMap<String, String> sidecars,
    SortedSet<String> disabled,
    SortedSet<String> ignored
) {
    public static final String SETUP_LOCAL = "Setup.local";
    public static final String MAKE_DATA = "Makefile.extra";

    public SetupResult {
        directives = List.copyOf(directives);
        sidecars = Collections.unmodifiableSortedMap(new TreeMap<>(sidecars));
        disabled = Collections.unmodifiableSortedSet(new TreeSet<>(disabled));
        ignored = Collections.unmodifiableSortedSet(new TreeSet<>(ignored));
    }

    public List<SetupDirective> primaryDirectives() {
        return directives.stream().filter(SetupDirective::isPrimary).collect(Collectors.toList());
    }

    /**
     * Publishes Setup.local, the make supplement and every sidecar into {@code directory}.
     */
    public void writeTo(Path directory) {
        AtomicFiles.writeString(directory.resolve(SETUP_LOCAL), setupLocal);
        AtomicFiles.writeString(directory.resolve(MAKE_DATA), makeData);
        sidecars.forEach((name, text) -> AtomicFiles.writeString(directory.resolve(name), text + "\n"));
    }
}
