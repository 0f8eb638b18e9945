package work.lcod.distpack.nativeconfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import work.lcod.distpack.catalog.BuildMode;
import work.lcod.distpack.setup.SetupLine;

/**
 * Read-only view of the runtime's native extension configuration: the Setup file plus the
 * config.c init table.
 */
public record NativeExtensionIndex(
    SortedSet<String> declared,
    SortedMap<String, SetupLine> enabled,
    Map<String, BuildMode> enabledSections,
    SortedSet<String> disabled,
    SortedMap<String, String> inittab
) {
    public NativeExtensionIndex {
        declared = Collections.unmodifiableSortedSet(new TreeSet<>(declared));
        enabled = Collections.unmodifiableSortedMap(new TreeMap<>(enabled));
        enabledSections = Map.copyOf(enabledSections);
        disabled = Collections.unmodifiableSortedSet(new TreeSet<>(disabled));
        inittab = Collections.unmodifiableSortedMap(new TreeMap<>(inittab));
    }

    public static NativeExtensionIndex parse(String setupContent, String configCContent) {
        var setup = NativeSetupParser.parse(setupContent);
        return new NativeExtensionIndex(
            setup.declared(),
            setup.enabled(),
            setup.sections(),
            setup.disabled(),
            ConfigCParser.parseInittab(configCContent)
        );
    }

    public static NativeExtensionIndex load(Path setupFile, Path configCFile) {
        return parse(read(setupFile), read(configCFile));
    }

    /**
     * Every module the native files mention in either document.
     */
    public SortedSet<String> allModules() {
        var all = new TreeSet<>(declared);
        all.addAll(inittab.keySet());
        return all;
    }

    public boolean isEnabled(String module) {
        return enabled.containsKey(module);
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path, ex);
        }
    }
}
