package work.lcod.distpack.nativeconfig;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import work.lcod.distpack.catalog.BuildMode;
import work.lcod.distpack.setup.SetupLine;
import work.lcod.distpack.setup.SetupLineParser;

/**
 * Reads the runtime's own {@code Modules/Setup} file. A module counts as declared when a line, or
 * its commented-out form, starts with the module name; it is enabled only when the line is live and
 * sits in the static or shared section.
 */
public final class NativeSetupParser {
    private static final Pattern MODULE_LINE = Pattern.compile("^([a-z_][a-z0-9_]*)\\s+\\S.*$");
    private static final Pattern SECTION = Pattern.compile("^\\*(static|shared|disabled)\\*$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*\\s*[:+]?=.*$");

    private NativeSetupParser() {}

    public static NativeSetupFile parse(String content) {
        var declared = new TreeSet<String>();
        var enabled = new TreeMap<String, SetupLine>();
        var sections = new TreeMap<String, BuildMode>();
        var disabled = new TreeSet<String>();
        String section = "static";

        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            var marker = SECTION.matcher(line);
            if (marker.matches()) {
                section = marker.group(1);
                continue;
            }

            String[] parts = line.split("#");
            String live = parts.length == 0 ? "" : parts[0].strip();
            if (!live.isEmpty() && !ASSIGNMENT.matcher(live).matches()) {
                if ("disabled".equals(section)) {
                    for (String word : SetupLineParser.tokenize(live)) {
                        disabled.add(word);
                        declared.add(word);
                    }
                    continue;
                }
                Optional<String> module = moduleName(live);
                if (module.isPresent()) {
                    declared.add(module.get());
                    enabled.put(module.get(), SetupLineParser.parse(live).orElseThrow());
                    sections.put(module.get(), BuildMode.from(section));
                }
                continue;
            }
            for (int i = 1; i < parts.length; i++) {
                String commented = parts[i].strip();
                if (!ASSIGNMENT.matcher(commented).matches()) {
                    moduleName(commented).ifPresent(declared::add);
                }
            }
        }
        return new NativeSetupFile(declared, enabled, sections, disabled);
    }

    private static Optional<String> moduleName(String text) {
        var matcher = MODULE_LINE.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        // Comment prose such as "fcntl is now built" must not count as a declaration.
        boolean namesSources = SetupLineParser.parse(text).map(line -> !line.sources().isEmpty()).orElse(false);
        return namesSources ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Parsed Setup file.
     *
     * @param sections build section of each enabled module
     * @param disabled modules named in the {@code *disabled*} section
     */
    public record NativeSetupFile(
        SortedSet<String> declared,
        SortedMap<String, SetupLine> enabled,
        Map<String, BuildMode> sections,
        SortedSet<String> disabled
    ) {}
}
