package work.lcod.distpack.nativeconfig;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Extracts the {@code {"name", init_fn},} entries of the {@code _inittab} table from
 * {@code Modules/config.c.in}.
 */
public final class ConfigCParser {
    private static final Pattern INITTAB_ENTRY = Pattern.compile("\\{\"([^\"]+)\", ([^}]+)},");

    private ConfigCParser() {}

    /**
     * Returns module name -> initializer symbol, in name order.
     */
    public static SortedMap<String, String> parseInittab(String content) {
        var entries = new TreeMap<String, String>();
        boolean inTable = false;
        for (String line : content.split("\\R")) {
            if (line.startsWith("struct _inittab")) {
                inTable = true;
                continue;
            }
            if (!inTable) {
                continue;
            }
            if (line.contains("/* Sentinel */")) {
                break;
            }
            var matcher = INITTAB_ENTRY.matcher(line);
            if (matcher.find()) {
                entries.put(matcher.group(1), matcher.group(2).strip());
            }
        }
        return Collections.unmodifiableSortedMap(entries);
    }
}
