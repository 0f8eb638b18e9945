package work.lcod.distpack.nativeconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.lcod.distpack.api.DistributionBuildException;

/**
 * The extension catalog and the runtime's native configuration disagree.
 */
public final class DriftException extends DistributionBuildException {
    private final Map<String, SortedSet<String>> problems;

    public DriftException(Map<String, SortedSet<String>> problems) {
        super("metadata_drift", describe(problems));
        this.problems = Collections.unmodifiableMap(new LinkedHashMap<>(problems));
    }

    /**
     * Problem description -> offending module names.
     */
    public Map<String, SortedSet<String>> problems() {
        return problems;
    }

    public Set<String> offendingModules() {
        SortedSet<String> all = new TreeSet<>();
        problems.values().forEach(all::addAll);
        return all;
    }

    private static String describe(Map<String, SortedSet<String>> problems) {
        return problems.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + String.join(", ", entry.getValue()))
            .collect(Collectors.joining("; ", "Extension metadata drift detected: ", ""));
    }
}
