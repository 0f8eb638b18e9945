package work.lcod.distpack.catalog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.distpack.shared.TargetPatterns;
import work.lcod.distpack.shared.VersionPredicates;

/**
 * A catalog value gated by target patterns and/or a runtime version range. All present
 * conditions must hold for the entry to apply.
 */
public record ConditionalEntry(
    List<String> values,
    List<String> targets,
    Optional<String> minimumVersion,
    Optional<String> maximumVersion
) {
    public ConditionalEntry {
        values = List.copyOf(values);
        targets = List.copyOf(targets);
        Objects.requireNonNull(minimumVersion, "minimumVersion");
        Objects.requireNonNull(maximumVersion, "maximumVersion");
    }

    public static ConditionalEntry of(String value, List<String> targets) {
        return new ConditionalEntry(List.of(value), targets, Optional.empty(), Optional.empty());
    }

    /**
     * The single value of a source/define/include/link entry.
     */
    public String value() {
        if (values.isEmpty()) {
            throw new IllegalStateException("Conditional entry carries no value");
        }
        return values.get(0);
    }

    public boolean applies(String targetTriple, String runtimeVersion) {
        if (!TargetPatterns.appliesTo(targetTriple, targets)) {
            return false;
        }
        if (minimumVersion.isPresent() && !VersionPredicates.meetsMinimum(runtimeVersion, minimumVersion.get())) {
            return false;
        }
        return maximumVersion.isEmpty() || VersionPredicates.meetsMaximum(runtimeVersion, maximumVersion.get());
    }
}
