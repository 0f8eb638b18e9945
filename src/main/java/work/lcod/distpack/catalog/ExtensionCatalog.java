package work.lcod.distpack.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validated extension catalog, ordered by module name.
 */
public final class ExtensionCatalog {
    private final SortedMap<String, ExtensionModuleSpec> specs;

    public ExtensionCatalog(Collection<ExtensionModuleSpec> specs) {
        var byName = new TreeMap<String, ExtensionModuleSpec>();
        for (var spec : specs) {
            if (byName.put(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + spec.name());
            }
        }
        this.specs = Collections.unmodifiableSortedMap(byName);
    }

    public Optional<ExtensionModuleSpec> find(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public boolean contains(String name) {
        return specs.containsKey(name);
    }

    public Collection<ExtensionModuleSpec> specs() {
        return specs.values();
    }

    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(specs.keySet()));
    }

    public int size() {
        return specs.size();
    }
}
