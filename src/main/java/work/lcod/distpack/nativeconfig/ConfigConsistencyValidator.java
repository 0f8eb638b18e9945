package work.lcod.distpack.nativeconfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.catalog.ExtensionCatalog;
import work.lcod.distpack.catalog.ExtensionModuleSpec;
import work.lcod.distpack.shared.TargetTriple;

/**
 * Cross-checks the extension catalog against the runtime's native Setup file and init table.
 * Runs before synthesis; any disagreement is fatal.
 */
public final class ConfigConsistencyValidator {
    static final String MISSING_FROM_CATALOG = "declared by the runtime but missing from the catalog";
    static final String NOT_ENABLED_NATIVELY = "flagged setup-enabled but not enabled in Setup";
    static final String NOT_FLAGGED_SETUP_ENABLED = "enabled in Setup but not flagged setup-enabled";
    static final String MISSING_FROM_INITTAB = "flagged config-c-only but absent from config.c";
    static final String NOT_FLAGGED_CONFIG_C_ONLY = "present in config.c but not flagged config-c-only";

    private final BuildLog log;

    public ConfigConsistencyValidator(BuildLog log) {
        this.log = log.stage(ConfigConsistencyValidator.class);
    }

    public void validate(ExtensionCatalog catalog, NativeExtensionIndex nativeIndex, TargetTriple target, String runtimeVersion) {
        Set<String> known = catalog.names();
        var problems = new LinkedHashMap<String, SortedSet<String>>();

        var missing = new TreeSet<>(nativeIndex.allModules());
        missing.removeAll(known);
        record(problems, MISSING_FROM_CATALOG, missing);

        var wantEnabled = new TreeSet<String>();
        var wantConfigC = new TreeSet<String>();
        for (ExtensionModuleSpec spec : catalog.specs()) {
            if (!spec.supportsVersion(runtimeVersion)) {
                continue;
            }
            if (spec.setupEnabledFor(target.value(), runtimeVersion)) {
                wantEnabled.add(spec.name());
            }
            if (spec.configCOnly()) {
                wantConfigC.add(spec.name());
            }
        }

        var haveEnabled = new TreeSet<>(nativeIndex.enabled().keySet());
        haveEnabled.retainAll(known);
        record(problems, NOT_ENABLED_NATIVELY, difference(wantEnabled, haveEnabled));
        record(problems, NOT_FLAGGED_SETUP_ENABLED, difference(haveEnabled, wantEnabled));

        var haveConfigC = new TreeSet<>(nativeIndex.inittab().keySet());
        haveConfigC.retainAll(known);
        record(problems, MISSING_FROM_INITTAB, difference(wantConfigC, haveConfigC));
        record(problems, NOT_FLAGGED_CONFIG_C_ONLY, difference(haveConfigC, wantConfigC));

        if (!problems.isEmpty()) {
            throw new DriftException(problems);
        }
        log.info("extension catalog agrees with native configuration ({} native modules)", nativeIndex.allModules().size());
    }

    private static SortedSet<String> difference(Set<String> left, Set<String> right) {
        var result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }

    private void record(Map<String, SortedSet<String>> problems, String description, SortedSet<String> modules) {
        if (modules.isEmpty()) {
            return;
        }
        log.warn("{}: {}", description, String.join(", ", modules));
        problems.put(description, modules);
    }
}
