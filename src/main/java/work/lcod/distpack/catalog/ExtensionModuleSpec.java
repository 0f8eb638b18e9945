package work.lcod.distpack.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.distpack.shared.TargetPatterns;
import work.lcod.distpack.shared.VersionPredicates;

/**
 * One validated catalog entry. Immutable once loaded.
 */
public record ExtensionModuleSpec(
    String name,
    BuildRecipe recipe,
    Map<String, BuildRecipe> variants,
    BuildMode buildMode,
    boolean setupEnabled,
    List<ConditionalEntry> setupEnabledConditional,
    boolean configCOnly,
    Optional<String> minimumVersion,
    Optional<String> maximumVersion,
    List<String> disabledTargets,
    List<String> requiredTargets
) {
    public static final String DEFAULT_VARIANT = "default";

    public ExtensionModuleSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(recipe, "recipe");
        Objects.requireNonNull(buildMode, "buildMode");
        Objects.requireNonNull(minimumVersion, "minimumVersion");
        Objects.requireNonNull(maximumVersion, "maximumVersion");
        variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
        setupEnabledConditional = List.copyOf(setupEnabledConditional);
        disabledTargets = List.copyOf(disabledTargets);
        requiredTargets = List.copyOf(requiredTargets);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean supportsVersion(String runtimeVersion) {
        if (minimumVersion.isPresent() && !VersionPredicates.meetsMinimum(runtimeVersion, minimumVersion.get())) {
            return false;
        }
        return maximumVersion.isEmpty() || VersionPredicates.meetsMaximum(runtimeVersion, maximumVersion.get());
    }

    public boolean disabledOn(String targetTriple) {
        return TargetPatterns.matchesAny(targetTriple, disabledTargets);
    }

    public boolean requiredOn(String targetTriple) {
        return TargetPatterns.matchesAny(targetTriple, requiredTargets);
    }

    /**
     * Whether the runtime's own Setup file is expected to enable this module for the given version.
     */
    public boolean setupEnabledFor(String targetTriple, String runtimeVersion) {
        if (setupEnabled) {
            return true;
        }
        return setupEnabledConditional.stream().anyMatch(entry -> entry.applies(targetTriple, runtimeVersion));
    }

    /**
     * Recipes in synthesis order, keyed by variant tag. The first one is the primary build.
     */
    public Map<String, BuildRecipe> buildsInOrder() {
        Map<String, BuildRecipe> ordered = new LinkedHashMap<>();
        if (recipe.declaresSources()) {
            ordered.put(DEFAULT_VARIANT, recipe);
        }
        ordered.putAll(variants);
        return ordered;
    }

    public static final class Builder {
        private final String name;
        private BuildRecipe recipe = BuildRecipe.empty();
        private final Map<String, BuildRecipe> variants = new LinkedHashMap<>();
        private BuildMode buildMode = BuildMode.STATIC;
        private boolean setupEnabled;
        private List<ConditionalEntry> setupEnabledConditional = List.of();
        private boolean configCOnly;
        private Optional<String> minimumVersion = Optional.empty();
        private Optional<String> maximumVersion = Optional.empty();
        private List<String> disabledTargets = List.of();
        private List<String> requiredTargets = List.of();

        private Builder(String name) {
            this.name = name;
        }

        public Builder recipe(BuildRecipe recipe) {
            this.recipe = recipe;
            return this;
        }

        public Builder variant(String tag, BuildRecipe variant) {
            this.variants.put(tag, variant);
            return this;
        }

        public Builder buildMode(BuildMode buildMode) {
            this.buildMode = buildMode;
            return this;
        }

        public Builder setupEnabled(boolean setupEnabled) {
            this.setupEnabled = setupEnabled;
            return this;
        }

        public Builder setupEnabledConditional(List<ConditionalEntry> setupEnabledConditional) {
            this.setupEnabledConditional = setupEnabledConditional;
            return this;
        }

        public Builder configCOnly(boolean configCOnly) {
            this.configCOnly = configCOnly;
            return this;
        }

        public Builder minimumVersion(String minimumVersion) {
            this.minimumVersion = Optional.ofNullable(minimumVersion);
            return this;
        }

        public Builder maximumVersion(String maximumVersion) {
            this.maximumVersion = Optional.ofNullable(maximumVersion);
            return this;
        }

        public Builder disabledTargets(List<String> disabledTargets) {
            this.disabledTargets = disabledTargets;
            return this;
        }

        public Builder requiredTargets(List<String> requiredTargets) {
            this.requiredTargets = requiredTargets;
            return this;
        }

        public ExtensionModuleSpec build() {
            return new ExtensionModuleSpec(
                name,
                recipe,
                variants,
                buildMode,
                setupEnabled,
                setupEnabledConditional,
                configCOnly,
                minimumVersion,
                maximumVersion,
                disabledTargets,
                requiredTargets
            );
        }
    }
}
