package work.lcod.distpack.catalog;

import java.util.List;

/**
 * The directive-level part of a catalog entry: what goes onto one Setup line.
 * Shared by the entry itself and by each of its variants.
 */
public record BuildRecipe(
    List<String> sources,
    List<ConditionalEntry> sourcesConditional,
    List<String> defines,
    List<ConditionalEntry> definesConditional,
    List<String> includes,
    List<ConditionalEntry> includesConditional,
    List<String> includesDeps,
    List<String> links,
    List<ConditionalEntry> linksConditional,
    List<ConditionalEntry> linkerArgs,
    List<String> frameworks
) {
    public BuildRecipe {
        sources = List.copyOf(sources);
        sourcesConditional = List.copyOf(sourcesConditional);
        defines = List.copyOf(defines);
        definesConditional = List.copyOf(definesConditional);
        includes = List.copyOf(includes);
        includesConditional = List.copyOf(includesConditional);
        includesDeps = List.copyOf(includesDeps);
        links = List.copyOf(links);
        linksConditional = List.copyOf(linksConditional);
        linkerArgs = List.copyOf(linkerArgs);
        frameworks = List.copyOf(frameworks);
    }

    public static BuildRecipe empty() {
        return new BuildRecipe(
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of(), List.of()
        );
    }

    public boolean declaresSources() {
        return !sources.isEmpty() || !sourcesConditional.isEmpty();
    }
}
