package work.lcod.distpack.setup;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structured view of one Setup directive: {@code name file.c [...] [-Ipath] [-Dflag] [-lname] [-framework Name]}.
 */
public record SetupLine(
    String module,
    List<String> sources,
    List<String> defines,
    List<String> includes,
    List<LinkToken> links,
    List<String> frameworks,
    List<String> otherArgs
) {
    public SetupLine {
        Objects.requireNonNull(module, "module");
        sources = List.copyOf(sources);
        defines = List.copyOf(defines);
        includes = List.copyOf(includes);
        links = List.copyOf(links);
        frameworks = List.copyOf(frameworks);
        otherArgs = List.copyOf(otherArgs);
    }

    public static SetupLine empty(String module) {
        return new SetupLine(module, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public Set<String> sourceSet() {
        return new LinkedHashSet<>(sources);
    }

    public Set<String> defineSet() {
        return new LinkedHashSet<>(defines);
    }

    public Set<String> linkNames() {
        return links.stream().map(LinkToken::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Object files the native build produces for this line's sources, relative to the build root.
     */
    public List<String> objectPaths() {
        return sources.stream().map(SetupLine::objectPathFor).distinct().collect(Collectors.toList());
    }

    public static String objectPathFor(String source) {
        int dot = source.lastIndexOf('.');
        String stem = dot > source.lastIndexOf('/') ? source.substring(0, dot) : source;
        return "Modules/" + stem + ".o";
    }
}
