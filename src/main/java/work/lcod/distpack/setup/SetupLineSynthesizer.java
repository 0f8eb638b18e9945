package work.lcod.distpack.setup;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.catalog.BuildMode;
import work.lcod.distpack.catalog.BuildRecipe;
import work.lcod.distpack.catalog.ConditionalEntry;
import work.lcod.distpack.catalog.ExtensionCatalog;
import work.lcod.distpack.catalog.ExtensionModuleSpec;
import work.lcod.distpack.shared.BuildOptions;
import work.lcod.distpack.shared.TargetTriple;

/**
 * Turns catalog entries into Setup.local directives for one (target, version, options) cell.
 */
public final class SetupLineSynthesizer {
    public static final String DEFAULT_DEPS_ROOT = "/tools/deps";

    // The limited-API example modules cannot be built against a debug runtime.
    static final Set<String> DEBUG_DISABLED = Set.of("xxlimited", "xxlimited_35");

    // makesetup treats any '=' on a line as a variable assignment.
    private static final Pattern DEFINE_WITH_VALUE = Pattern.compile("-D[^=\\s]+=\\S+");

    private final BuildLog log;
    private final String depsRoot;

    public SetupLineSynthesizer(BuildLog log) {
        this(log, DEFAULT_DEPS_ROOT);
    }

    public SetupLineSynthesizer(BuildLog log, String depsRoot) {
        this.log = log.stage(SetupLineSynthesizer.class);
        this.depsRoot = depsRoot.endsWith("/") ? depsRoot.substring(0, depsRoot.length() - 1) : depsRoot;
    }

    public SetupResult synthesize(
        ExtensionCatalog catalog,
        TargetTriple target,
        String runtimeVersion,
        BuildOptions options
    ) {
        return synthesize(catalog, target, runtimeVersion, options, Map.of());
    }

    /**
     * @param nativeLines enabled declarations from the runtime's own Setup file, used to describe
     *     pass-through modules
     */
    public SetupResult synthesize(
        ExtensionCatalog catalog,
        TargetTriple target,
        String runtimeVersion,
        BuildOptions options,
        Map<String, SetupLine> nativeLines
    ) {
        var ignored = new TreeSet<String>();
        var disabled = computeDisabled(catalog, target, runtimeVersion, options, ignored);
        var output = new Output(isFullyStatic(target, options));

        for (ExtensionModuleSpec spec : catalog.specs()) {
            String name = spec.name();
            if (ignored.contains(name) || disabled.contains(name)) {
                continue;
            }
            if (spec.configCOnly()) {
                output.directives.add(passThrough(spec, SetupDirective.Kind.CONFIG_C_ONLY, nativeLines));
                continue;
            }
            if (spec.setupEnabledFor(target.value(), runtimeVersion)) {
                log.debug("{} is enabled by the runtime's Setup file", name);
                output.directives.add(passThrough(spec, SetupDirective.Kind.SETUP_ENABLED, nativeLines));
                continue;
            }
            synthesizeSpec(spec, target, runtimeVersion, output);
        }

        return new SetupResult(
            output.directives,
            renderSetupLocal(output.sections, disabled),
            renderMakeData(output.cflags, output.variantRules, output.variantTargets),
            output.sidecars,
            disabled,
            ignored
        );
    }

    public static boolean isFullyStatic(TargetTriple target, BuildOptions options) {
        return target.isMusl() || options.has(BuildOptions.Flag.STATIC);
    }

    private SortedSet<String> computeDisabled(
        ExtensionCatalog catalog,
        TargetTriple target,
        String runtimeVersion,
        BuildOptions options,
        Set<String> ignored
    ) {
        var disabled = new TreeSet<String>();
        for (ExtensionModuleSpec spec : catalog.specs()) {
            if (!spec.supportsVersion(runtimeVersion)) {
                log.info("ignoring extension module {} because runtime {} is outside its version range", spec.name(), runtimeVersion);
                ignored.add(spec.name());
                continue;
            }
            if (spec.disabledOn(target.value())) {
                log.info("disabling extension module {} because it is disabled for {}", spec.name(), target);
                disabled.add(spec.name());
            }
        }
        if (options.has(BuildOptions.Flag.DEBUG)) {
            for (String name : DEBUG_DISABLED) {
                if (catalog.contains(name) && !ignored.contains(name) && disabled.add(name)) {
                    log.info("disabling extension module {} for debug build", name);
                }
            }
        }
        return disabled;
    }

    private SetupDirective passThrough(
        ExtensionModuleSpec spec,
        SetupDirective.Kind kind,
        Map<String, SetupLine> nativeLines
    ) {
        SetupLine line = nativeLines.getOrDefault(spec.name(), SetupLine.empty(spec.name()));
        List<String> objects = kind == SetupDirective.Kind.CONFIG_C_ONLY ? List.of() : line.objectPaths();
        return new SetupDirective(
            spec.name(),
            ExtensionModuleSpec.DEFAULT_VARIANT,
            kind,
            spec.buildMode(),
            "",
            line,
            objects,
            true
        );
    }

    private void synthesizeSpec(
        ExtensionModuleSpec spec,
        TargetTriple target,
        String runtimeVersion,
        Output output
    ) {
        String name = spec.name();
        Map<String, BuildRecipe> builds = spec.buildsInOrder();
        if (builds.isEmpty()) {
            // Nothing to compile: a bare name would register a module without objects.
            if (renderWords(name, spec.recipe(), target, runtimeVersion).size() > 1) {
                throw new MalformedDirectiveException(name, name + " declares build flags but no sources");
            }
            log.info("skipping extension module {} because it declares no sources", name);
            return;
        }

        boolean primary = true;
        for (var build : builds.entrySet()) {
            String variant = build.getKey();
            List<String> words = renderWords(name, build.getValue(), target, runtimeVersion);
            SetupLine original = SetupLineParser.parseWords(words).orElseThrow();
            if (original.sources().isEmpty()) {
                throw new MalformedDirectiveException(name, name + " (" + variant + ") has no sources applicable to " + target);
            }

            List<String> objects = primary
                ? original.objectPaths()
                : variantObjectPaths(name, variant, original.sources());
            List<String> rewritten = extractValuedDefines(name, words, objects, output.cflags);
            String text = String.join(" ", rewritten);
            if (text.indexOf('=') >= 0) {
                throw new MalformedDirectiveException(name, "'=' appears in Setup line and would confuse makesetup: " + text);
            }
            SetupLine parsed = SetupLineParser.parseWords(rewritten).orElseThrow();

            if (primary) {
                log.debug("synthesized {}: {}", name, text);
                output.sections.get(spec.buildMode()).add(text);
                output.directives.add(new SetupDirective(
                    name, variant, SetupDirective.Kind.SYNTHESIZED, spec.buildMode(), text, parsed, objects, true
                ));
                primary = false;
                continue;
            }

            boolean linked = !output.fullyStatic;
            String stem = SetupDirective.variantStem(name, variant);
            log.debug("building {} variant {} out of line (linked: {})", name, variant, linked);
            output.variantRules.addAll(variantRules(stem, parsed, objects, linked));
            output.variantTargets.add(linked ? "Modules/" + stem + "$(EXT_SUFFIX)" : String.join(" ", objects));
            // Written even when the link step is skipped; consumers must cope with a missing module.
            output.sidecars.put(stem + ".data", String.join(" ", words));
            output.directives.add(new SetupDirective(
                name, variant, SetupDirective.Kind.VARIANT, BuildMode.SHARED, text, parsed, objects, linked
            ));
        }
    }

    private List<String> renderWords(
        String name,
        BuildRecipe recipe,
        TargetTriple target,
        String runtimeVersion
    ) {
        String triple = target.value();
        var words = new ArrayList<String>();
        words.add(name);
        words.addAll(recipe.sources());
        for (ConditionalEntry entry : recipe.sourcesConditional()) {
            if (entry.applies(triple, runtimeVersion)) {
                words.add(entry.value());
            }
        }
        for (String define : recipe.defines()) {
            words.add("-D" + define);
        }
        for (ConditionalEntry entry : recipe.definesConditional()) {
            if (entry.applies(triple, runtimeVersion)) {
                words.add("-D" + entry.value());
            }
        }
        for (String include : recipe.includes()) {
            words.add("-I" + include);
        }
        for (ConditionalEntry entry : recipe.includesConditional()) {
            if (entry.applies(triple, runtimeVersion)) {
                words.add("-I" + entry.value());
            }
        }
        // Apple builds put the dependency tree on the global search path already.
        if (!target.isApple()) {
            for (String include : recipe.includesDeps()) {
                words.add("-I" + depsRoot + "/" + include);
            }
        }
        for (String link : recipe.links()) {
            words.addAll(linkWords(link, target));
        }
        for (ConditionalEntry entry : recipe.linksConditional()) {
            if (entry.applies(triple, runtimeVersion)) {
                words.addAll(linkWords(entry.value(), target));
            }
        }
        if (target.isApple()) {
            for (String framework : recipe.frameworks()) {
                words.add("-framework");
                words.add(framework);
            }
        }
        for (ConditionalEntry entry : recipe.linkerArgs()) {
            if (entry.applies(triple, runtimeVersion)) {
                words.addAll(entry.values());
            }
        }
        for (String word : words) {
            if (word.isEmpty() || word.indexOf('#') >= 0 || word.chars().anyMatch(Character::isWhitespace)) {
                throw new MalformedDirectiveException(name, "token '" + word + "' cannot appear in a Setup line for " + name);
            }
        }
        return words;
    }

    /**
     * Apple has no version script to keep symbols of static dependencies private, so libraries are
     * linked with the hidden form there.
     */
    static List<String> linkWords(String library, TargetTriple target) {
        if (library.endsWith(".a")) {
            return List.of(library);
        }
        if (target.isApple()) {
            return List.of("-Xlinker", "-hidden-l" + library);
        }
        return List.of("-l" + library);
    }

    private static List<String> extractValuedDefines(
        String name,
        List<String> words,
        List<String> objects,
        SortedMap<String, List<String>> cflags
    ) {
        var kept = new ArrayList<String>(words.size());
        for (String word : words) {
            if (DEFINE_WITH_VALUE.matcher(word).matches()) {
                if (objects.isEmpty()) {
                    throw new MalformedDirectiveException(name, "define " + word + " of " + name + " has no object to attach to");
                }
                for (String object : objects) {
                    var flags = cflags.computeIfAbsent(object, key -> new ArrayList<>());
                    if (!flags.contains(word)) {
                        flags.add(word);
                    }
                }
                continue;
            }
            kept.add(word);
        }
        return kept;
    }

    private static List<String> variantObjectPaths(String name, String variant, List<String> sources) {
        var objects = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (String source : sources) {
            String file = source.substring(source.lastIndexOf('/') + 1);
            String stem = file.substring(0, file.lastIndexOf('.'));
            String object = "Modules/" + SetupDirective.variantStem(name, variant) + "-" + stem + ".o";
            if (!seen.add(object)) {
                throw new MalformedDirectiveException(name, "variant " + variant + " of " + name + " has two sources named " + stem);
            }
            objects.add(object);
        }
        return objects;
    }

    private static List<String> variantRules(String stem, SetupLine parsed, List<String> objects, boolean linked) {
        var rules = new ArrayList<String>();
        var compileFlags = new StringBuilder();
        parsed.includes().forEach(include -> compileFlags.append(" -I").append(include));
        parsed.defines().forEach(define -> compileFlags.append(" -D").append(define));

        for (int i = 0; i < objects.size(); i++) {
            String source = "$(srcdir)/Modules/" + parsed.sources().get(i);
            rules.add(objects.get(i) + ": " + source);
            rules.add("\t$(CC) $(PY_STDMODULE_CFLAGS)" + compileFlags + " -c " + source + " -o " + objects.get(i));
        }
        if (linked) {
            var linkArgs = new StringBuilder();
            parsed.links().forEach(link -> linkArgs.append(' ').append(link.text()));
            parsed.frameworks().forEach(framework -> linkArgs.append(" -framework ").append(framework));
            parsed.otherArgs().forEach(arg -> linkArgs.append(' ').append(arg));
            String module = "Modules/" + stem + "$(EXT_SUFFIX)";
            String objectList = String.join(" ", objects);
            rules.add(module + ": " + objectList);
            rules.add("\t$(BLDSHARED) " + objectList + linkArgs + " -o " + module);
        }
        return rules;
    }

    private static String renderSetupLocal(Map<BuildMode, List<String>> sections, SortedSet<String> disabled) {
        var lines = new ArrayList<String>();
        lines.add("*static*");
        lines.addAll(sections.get(BuildMode.STATIC));
        lines.add("");
        lines.add("*shared*");
        lines.addAll(sections.get(BuildMode.SHARED));
        lines.add("");
        lines.add("*disabled*");
        lines.addAll(disabled);
        return String.join("\n", lines) + "\n";
    }

    private static String renderMakeData(
        SortedMap<String, List<String>> cflags,
        List<String> variantRules,
        List<String> variantTargets
    ) {
        var lines = new ArrayList<String>();
        cflags.forEach((object, flags) -> lines.add(object + ": PY_STDMODULE_CFLAGS += " + String.join(" ", flags)));
        lines.addAll(variantRules);
        if (!variantTargets.isEmpty()) {
            lines.add("all: " + String.join(" ", variantTargets));
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    private static final class Output {
        private final boolean fullyStatic;
        private final List<SetupDirective> directives = new ArrayList<>();
        private final Map<BuildMode, List<String>> sections = new EnumMap<>(BuildMode.class);
        private final SortedMap<String, List<String>> cflags = new TreeMap<>();
        private final List<String> variantRules = new ArrayList<>();
        private final List<String> variantTargets = new ArrayList<>();
        private final SortedMap<String, String> sidecars = new TreeMap<>();

        private Output(boolean fullyStatic) {
            this.fullyStatic = fullyStatic;
            for (BuildMode mode : BuildMode.values()) {
                sections.put(mode, new ArrayList<>());
            }
        }
    }
}
