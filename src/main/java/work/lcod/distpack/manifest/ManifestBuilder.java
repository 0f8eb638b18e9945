package work.lcod.distpack.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.catalog.BuildMode;
import work.lcod.distpack.catalog.ExtensionCatalog;
import work.lcod.distpack.catalog.ExtensionModuleSpec;
import work.lcod.distpack.setup.LinkToken;
import work.lcod.distpack.setup.SetupDirective;
import work.lcod.distpack.setup.SetupLineSynthesizer;
import work.lcod.distpack.setup.SetupResult;
import work.lcod.distpack.shared.BuildOptions;
import work.lcod.distpack.shared.TargetTriple;
import work.lcod.distpack.shared.VersionPredicates;

/**
 * Reconstructs the distribution manifest from the compiled artifact tree and the directives that
 * produced it.
 */
public final class ManifestBuilder {
    // The interpreter cannot start without these.
    static final Set<String> REQUIRED_EXTENSIONS = Set.of(
        "_codecs",
        "_io",
        "_signal",
        "_thread",
        "_tracemalloc",
        "_weakref",
        "faulthandler",
        "posix"
    );

    private final BuildLog log;
    private final LicenseRegistry registry;

    public ManifestBuilder(BuildLog log, LicenseRegistry registry) {
        this.log = log.stage(ManifestBuilder.class);
        this.registry = registry;
    }

    public DistributionManifest build(
        ExtensionCatalog catalog,
        SetupResult setup,
        Map<String, String> inittab,
        ArtifactTree tree,
        BuildVariables variables,
        TargetTriple target,
        BuildOptions options
    ) {
        List<LinkEntry> coreLinks = CoreLinkPolicy.coreLinks(target, variables.coreLinkFlags());
        Map<String, String> libraries = tree.staticLibraries();
        Set<String> unclaimed = Set.copyOf(tree.moduleObjects());
        var extensions = new TreeMap<String, List<ExtensionBuildRecord>>();

        List<SetupDirective> ordered = Stream.concat(
            setup.directives().stream().filter(SetupDirective::isPrimary),
            setup.directives().stream().filter(directive -> !directive.isPrimary())
        ).collect(Collectors.toList());

        for (SetupDirective directive : ordered) {
            String name = directive.extension();
            boolean required = isRequired(catalog, name, target);
            if (directive.kind() == SetupDirective.Kind.CONFIG_C_ONLY) {
                String initFn = inittab.getOrDefault(name, "PyInit_" + name);
                log.debug("adding in-core extension {}", name);
                extensions.computeIfAbsent(name, key -> new ArrayList<>()).add(ExtensionBuildRecord.inCore(initFn, required));
                continue;
            }

            Set<String> wanted = directive.objectPaths().stream()
                .map(path -> "build/" + path)
                .collect(Collectors.toCollection(TreeSet::new));
            SortedSet<String> claimed = intersection(wanted, unclaimed);
            unclaimed = difference(unclaimed, claimed);
            for (String object : claimed) {
                log.debug("adding object file {} for extension {} ({})", object, name, directive.variant());
            }
            if (claimed.size() < wanted.size()) {
                log.debug("{} ({}) references objects that are absent or already claimed: {}", name, directive.variant(), difference(wanted, claimed));
            }

            List<LinkEntry> links = resolveLinks(name, directive, libraries);
            extensions.computeIfAbsent(name, key -> new ArrayList<>()).add(
                record(name, directive, new ArrayList<>(claimed), links, required, variables)
            );
        }

        for (var entry : inittab.entrySet()) {
            var records = extensions.get(entry.getKey());
            if (records == null || records.stream().noneMatch(ExtensionBuildRecord::inCore)) {
                log.debug("adding in-core extension {} from config.c", entry.getKey());
                extensions.computeIfAbsent(entry.getKey(), key -> new ArrayList<>())
                    .add(ExtensionBuildRecord.inCore(entry.getValue(), isRequired(catalog, entry.getKey(), target)));
            }
        }

        // Objects no extension owns, such as helpers shared by several modules, belong to the core.
        SortedSet<String> coreObjs = new TreeSet<>(tree.coreObjects());
        coreObjs.addAll(unclaimed);
        log.info("manifest covers {} extensions and {} core objects", extensions.size(), coreObjs.size());

        var cpython = registry.find("cpython-" + VersionPredicates.majorMinor(variables.pythonVersion()));
        if (cpython.isEmpty()) {
            log.warn("license registry has no entry for cpython-{}", VersionPredicates.majorMinor(variables.pythonVersion()));
        }

        return new DistributionManifest(
            DistributionManifest.SCHEMA_VERSION,
            target.value(),
            options.toString(),
            variables.pythonVersion(),
            variables.extSuffix(),
            objectFileFormat(target, options, variables),
            new ArrayList<>(coreObjs),
            coreLinks,
            variables.staticLib(),
            variables.sharedLib(),
            extensions,
            extensionModuleLoading(target, options),
            crtFeatures(target, variables),
            variables.paths(),
            cpython.flatMap(LicenseRegistry.PackageLicense::licenses).orElse(List.of()),
            cpython.flatMap(LicenseRegistry.PackageLicense::licensePath)
        );
    }

    private ExtensionBuildRecord record(
        String name,
        SetupDirective directive,
        List<String> objs,
        List<LinkEntry> links,
        boolean required,
        BuildVariables variables
    ) {
        var licenses = new TreeSet<String>();
        var licensePaths = new TreeSet<String>();
        boolean attributed = false;
        boolean publicDomain = false;
        for (LinkEntry link : links) {
            for (var provider : registry.providersOf(link.name())) {
                attributed = true;
                licenses.addAll(provider.licenses().orElse(List.of()));
                provider.licensePath().ifPresent(licensePaths::add);
                publicDomain |= provider.publicDomain();
            }
        }
        if (!attributed && links.stream().anyMatch(LinkEntry::isLocal)) {
            String local = links.stream().filter(LinkEntry::isLocal).map(LinkEntry::name).collect(Collectors.joining(", "));
            throw new MissingLicenseException(name, "Missing license for local library " + local + " of extension " + name);
        }

        Optional<String> sharedLib = Optional.empty();
        if (directive.kind() == SetupDirective.Kind.VARIANT && directive.linked()) {
            sharedLib = Optional.of("build/Modules/" + directive.variantStem() + variables.extSuffix());
        } else if (directive.isPrimary() && directive.buildMode() == BuildMode.SHARED) {
            sharedLib = Optional.of("build/Modules/" + name + variables.extSuffix());
        }

        return new ExtensionBuildRecord(
            directive.variant(),
            false,
            "PyInit_" + name,
            links,
            objs,
            required,
            new ArrayList<>(licenses),
            new ArrayList<>(licensePaths),
            attributed ? Optional.of(publicDomain) : Optional.empty(),
            sharedLib,
            Optional.empty()
        );
    }

    private List<LinkEntry> resolveLinks(String name, SetupDirective directive, Map<String, String> libraries) {
        var byName = new LinkedHashMap<String, LinkEntry>();
        for (LinkToken token : directive.parsed().links()) {
            String path = libraries.get(token.name());
            LinkEntry entry = path != null ? LinkEntry.localStatic(token.name(), path) : LinkEntry.system(token.name());
            log.debug("adding library {} for extension {} ({})", token.name(), name, path != null ? path : "system");
            byName.putIfAbsent(token.name(), entry);
        }
        for (String framework : directive.parsed().frameworks()) {
            byName.putIfAbsent(framework, LinkEntry.framework(framework));
        }
        return byName.values().stream()
            .sorted(Comparator.comparing(LinkEntry::name))
            .collect(Collectors.toList());
    }

    private static boolean isRequired(ExtensionCatalog catalog, String name, TargetTriple target) {
        if (REQUIRED_EXTENSIONS.contains(name)) {
            return true;
        }
        return catalog.find(name).map(spec -> spec.requiredOn(target.value())).orElse(false);
    }

    static String objectFileFormat(TargetTriple target, BuildOptions options, BuildVariables variables) {
        if (options.has(BuildOptions.Flag.LTO)) {
            return "llvm-bitcode:" + variables.clangVersion().orElse("unknown");
        }
        return target.isApple() ? "mach-o" : "elf";
    }

    static List<String> extensionModuleLoading(TargetTriple target, BuildOptions options) {
        if (SetupLineSynthesizer.isFullyStatic(target, options)) {
            return List.of("builtin");
        }
        return List.of("builtin", "shared-library");
    }

    static List<String> crtFeatures(TargetTriple target, BuildVariables variables) {
        if (target.isApple()) {
            return List.of("libSystem");
        }
        if (target.isMusl()) {
            return List.of("static");
        }
        var features = new ArrayList<String>();
        features.add("glibc-dynamic");
        variables.glibcMaxSymbolVersion().ifPresent(version -> features.add("glibc-max-symbol-version:" + version));
        return features;
    }

    private static SortedSet<String> intersection(Set<String> left, Set<String> right) {
        var result = new TreeSet<>(left);
        result.retainAll(right);
        return Collections.unmodifiableSortedSet(result);
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        var result = new HashSet<>(left);
        result.removeAll(right);
        return Set.copyOf(result);
    }
}
