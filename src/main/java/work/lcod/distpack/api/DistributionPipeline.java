package work.lcod.distpack.api;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.distpack.archive.DistributionArchiver;
import work.lcod.distpack.catalog.CatalogLoader;
import work.lcod.distpack.catalog.ExtensionCatalog;
import work.lcod.distpack.manifest.ArtifactTree;
import work.lcod.distpack.manifest.BuildVariables;
import work.lcod.distpack.manifest.DistributionManifest;
import work.lcod.distpack.manifest.LicenseRegistry;
import work.lcod.distpack.manifest.ManifestBuilder;
import work.lcod.distpack.manifest.ManifestValidator;
import work.lcod.distpack.manifest.ManifestWriter;
import work.lcod.distpack.nativeconfig.ConfigConsistencyValidator;
import work.lcod.distpack.nativeconfig.NativeExtensionIndex;
import work.lcod.distpack.setup.SetupLine;
import work.lcod.distpack.setup.SetupLineSynthesizer;
import work.lcod.distpack.setup.SetupResult;

/**
 * Public entry point running the stages of one build cell: catalog load, drift check, Setup
 * synthesis, manifest generation and packaging.
 */
public final class DistributionPipeline {
    public enum Stage {
        VALIDATE,
        SETUP,
        MANIFEST,
        PACKAGE
    }

    private final DistributionBuildConfiguration configuration;
    private final BuildLog log;

    public DistributionPipeline(DistributionBuildConfiguration configuration) {
        this(configuration, BuildLog.forCell(configuration.targetTriple().value(), configuration.buildOptions().toString()));
    }

    public DistributionPipeline(DistributionBuildConfiguration configuration, BuildLog log) {
        this.configuration = configuration;
        this.log = log;
    }

    /**
     * Runs {@code stage} and every stage it depends on, reporting failures instead of throwing.
     */
    public PipelineResult run(Stage stage) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("target_triple", configuration.targetTriple().value());
        metadata.put("build_options", configuration.buildOptions().toString());
        metadata.put("python_version", configuration.runtimeVersion());
        try {
            switch (stage) {
                case VALIDATE -> {
                    var catalog = loadCatalog();
                    validate(catalog, requireNative());
                    metadata.put("extensions", catalog.size());
                }
                case SETUP -> {
                    var setup = synthesize();
                    setup.writeTo(configuration.outputDirectory());
                    metadata.put("setup_local", configuration.outputDirectory().resolve(SetupResult.SETUP_LOCAL).toString());
                    metadata.put("disabled", setup.disabled());
                    metadata.put("variants", setup.sidecars().keySet());
                }
                case MANIFEST -> {
                    var manifest = writeManifest();
                    metadata.put("manifest", manifestPath().toString());
                    metadata.put("extensions", manifest.extensions().size());
                }
                case PACKAGE -> {
                    Path archive = packageDistribution();
                    metadata.put("archive", archive.toString());
                }
                default -> throw new IllegalArgumentException("Unsupported stage: " + stage);
            }
            return PipelineResult.success(stage, metadata, started);
        } catch (DistributionBuildException ex) {
            return failure(stage, ex.code(), ex, metadata, started);
        } catch (UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            return failure(stage, "error", ex, metadata, started);
        }
    }

    public ExtensionCatalog loadCatalog() {
        var catalog = CatalogLoader.load(configuration.catalog());
        log.info("loaded {} catalog entries from {}", catalog.size(), configuration.catalog());
        return catalog;
    }

    public Optional<NativeExtensionIndex> loadNative() {
        if (configuration.nativeSetup().isEmpty() || configuration.nativeConfigC().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(NativeExtensionIndex.load(configuration.nativeSetup().get(), configuration.nativeConfigC().get()));
    }

    public void validate(ExtensionCatalog catalog, NativeExtensionIndex nativeIndex) {
        new ConfigConsistencyValidator(log).validate(
            catalog,
            nativeIndex,
            configuration.targetTriple(),
            configuration.runtimeVersion()
        );
    }

    /**
     * Loads the catalog, checks it against the native files when they are configured and
     * synthesizes the Setup directives.
     */
    public SetupResult synthesize() {
        return synthesize(loadCatalog(), loadNative());
    }

    public DistributionManifest buildManifest() {
        var catalog = loadCatalog();
        var nativeIndex = loadNative();
        var setup = synthesize(catalog, nativeIndex);
        Path root = configuration.artifactRoot()
            .orElseThrow(() -> new IllegalArgumentException("An artifact root is required to build the manifest"));
        Path variablesPath = configuration.buildVariables()
            .orElseThrow(() -> new IllegalArgumentException("A build variables document is required to build the manifest"));
        var registry = configuration.licenseRegistry().map(LicenseRegistry::load).orElseGet(LicenseRegistry::empty);
        var tree = ArtifactTree.scan(root);

        var manifest = new ManifestBuilder(log, registry).build(
            catalog,
            setup,
            nativeIndex.map(NativeExtensionIndex::inittab).orElse(Collections.emptySortedMap()),
            tree,
            BuildVariables.load(variablesPath),
            configuration.targetTriple(),
            configuration.buildOptions()
        );
        ManifestValidator.validate(manifest, catalog, tree);
        return manifest;
    }

    public DistributionManifest writeManifest() {
        var manifest = buildManifest();
        ManifestWriter.write(manifest, manifestPath());
        log.info("wrote {}", manifestPath());
        return manifest;
    }

    public Path packageDistribution() {
        var manifest = buildManifest();
        Path root = configuration.artifactRoot().orElseThrow();
        Path archive = configuration.archivePath();
        new DistributionArchiver(log).archive(root, ManifestWriter.toBytes(manifest), archive);
        return archive;
    }

    private SetupResult synthesize(ExtensionCatalog catalog, Optional<NativeExtensionIndex> nativeIndex) {
        nativeIndex.ifPresent(index -> validate(catalog, index));
        return new SetupLineSynthesizer(log, configuration.depsRoot()).synthesize(
            catalog,
            configuration.targetTriple(),
            configuration.runtimeVersion(),
            configuration.buildOptions(),
            nativeIndex.<Map<String, SetupLine>>map(NativeExtensionIndex::enabled).orElse(Map.of())
        );
    }

    private NativeExtensionIndex requireNative() {
        return loadNative().orElseThrow(
            () -> new IllegalArgumentException("Both the native Setup file and config.c.in are required to validate")
        );
    }

    private Path manifestPath() {
        return configuration.outputDirectory().resolve(ManifestWriter.FILE_NAME);
    }

    private PipelineResult failure(
        Stage stage,
        String code,
        RuntimeException ex,
        Map<String, Object> metadata,
        Instant started
    ) {
        log.warn("{} failed: {}", stage.name().toLowerCase(Locale.ROOT), ex.getMessage());
        if (Boolean.getBoolean("distpack.debug")) {
            ex.printStackTrace();
        }
        return PipelineResult.failure(stage, code, ex.getMessage(), metadata, started);
    }
}
