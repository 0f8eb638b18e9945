package work.lcod.distpack.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.distpack.setup.SetupLineSynthesizer;
import work.lcod.distpack.shared.BuildOptions;
import work.lcod.distpack.shared.TargetTriple;

/**
 * Immutable configuration for one build cell (target triple x build options).
 */
public record DistributionBuildConfiguration(
    Path catalog,
    Optional<Path> nativeSetup,
    Optional<Path> nativeConfigC,
    TargetTriple targetTriple,
    String runtimeVersion,
    BuildOptions buildOptions,
    Path outputDirectory,
    Optional<Path> artifactRoot,
    Optional<Path> buildVariables,
    Optional<Path> licenseRegistry,
    Optional<Path> archive,
    String depsRoot,
    LogLevel logLevel
) {
    public DistributionBuildConfiguration {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(nativeSetup, "nativeSetup");
        Objects.requireNonNull(nativeConfigC, "nativeConfigC");
        Objects.requireNonNull(targetTriple, "targetTriple");
        Objects.requireNonNull(runtimeVersion, "runtimeVersion");
        Objects.requireNonNull(buildOptions, "buildOptions");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(artifactRoot, "artifactRoot");
        Objects.requireNonNull(buildVariables, "buildVariables");
        Objects.requireNonNull(licenseRegistry, "licenseRegistry");
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(depsRoot, "depsRoot");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Where the packaged distribution goes unless an explicit archive path was given.
     */
    public Path archivePath() {
        return archive.orElseGet(() -> outputDirectory.resolve(
            "cpython-" + runtimeVersion + "-" + targetTriple + "-" + buildOptions + ".tar"
        ));
    }

    public static final class Builder {
        private Path catalog;
        private Path nativeSetup;
        private Path nativeConfigC;
        private TargetTriple targetTriple;
        private String runtimeVersion;
        private BuildOptions buildOptions = BuildOptions.of();
        private Path outputDirectory;
        private Path artifactRoot;
        private Path buildVariables;
        private Path licenseRegistry;
        private Path archive;
        private String depsRoot = SetupLineSynthesizer.DEFAULT_DEPS_ROOT;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder catalog(Path catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder nativeSetup(Path nativeSetup) {
            this.nativeSetup = nativeSetup;
            return this;
        }

        public Builder nativeConfigC(Path nativeConfigC) {
            this.nativeConfigC = nativeConfigC;
            return this;
        }

        public Builder targetTriple(TargetTriple targetTriple) {
            this.targetTriple = targetTriple;
            return this;
        }

        public Builder runtimeVersion(String runtimeVersion) {
            this.runtimeVersion = runtimeVersion;
            return this;
        }

        public Builder buildOptions(BuildOptions buildOptions) {
            this.buildOptions = buildOptions;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder artifactRoot(Path artifactRoot) {
            this.artifactRoot = artifactRoot;
            return this;
        }

        public Builder buildVariables(Path buildVariables) {
            this.buildVariables = buildVariables;
            return this;
        }

        public Builder licenseRegistry(Path licenseRegistry) {
            this.licenseRegistry = licenseRegistry;
            return this;
        }

        public Builder archive(Path archive) {
            this.archive = archive;
            return this;
        }

        public Builder depsRoot(String depsRoot) {
            this.depsRoot = depsRoot;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public DistributionBuildConfiguration build() {
            return new DistributionBuildConfiguration(
                catalog,
                Optional.ofNullable(nativeSetup),
                Optional.ofNullable(nativeConfigC),
                targetTriple,
                runtimeVersion,
                buildOptions,
                outputDirectory,
                Optional.ofNullable(artifactRoot),
                Optional.ofNullable(buildVariables),
                Optional.ofNullable(licenseRegistry),
                Optional.ofNullable(archive),
                depsRoot,
                logLevel
            );
        }
    }
}
