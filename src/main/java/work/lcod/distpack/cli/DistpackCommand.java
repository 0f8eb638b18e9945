package work.lcod.distpack.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.api.DistributionBuildConfiguration;
import work.lcod.distpack.api.DistributionPipeline;
import work.lcod.distpack.api.LogLevel;
import work.lcod.distpack.archive.DeterministicArchivePackager;
import work.lcod.distpack.shared.AtomicFiles;
import work.lcod.distpack.shared.BuildOptions;
import work.lcod.distpack.shared.TargetTriple;

@CommandLine.Command(
    name = "distpack",
    description = "Resolve extension modules, build manifests and package runtime distributions.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        DistpackCommand.ValidateCommand.class,
        DistpackCommand.SetupCommand.class,
        DistpackCommand.ManifestCommand.class,
        DistpackCommand.PackageCommand.class,
        DistpackCommand.NormalizeCommand.class
    }
)
final class DistpackCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "A subcommand is required.");
    }

    /**
     * Options identifying one build cell, shared by the stage subcommands.
     */
    static final class CellOptions {
        @CommandLine.Option(names = "--catalog", required = true, description = "Extension catalog YAML.")
        Path catalog;

        @CommandLine.Option(names = "--setup", description = "The runtime's Modules/Setup file.")
        Path nativeSetup;

        @CommandLine.Option(names = "--config-c", description = "The runtime's Modules/config.c.in file.")
        Path nativeConfigC;

        @CommandLine.Option(names = {"-t", "--target"}, required = true, description = "Target triple.")
        String target;

        @CommandLine.Option(names = "--python-version", required = true, description = "Runtime version (e.g. 3.13.1).")
        String pythonVersion;

        @CommandLine.Option(names = "--options", defaultValue = "noopt", description = "Build options joined with '+'.")
        String options;

        @CommandLine.Option(names = {"-o", "--output"}, defaultValue = ".", description = "Output directory.")
        Path output;

        @CommandLine.Option(names = "--artifacts", description = "Root of the compiled distribution tree.")
        Path artifacts;

        @CommandLine.Option(names = "--build-vars", description = "JSON build variables reported by the runtime.")
        Path buildVariables;

        @CommandLine.Option(names = "--licenses", description = "TOML license registry.")
        Path licenses;

        @CommandLine.Option(names = "--archive", description = "Archive path (default: <output>/cpython-<version>-<target>-<options>.tar).")
        Path archive;

        @CommandLine.Option(names = "--deps-root", defaultValue = "/tools/deps", description = "Root of dependency headers on Linux builders.")
        String depsRoot;

        @CommandLine.Option(
            names = "--log-level",
            description = "Log threshold (trace|debug|info|warn|error).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        String logLevel;

        DistributionBuildConfiguration toConfiguration() {
            return DistributionBuildConfiguration.builder()
                .catalog(catalog)
                .nativeSetup(nativeSetup)
                .nativeConfigC(nativeConfigC)
                .targetTriple(TargetTriple.of(target))
                .runtimeVersion(pythonVersion)
                .buildOptions(BuildOptions.parse(options))
                .outputDirectory(output)
                .artifactRoot(artifacts)
                .buildVariables(buildVariables)
                .licenseRegistry(licenses)
                .archive(archive)
                .depsRoot(depsRoot)
                .logLevel(LogLevel.from(logLevel))
                .build();
        }
    }

    abstract static class StageCommand implements Callable<Integer> {
        @CommandLine.Mixin
        CellOptions cell;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        abstract DistributionPipeline.Stage stage();

        @Override
        public Integer call() {
            DistributionBuildConfiguration configuration;
            try {
                configuration = cell.toConfiguration();
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
            }
            configuration.logLevel().apply();
            var result = new DistributionPipeline(configuration).run(stage());
            spec.commandLine().getOut().println(result.toPrettyJson());
            return result.status().exitCode();
        }
    }

    @CommandLine.Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check the catalog against the runtime's Setup file and init table.")
    static final class ValidateCommand extends StageCommand {
        @Override
        DistributionPipeline.Stage stage() {
            return DistributionPipeline.Stage.VALIDATE;
        }
    }

    @CommandLine.Command(name = "setup", mixinStandardHelpOptions = true,
        description = "Write Setup.local, the make supplement and variant sidecars.")
    static final class SetupCommand extends StageCommand {
        @Override
        DistributionPipeline.Stage stage() {
            return DistributionPipeline.Stage.SETUP;
        }
    }

    @CommandLine.Command(name = "manifest", mixinStandardHelpOptions = true,
        description = "Scan compiled artifacts and write PYTHON.json.")
    static final class ManifestCommand extends StageCommand {
        @Override
        DistributionPipeline.Stage stage() {
            return DistributionPipeline.Stage.MANIFEST;
        }
    }

    @CommandLine.Command(name = "package", mixinStandardHelpOptions = true,
        description = "Build the manifest and pack the distribution into a canonical tar.")
    static final class PackageCommand extends StageCommand {
        @Override
        DistributionPipeline.Stage stage() {
            return DistributionPipeline.Stage.PACKAGE;
        }
    }

    @CommandLine.Command(name = "normalize", mixinStandardHelpOptions = true,
        description = "Rewrite an uncompressed tar into its canonical form.")
    static final class NormalizeCommand implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", description = "Input tar.")
        Path input;

        @CommandLine.Option(names = {"-o", "--output"}, description = "Output tar (default: rewrite in place).")
        Path output;

        @CommandLine.Option(names = "--metadata-member", defaultValue = DeterministicArchivePackager.METADATA_MEMBER,
            description = "Member always stored first.")
        String metadataMember;

        @Override
        public Integer call() throws Exception {
            var packager = new DeterministicArchivePackager(BuildLog.forCell("normalize", input.getFileName().toString()), metadataMember);
            byte[] normalized = packager.normalize(Files.readAllBytes(input));
            AtomicFiles.write(output != null ? output : input, normalized);
            return 0;
        }
    }
}
