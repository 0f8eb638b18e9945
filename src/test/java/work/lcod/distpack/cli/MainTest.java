package work.lcod.distpack.cli;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.archive.DeterministicArchivePackager;
import work.lcod.distpack.support.DistpackTestSupport;
import work.lcod.distpack.support.DistpackTestSupport.TarFixture;

class MainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().contains("PYTHON.json schema 8"));
    }

    @Test
    void requiresSubcommand() {
        assertEquals(2, execute());
        assertTrue(err.toString().contains("A subcommand is required."));
    }

    @Test
    void setupStageWritesFilesAndReportsJson(@TempDir Path dir) throws Exception {
        DistpackTestSupport.writeSampleBuild(dir);

        int exit = execute(
            "setup",
            "--catalog", dir.resolve("catalog.yml").toString(),
            "--setup", dir.resolve("Modules/Setup").toString(),
            "--config-c", dir.resolve("Modules/config.c.in").toString(),
            "-t", "x86_64-unknown-linux-gnu",
            "--python-version", "3.12.4",
            "--options", "pgo+lto",
            "-o", dir.resolve("out").toString()
        );

        assertEquals(0, exit, err::toString);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("\"build_options\" : \"pgo+lto\""));
        assertTrue(Files.readString(dir.resolve("out/Setup.local")).contains("zlib zlibmodule.c -lz"));
    }

    @Test
    void failingStageExitsWithOne(@TempDir Path dir) {
        DistpackTestSupport.writeSampleBuild(dir);

        int exit = execute(
            "validate",
            "--catalog", dir.resolve("catalog.yml").toString(),
            "-t", "aarch64-apple-darwin",
            "--python-version", "3.12.4"
        );

        assertEquals(1, exit);
        assertTrue(out.toString().contains("\"code\" : \"error\""));
    }

    @Test
    void rejectsUnknownBuildOption(@TempDir Path dir) {
        DistpackTestSupport.writeSampleBuild(dir);

        int exit = execute(
            "setup",
            "--catalog", dir.resolve("catalog.yml").toString(),
            "-t", "x86_64-unknown-linux-gnu",
            "--python-version", "3.12.4",
            "--options", "fast"
        );

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Unsupported build option: fast"));
    }

    @Test
    void normalizesArchiveInPlace(@TempDir Path dir) throws Exception {
        Path tar = dir.resolve("dist.tar");
        Files.write(tar, new TarFixture()
            .file("python/b.txt", "b", 0644, 10L, "builder")
            .file("python/PYTHON.json", "{}", 0600, 20L, "builder")
            .bytes());

        assertEquals(0, execute("normalize", tar.toString()), err::toString);

        byte[] normalized = Files.readAllBytes(tar);
        var packager = new DeterministicArchivePackager(BuildLog.quiet());
        assertEquals("python/PYTHON.json", DistpackTestSupport.entries(normalized).get(0).getName());
        assertArrayEquals(normalized, packager.normalize(normalized));
    }

    @Test
    void reportsCorruptArchiveWithCode(@TempDir Path dir) throws Exception {
        Path tar = dir.resolve("broken.tar");
        Files.write(tar, "definitely not a tar archive".repeat(40).getBytes(StandardCharsets.UTF_8));

        assertEquals(1, execute("normalize", tar.toString()));
        assertTrue(err.toString().contains("[archive_integrity]"));
    }
}
