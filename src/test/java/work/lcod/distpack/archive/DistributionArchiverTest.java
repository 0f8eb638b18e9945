package work.lcod.distpack.archive;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.support.DistpackTestSupport;

class DistributionArchiverTest {
    private static final byte[] MANIFEST = "{\"version\": \"8\"}\n".getBytes(StandardCharsets.UTF_8);

    private static Path tree(Path root) throws Exception {
        DistpackTestSupport.write(root, "install/lib/python3.12/os.py", "import abc\n");
        DistpackTestSupport.write(root, "install/bin/python3.12", "#!elf");
        DistpackTestSupport.write(root, "PYTHON.json", "stale");
        Files.createDirectories(root.resolve("build/empty"));
        Files.setPosixFilePermissions(root.resolve("install/bin/python3.12"), PosixFilePermissions.fromString("rwxr-xr-x"));
        Files.createSymbolicLink(root.resolve("install/bin/python3"), Path.of("python3.12"));
        return root;
    }

    @Test
    void packsTreeWithInjectedManifest(@TempDir Path dir) throws Exception {
        Path root = tree(dir.resolve("dist"));
        Path destination = dir.resolve("out/cpython.tar");

        byte[] archive = new DistributionArchiver(BuildLog.quiet()).archive(root, MANIFEST, destination);

        assertArrayEquals(archive, Files.readAllBytes(destination));
        var members = new DeterministicArchivePackager(BuildLog.quiet()).read(archive);
        assertEquals(
            List.of("python/PYTHON.json", "python/install/bin/python3", "python/install/bin/python3.12", "python/install/lib/python3.12/os.py"),
            members.stream().map(ArchiveMember::path).collect(Collectors.toList())
        );
        assertArrayEquals(MANIFEST, members.get(0).content());
        assertTrue(members.get(1).isLink());
        assertEquals("python3.12", members.get(1).linkName());
        assertEquals(0775, members.get(2).mode() & 07777);
        assertEquals(DeterministicArchivePackager.DEFAULT_MTIME, members.get(3).mtimeSeconds());
    }

    @Test
    void repeatedRunsProduceIdenticalBytes(@TempDir Path dir) throws Exception {
        Path root = tree(dir.resolve("dist"));
        var archiver = new DistributionArchiver(BuildLog.quiet());

        byte[] first = archiver.archive(root, MANIFEST, dir.resolve("a.tar"));
        Files.setLastModifiedTime(root.resolve("install/lib/python3.12/os.py"), FileTime.fromMillis(0L));
        byte[] second = archiver.archive(root, MANIFEST, dir.resolve("b.tar"));

        assertArrayEquals(first, second);
    }
}
