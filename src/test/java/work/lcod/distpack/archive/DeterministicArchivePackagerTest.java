package work.lcod.distpack.archive;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.distpack.support.DistpackTestSupport.entries;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.junit.jupiter.api.Test;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.support.DistpackTestSupport.TarFixture;

class DeterministicArchivePackagerTest {
    private final DeterministicArchivePackager packager = new DeterministicArchivePackager(BuildLog.quiet());

    private static List<String> names(byte[] tar) {
        return entries(tar).stream().map(TarArchiveEntry::getName).collect(Collectors.toList());
    }

    private static TarArchiveEntry entry(byte[] tar, String name) {
        return entries(tar).stream().filter(entry -> entry.getName().equals(name)).findFirst().orElseThrow();
    }

    private static byte[] sample() {
        return new TarFixture()
            .directory("python/", 1_600_000_000L)
            .file("python/install/bin/python3", "#!elf", 0755, 1_650_000_000L, "builder")
            .file("python/PYTHON.json", "{}\n", 0644, 1_650_000_001L, "builder")
            .directory("python/install/lib", 1_600_000_000L)
            .file("python/install/lib/os.py", "import abc\n", 0600, 1_700_000_000L, "ci")
            .symlink("python/install/bin/python", "python3", 1_650_000_000L)
            .bytes();
    }

    @Test
    void placesMetadataFirstAndSortsTheRest() {
        assertEquals(
            List.of("python/PYTHON.json", "python/install/bin/python", "python/install/bin/python3", "python/install/lib/os.py"),
            names(packager.normalize(sample()))
        );
    }

    @Test
    void canonicalizesOwnershipTimesAndModes() {
        byte[] normalized = packager.normalize(sample());

        for (TarArchiveEntry entry : entries(normalized)) {
            assertEquals(DeterministicArchivePackager.DEFAULT_MTIME * 1000L, entry.getModTime().getTime());
            assertEquals(0L, entry.getLongUserId());
            assertEquals(0L, entry.getLongGroupId());
            assertEquals("root", entry.getUserName());
            assertEquals("root", entry.getGroupName());
        }
        assertEquals(0775, entry(normalized, "python/install/bin/python3").getMode() & 07777);
        assertEquals(0664, entry(normalized, "python/PYTHON.json").getMode() & 07777);
        assertEquals(0660, entry(normalized, "python/install/lib/os.py").getMode() & 07777);
    }

    @Test
    void keepsSymlinksAndDropsDirectories() {
        byte[] normalized = packager.normalize(sample());

        var link = entry(normalized, "python/install/bin/python");
        assertTrue(link.isSymbolicLink());
        assertEquals("python3", link.getLinkName());
        assertTrue(entries(normalized).stream().noneMatch(TarArchiveEntry::isDirectory));
    }

    @Test
    void isIdempotent() {
        byte[] once = packager.normalize(sample());

        assertArrayEquals(once, packager.normalize(once));
    }

    @Test
    void ignoresInputOrderAndMetadata() {
        byte[] reordered = new TarFixture()
            .symlink("python/install/bin/python", "python3", 1L)
            .file("python/install/lib/os.py", "import abc\n", 0600, 2L, "someone")
            .file("python/PYTHON.json", "{}\n", 0644, 3L, "else")
            .file("python/install/bin/python3", "#!elf", 0755, 4L, "root")
            .bytes();

        assertArrayEquals(packager.normalize(sample()), packager.normalize(reordered));
    }

    @Test
    void preservesContent() {
        var packed = new DeterministicArchivePackager(BuildLog.quiet(), "meta.json");
        byte[] normalized = packed.normalize(new TarFixture()
            .file("b.txt", "bee", 0644, 5L, "x")
            .file("meta.json", "{\"a\": 1}", 0644, 5L, "x")
            .bytes());

        var members = packed.read(normalized);
        assertEquals(List.of("meta.json", "b.txt"), members.stream().map(ArchiveMember::path).collect(Collectors.toList()));
        assertEquals("{\"a\": 1}", new String(members.get(0).content(), StandardCharsets.UTF_8));
        assertEquals("bee", new String(members.get(1).content(), StandardCharsets.UTF_8));
    }

    @Test
    void emptyArchiveStaysEmpty() {
        assertTrue(entries(packager.normalize(new TarFixture().bytes())).isEmpty());
    }

    @Test
    void rejectsInputThatIsNotTar() {
        byte[] garbage = new byte[2048];
        Arrays.fill(garbage, (byte) 'x');

        var error = assertThrows(IntegrityException.class, () -> packager.normalize(garbage));
        assertEquals("archive_integrity", error.code());
        assertThrows(IntegrityException.class, () -> packager.normalize("short".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsDuplicateMembers() {
        byte[] duplicated = new TarFixture()
            .file("python/a.txt", "1", 0644, 1L, "x")
            .file("python/a.txt", "2", 0644, 1L, "x")
            .bytes();

        assertThrows(IntegrityException.class, () -> packager.normalize(duplicated));
    }
}
