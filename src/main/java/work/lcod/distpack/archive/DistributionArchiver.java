package work.lcod.distpack.archive;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import work.lcod.distpack.api.BuildLog;
import work.lcod.distpack.shared.AtomicFiles;

/**
 * Packs an on-disk distribution tree plus its manifest into the final canonical tar.
 */
public final class DistributionArchiver {
    public static final String PREFIX = "python/";

    private final BuildLog log;
    private final DeterministicArchivePackager packager;

    public DistributionArchiver(BuildLog log) {
        this.log = log.stage(DistributionArchiver.class);
        this.packager = new DeterministicArchivePackager(log);
    }

    /**
     * Builds the archive in memory, normalizes it and only then publishes it at {@code destination}.
     *
     * @param manifestJson serialized manifest stored as {@code python/PYTHON.json}; replaces any
     *     file of that name in the tree
     */
    public byte[] archive(Path root, byte[] manifestJson, Path destination) {
        var members = new ArrayList<ArchiveMember>();
        members.add(new ArchiveMember(
            DeterministicArchivePackager.METADATA_MEMBER, 0644, 0L, 0L, 0L, "", "",
            TarConstants.LF_NORMAL, "", manifestJson
        ));
        for (Path file : listFiles(root)) {
            String path = PREFIX + root.relativize(file).toString().replace('\\', '/');
            if (path.equals(DeterministicArchivePackager.METADATA_MEMBER)) {
                continue;
            }
            members.add(toMember(file, path));
        }

        byte[] normalized = packager.normalize(DeterministicArchivePackager.write(members));
        AtomicFiles.write(destination, normalized);
        log.info("wrote {} ({} members, {} bytes)", destination, members.size(), normalized.length);
        return normalized;
    }

    private static List<Path> listFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(path -> !Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list distribution tree " + root, ex);
        }
    }

    private static ArchiveMember toMember(Path file, String path) {
        try {
            if (Files.isSymbolicLink(file)) {
                String target = Files.readSymbolicLink(file).toString().replace('\\', '/');
                return new ArchiveMember(path, 0777, 0L, 0L, 0L, "", "", TarConstants.LF_SYMLINK, target, null);
            }
            return new ArchiveMember(path, mode(file), 0L, 0L, 0L, "", "", TarConstants.LF_NORMAL, "", Files.readAllBytes(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + file, ex);
        }
    }

    private static int mode(Path file) throws IOException {
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(file, LinkOption.NOFOLLOW_LINKS);
            int mode = 0;
            for (PosixFilePermission permission : permissions) {
                mode |= 1 << (8 - permission.ordinal());
            }
            return mode;
        } catch (UnsupportedOperationException ex) {
            return Files.isExecutable(file) ? 0755 : 0644;
        }
    }
}
