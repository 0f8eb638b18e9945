package work.lcod.distpack.archive;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import work.lcod.distpack.api.BuildLog;

/**
 * Rewrites an uncompressed tar stream into a canonical, byte-reproducible form.
 */
public final class DeterministicArchivePackager {
    public static final String METADATA_MEMBER = "python/PYTHON.json";
    // 2024-01-01T00:00:00Z
    public static final long DEFAULT_MTIME = 1704067200L;
    public static final String DEFAULT_OWNER = "root";

    private final BuildLog log;
    private final String metadataMember;

    public DeterministicArchivePackager(BuildLog log) {
        this(log, METADATA_MEMBER);
    }

    public DeterministicArchivePackager(BuildLog log, String metadataMember) {
        this.log = log.stage(DeterministicArchivePackager.class);
        this.metadataMember = Objects.requireNonNull(metadataMember, "metadataMember");
    }

    public byte[] normalize(byte[] tar) {
        List<ArchiveMember> members = read(tar);
        members.sort(Comparator
            .comparing((ArchiveMember member) -> !member.path().equals(metadataMember))
            .thenComparing(ArchiveMember::path));
        var canonical = new ArrayList<ArchiveMember>(members.size());
        for (ArchiveMember member : members) {
            canonical.add(member.canonical(DEFAULT_MTIME, DEFAULT_OWNER));
        }
        log.debug("normalized archive with {} members", canonical.size());
        return write(canonical);
    }

    /**
     * Decodes every non-directory member. Directory entries carry nothing consumers need.
     */
    List<ArchiveMember> read(byte[] tar) {
        Objects.requireNonNull(tar, "tar");
        if (tar.length < TarConstants.DEFAULT_RCDSIZE) {
            throw new IntegrityException("Archive is truncated: " + tar.length + " bytes");
        }
        if (!isZeroBlock(tar) && !TarArchiveInputStream.matches(tar, tar.length)) {
            throw new IntegrityException("Archive does not start with a recognized tar header");
        }

        var members = new ArrayList<ArchiveMember>();
        var seen = new HashSet<String>();
        try (var input = new TarArchiveInputStream(new ByteArrayInputStream(tar), StandardCharsets.UTF_8.name())) {
            TarArchiveEntry entry;
            while ((entry = input.getNextTarEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                if (!seen.add(entry.getName())) {
                    throw new IntegrityException("Archive contains duplicate member " + entry.getName());
                }
                byte[] content = entry.isSymbolicLink() || entry.isLink() ? new byte[0] : input.readAllBytes();
                if (content.length != (entry.isSymbolicLink() || entry.isLink() ? 0 : entry.getSize())) {
                    throw new IntegrityException("Member " + entry.getName() + " is truncated");
                }
                members.add(ArchiveMember.fromEntry(entry, content));
            }
        } catch (IOException | IllegalArgumentException ex) {
            throw new IntegrityException("Unable to parse tar archive: " + ex.getMessage(), ex);
        }
        return members;
    }

    static byte[] write(List<ArchiveMember> members) {
        var buffer = new ByteArrayOutputStream();
        try (var output = new TarArchiveOutputStream(buffer, StandardCharsets.UTF_8.name())) {
            output.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            output.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            for (ArchiveMember member : members) {
                output.putArchiveEntry(member.toEntry());
                if (!member.isLink()) {
                    output.write(member.content());
                }
                output.closeArchiveEntry();
            }
            output.finish();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to encode tar archive", ex);
        }
        return buffer.toByteArray();
    }

    private static boolean isZeroBlock(byte[] tar) {
        for (int i = 0; i < TarConstants.DEFAULT_RCDSIZE; i++) {
            if (tar[i] != 0) {
                return false;
            }
        }
        return true;
    }
}
