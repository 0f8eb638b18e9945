package work.lcod.distpack.archive;

import java.util.Objects;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;

/**
 * One non-directory tar member. Normalization rewrites these fields but never the content.
 */
public record ArchiveMember(
    String path,
    int mode,
    long mtimeSeconds,
    long uid,
    long gid,
    String userName,
    String groupName,
    byte linkFlag,
    String linkName,
    byte[] content
) {
    public ArchiveMember {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(groupName, "groupName");
        linkName = linkName == null ? "" : linkName;
        content = content == null ? new byte[0] : content;
    }

    static ArchiveMember fromEntry(TarArchiveEntry entry, byte[] content) {
        return new ArchiveMember(
            entry.getName(),
            entry.getMode(),
            entry.getModTime().getTime() / 1000L,
            entry.getLongUserId(),
            entry.getLongGroupId(),
            entry.getUserName(),
            entry.getGroupName(),
            entry.getLinkFlag(),
            entry.getLinkName(),
            content
        );
    }

    public boolean isLink() {
        return !linkName.isEmpty();
    }

    /**
     * Copy with ownership and timestamp forced to the given values, group permissions widened and
     * the owner-execute bit mirrored to group-execute.
     */
    ArchiveMember canonical(long mtime, String owner) {
        int permissions = mode & 07777;
        permissions |= 0600 | 0060;
        if ((permissions & 0100) != 0) {
            permissions |= 0010;
        }
        return new ArchiveMember(path, permissions, mtime, 0L, 0L, owner, owner, linkFlag, linkName, content);
    }

    TarArchiveEntry toEntry() {
        var entry = new TarArchiveEntry(path, linkFlag);
        entry.setMode(mode);
        entry.setModTime(mtimeSeconds * 1000L);
        entry.setUserId(uid);
        entry.setGroupId(gid);
        entry.setUserName(userName);
        entry.setGroupName(groupName);
        if (isLink()) {
            entry.setLinkName(linkName);
        } else {
            entry.setSize(content.length);
        }
        return entry;
    }
}
