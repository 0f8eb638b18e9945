package work.lcod.distpack.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.distpack.shared.TargetTriple;

/**
 * Per-platform allow-list of the system libraries the core binary may link dynamically.
 */
public final class CoreLinkPolicy {
    static final Set<String> LINUX_ALLOWED = Set.of("c", "crypt", "dl", "m", "pthread", "rt", "util");
    static final Set<String> APPLE_ALLOWED = Set.of("c", "dl", "m", "pthread", "System", "util");

    private CoreLinkPolicy() {}

    /**
     * Converts the core's link flags into link entries, failing on any library outside the
     * platform allow-list.
     */
    public static List<LinkEntry> coreLinks(TargetTriple target, List<String> linkFlags) {
        Set<String> allowed = target.isApple() ? APPLE_ALLOWED : LINUX_ALLOWED;
        var links = new ArrayList<LinkEntry>();
        var unvetted = new ArrayList<String>();
        for (int i = 0; i < linkFlags.size(); i++) {
            String flag = linkFlags.get(i);
            if ("-framework".equals(flag) && i + 1 < linkFlags.size()) {
                String framework = linkFlags.get(++i);
                if (!target.isApple()) {
                    unvetted.add(framework);
                } else {
                    links.add(LinkEntry.framework(framework));
                }
            } else if (flag.startsWith("-l") && flag.length() > 2) {
                String name = flag.substring(2);
                if (!allowed.contains(name)) {
                    unvetted.add(name);
                } else if (links.stream().noneMatch(link -> link.name().equals(name))) {
                    links.add(LinkEntry.system(name));
                }
            }
        }
        if (!unvetted.isEmpty()) {
            throw new UnattributedLinkException(target.value(), unvetted);
        }
        return links;
    }
}
