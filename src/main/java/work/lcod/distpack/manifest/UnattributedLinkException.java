package work.lcod.distpack.manifest;

import java.util.List;
import work.lcod.distpack.api.DistributionBuildException;

/**
 * The core binary links a system library that the platform allow-list does not recognize.
 */
public final class UnattributedLinkException extends DistributionBuildException {
    private final List<String> libraries;

    public UnattributedLinkException(String targetTriple, List<String> libraries) {
        super(
            "unattributed_link",
            "Core links unvetted system libraries on " + targetTriple + ": " + String.join(", ", libraries)
        );
        this.libraries = List.copyOf(libraries);
    }

    public List<String> libraries() {
        return libraries;
    }
}
