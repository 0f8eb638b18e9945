package work.lcod.distpack.manifest;

import java.util.List;
import work.lcod.distpack.api.DistributionBuildException;

/**
 * A finished manifest fails its post-build consistency checks.
 */
public final class InvalidManifestException extends DistributionBuildException {
    private final List<String> problems;

    public InvalidManifestException(List<String> problems) {
        super("invalid_manifest", "Distribution manifest is invalid: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
