package work.lcod.distpack.setup;

import work.lcod.distpack.api.DistributionBuildException;

/**
 * A synthesized directive cannot be expressed in the legacy Setup grammar.
 */
public final class MalformedDirectiveException extends DistributionBuildException {
    private final String extension;

    public MalformedDirectiveException(String extension, String message) {
        super("malformed_directive", message);
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
