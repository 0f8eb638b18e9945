package work.lcod.distpack.archive;

import work.lcod.distpack.api.DistributionBuildException;

/**
 * The packager was handed a tar stream it cannot parse.
 */
public final class IntegrityException extends DistributionBuildException {
    public IntegrityException(String message) {
        super("archive_integrity", message);
    }

    public IntegrityException(String message, Throwable cause) {
        super("archive_integrity", message, cause);
    }
}
