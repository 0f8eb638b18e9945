package work.lcod.distpack.manifest;

import work.lcod.distpack.api.DistributionBuildException;

/**
 * A locally linked library cannot be attributed to any license.
 */
public final class MissingLicenseException extends DistributionBuildException {
    private final String extension;

    public MissingLicenseException(String extension, String message) {
        super("missing_license", message);
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
