package work.lcod.distpack.api;

/**
 * Base of every fatal distribution build failure. The {@link #code()} is stable and machine readable.
 */
public class DistributionBuildException extends RuntimeException {
    private final String code;

    public DistributionBuildException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DistributionBuildException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
