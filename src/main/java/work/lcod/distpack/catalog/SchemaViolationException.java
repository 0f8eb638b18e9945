package work.lcod.distpack.catalog;

import java.util.List;
import work.lcod.distpack.api.DistributionBuildException;

/**
 * Raised when the extension catalog fails structural validation.
 */
public final class SchemaViolationException extends DistributionBuildException {
    private final List<String> violations;

    public SchemaViolationException(List<String> violations) {
        super("schema_violation", "Extension catalog is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaViolationException(String violation, Throwable cause) {
        super("schema_violation", "Extension catalog is invalid: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> violations() {
        return violations;
    }
}
