package work.lcod.distpack.setup;

import java.util.List;
import java.util.Objects;
import work.lcod.distpack.catalog.BuildMode;

/**
 * One synthesized or passed-through Setup line, produced once per build and read-only thereafter.
 *
 * @param text literal Setup text; empty when the runtime's own files already carry the module
 * @param parsed structured view of {@code text}, or of the native declaration for pass-through modules
 * @param objectPaths objects this directive claims, relative to the build directory
 * @param linked false for variants whose loadable module is skipped on fully static targets
 */
public record SetupDirective(
    String extension,
    String variant,
    Kind kind,
    BuildMode buildMode,
    String text,
    SetupLine parsed,
    List<String> objectPaths,
    boolean linked
) {
    public enum Kind {
        SYNTHESIZED,
        VARIANT,
        SETUP_ENABLED,
        CONFIG_C_ONLY
    }

    public SetupDirective {
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(buildMode, "buildMode");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(parsed, "parsed");
        objectPaths = List.copyOf(objectPaths);
    }

    public boolean isPrimary() {
        return kind != Kind.VARIANT;
    }

    /**
     * Base name shared by the variant's objects, loadable module and sidecar record.
     */
    public String variantStem() {
        return variantStem(extension, variant);
    }

    public static String variantStem(String extension, String variant) {
        return "VARIANT-" + extension + "-" + variant;
    }
}
