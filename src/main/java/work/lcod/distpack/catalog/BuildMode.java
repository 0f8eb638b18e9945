package work.lcod.distpack.catalog;

import java.util.Locale;

public enum BuildMode {
    STATIC,
    SHARED;

    public static BuildMode from(String value) {
        try {
            return BuildMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported build-mode: " + value);
        }
    }

    public String sectionName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
