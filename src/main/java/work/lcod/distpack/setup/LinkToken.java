package work.lcod.distpack.setup;

import java.util.Objects;

/**
 * A library reference on a Setup line: {@code -lname}, the hidden Apple form
 * {@code -Xlinker -hidden-lname}, or a static archive given by path.
 */
public record LinkToken(String name, Kind kind, String text) {
    public enum Kind {
        LIBRARY,
        HIDDEN_LIBRARY,
        ARCHIVE_PATH
    }

    public LinkToken {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    /**
     * {@code path/to/libfoo.a} -> {@code foo}.
     */
    public static String archiveBareName(String path) {
        String file = path.substring(path.lastIndexOf('/') + 1);
        if (file.startsWith("lib")) {
            file = file.substring(3);
        }
        if (file.endsWith(".a")) {
            file = file.substring(0, file.length() - 2);
        }
        return file;
    }
}
