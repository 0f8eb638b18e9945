package work.lcod.distpack.manifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flat view of a compiled output tree: {@code /}-separated relative path -> size in bytes.
 */
public final class ArtifactTree {
    static final String MODULES_DIR = "build/Modules/";
    static final String LIBRARY_DIR = "build/lib/";
    static final SortedSet<String> CORE_DIRS = Collections.unmodifiableSortedSet(
        new TreeSet<>(List.of("build/Objects/", "build/Parser/", "build/Python/"))
    );

    private final SortedMap<String, Long> files;

    public ArtifactTree(SortedMap<String, Long> files) {
        this.files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
    }

    public static ArtifactTree of(Collection<String> paths) {
        var files = new TreeMap<String, Long>();
        paths.forEach(path -> files.put(path, 0L));
        return new ArtifactTree(files);
    }

    /**
     * Walks {@code root} and records every regular file relative to it.
     */
    public static ArtifactTree scan(Path root) {
        var files = new TreeMap<String, Long>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.filter(Files::isRegularFile).collect(Collectors.toList())) {
                String relative = root.relativize(path).toString().replace('\\', '/');
                files.put(relative, Files.size(path));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to scan artifact tree " + root, ex);
        }
        return new ArtifactTree(files);
    }

    public SortedMap<String, Long> files() {
        return files;
    }

    public SortedSet<String> objects() {
        return files.keySet().stream()
            .filter(path -> path.endsWith(".o"))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public SortedSet<String> coreObjects() {
        return objects().stream()
            .filter(path -> CORE_DIRS.stream().anyMatch(path::startsWith))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public SortedSet<String> moduleObjects() {
        return objects().stream()
            .filter(path -> path.startsWith(MODULES_DIR))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Static archives directly under {@code build/lib}, keyed by bare library name
     * ({@code build/lib/libz.a} -> {@code z}).
     */
    public SortedMap<String, String> staticLibraries() {
        var libraries = new TreeMap<String, String>();
        for (String path : files.keySet()) {
            if (!path.startsWith(LIBRARY_DIR) || !path.endsWith(".a")) {
                continue;
            }
            String file = path.substring(LIBRARY_DIR.length());
            if (file.contains("/") || !file.startsWith("lib") || file.length() <= 5) {
                continue;
            }
            libraries.put(file.substring(3, file.length() - 2), path);
        }
        return libraries;
    }
}
