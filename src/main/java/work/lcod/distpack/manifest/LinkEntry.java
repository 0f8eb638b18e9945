package work.lcod.distpack.manifest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One library an object set links against: a local archive shipped in the distribution, a system
 * library, or an Apple framework.
 */
public record LinkEntry(
    String name,
    Optional<String> pathStatic,
    Optional<String> pathDynamic,
    boolean system,
    boolean framework
) {
    public LinkEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pathStatic, "pathStatic");
        Objects.requireNonNull(pathDynamic, "pathDynamic");
    }

    public static LinkEntry localStatic(String name, String path) {
        return new LinkEntry(name, Optional.of(path), Optional.empty(), false, false);
    }

    public static LinkEntry system(String name) {
        return new LinkEntry(name, Optional.empty(), Optional.empty(), true, false);
    }

    public static LinkEntry framework(String name) {
        return new LinkEntry(name, Optional.empty(), Optional.empty(), false, true);
    }

    public boolean isLocal() {
        return pathStatic.isPresent() || pathDynamic.isPresent();
    }

    public boolean hasType() {
        return isLocal() || system || framework;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        pathStatic.ifPresent(path -> map.put("path_static", path));
        pathDynamic.ifPresent(path -> map.put("path_dynamic", path));
        if (system) {
            map.put("system", true);
        }
        if (framework) {
            map.put("framework", true);
        }
        return map;
    }
}
