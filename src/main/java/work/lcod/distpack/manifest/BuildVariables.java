package work.lcod.distpack.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Build variables the runtime reports about itself after the native build (ABI suffix, install
 * paths, flags used to link the core). Keys we do not consume are ignored.
 */
public record BuildVariables(
    String pythonVersion,
    String extSuffix,
    List<String> coreLinkFlags,
    Optional<String> staticLib,
    Optional<String> sharedLib,
    Optional<String> glibcMaxSymbolVersion,
    Optional<String> clangVersion,
    Map<String, String> paths
) {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    public BuildVariables {
        Objects.requireNonNull(pythonVersion, "pythonVersion");
        Objects.requireNonNull(extSuffix, "extSuffix");
        coreLinkFlags = List.copyOf(coreLinkFlags);
        Objects.requireNonNull(staticLib, "staticLib");
        Objects.requireNonNull(sharedLib, "sharedLib");
        Objects.requireNonNull(glibcMaxSymbolVersion, "glibcMaxSymbolVersion");
        Objects.requireNonNull(clangVersion, "clangVersion");
        paths = Collections.unmodifiableMap(new TreeMap<>(paths));
    }

    public static BuildVariables load(Path path) {
        try {
            return parse(Files.readAllBytes(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read build variables " + path, ex);
        }
    }

    public static BuildVariables parse(byte[] json) {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Build variables are not valid JSON: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Build variables must be a JSON object");
        }
        var paths = new TreeMap<String, String>();
        JsonNode pathsNode = root.path("paths");
        if (pathsNode.isObject()) {
            pathsNode.fields().forEachRemaining(entry -> paths.put(entry.getKey(), entry.getValue().asText()));
        }
        return new BuildVariables(
            required(root, "python_version"),
            required(root, "ext_suffix"),
            linkFlags(root.path("core_link_flags")),
            optional(root, "static_lib"),
            optional(root, "shared_lib"),
            optional(root, "glibc_max_symbol_version"),
            optional(root, "clang_version"),
            paths
        );
    }

    private static String required(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            throw new IllegalArgumentException("Build variables lack required string '" + key + "'");
        }
        return value.textValue();
    }

    private static Optional<String> optional(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    // Accepts either the raw LIBS string or an already split list.
    private static List<String> linkFlags(JsonNode node) {
        var flags = new ArrayList<String>();
        if (node.isTextual()) {
            for (String word : node.textValue().strip().split("\\s+")) {
                if (!word.isEmpty()) {
                    flags.add(word);
                }
            }
        } else if (node.isArray()) {
            node.forEach(item -> flags.add(item.asText()));
        }
        return flags;
    }
}
