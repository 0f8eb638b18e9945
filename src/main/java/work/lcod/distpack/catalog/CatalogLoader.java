package work.lcod.distpack.catalog;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import work.lcod.distpack.shared.TargetPatterns;

/**
 * Parses the YAML extension catalog and validates it against a closed schema. Every problem is
 * collected before failing so one run reports all typos at once.
 */
public final class CatalogLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
        .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    private static final Pattern MODULE_NAME = Pattern.compile("^[a-z_][a-z0-9_]*$");
    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+$");

    static final Set<String> RECIPE_KEYS = Set.of(
        "sources",
        "sources-conditional",
        "defines",
        "defines-conditional",
        "includes",
        "includes-conditional",
        "includes-deps",
        "links",
        "links-conditional",
        "linker-args",
        "frameworks"
    );

    static final Set<String> ENTRY_KEYS = Set.of(
        "sources",
        "sources-conditional",
        "defines",
        "defines-conditional",
        "includes",
        "includes-conditional",
        "includes-deps",
        "links",
        "links-conditional",
        "linker-args",
        "frameworks",
        "build-mode",
        "disabled-targets",
        "required-targets",
        "minimum-python-version",
        "maximum-python-version",
        "setup-enabled",
        "setup-enabled-conditional",
        "config-c-only",
        "variants"
    );

    private static final Set<String> CONDITION_KEYS = Set.of(
        "targets",
        "minimum-python-version",
        "maximum-python-version"
    );

    private CatalogLoader() {}

    public static ExtensionCatalog load(Path path) {
        try {
            return load(Files.readAllBytes(path));
        } catch (IOException ex) {
            throw new SchemaViolationException("unable to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static ExtensionCatalog load(byte[] document) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(document);
        } catch (IOException ex) {
            throw new SchemaViolationException("not a valid YAML document: " + ex.getMessage(), ex);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new ExtensionCatalog(List.of());
        }
        if (!root.isObject()) {
            throw new SchemaViolationException(List.of("top-level document must be a mapping"));
        }

        var violations = new ArrayList<String>();
        var specs = new ArrayList<ExtensionModuleSpec>();
        var fields = root.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String name = field.getKey();
            if (!MODULE_NAME.matcher(name).matches()) {
                violations.add("module name '" + name + "' must match " + MODULE_NAME.pattern());
                continue;
            }
            var reader = new EntryReader(name, violations);
            ExtensionModuleSpec spec = reader.readEntry(field.getValue());
            if (spec != null) {
                specs.add(spec);
            }
        }
        if (!violations.isEmpty()) {
            throw new SchemaViolationException(violations);
        }
        return new ExtensionCatalog(specs);
    }

    private static final class EntryReader {
        private final String name;
        private final List<String> violations;

        private EntryReader(String name, List<String> violations) {
            this.name = name;
            this.violations = violations;
        }

        ExtensionModuleSpec readEntry(JsonNode node) {
            if (node == null || node.isNull()) {
                return ExtensionModuleSpec.builder(name).build();
            }
            if (!node.isObject()) {
                violations.add(name + ": entry must be a mapping");
                return null;
            }
            if (!checkKeys(node, ENTRY_KEYS, name)) {
                return null;
            }

            var builder = ExtensionModuleSpec.builder(name)
                .recipe(readRecipe(node, name))
                .setupEnabled(readBoolean(node, "setup-enabled"))
                .configCOnly(readBoolean(node, "config-c-only"))
                .setupEnabledConditional(readConditionals(node, "setup-enabled-conditional", null, name))
                .minimumVersion(readVersion(node, "minimum-python-version", name))
                .maximumVersion(readVersion(node, "maximum-python-version", name))
                .disabledTargets(readPatterns(node, "disabled-targets", name))
                .requiredTargets(readPatterns(node, "required-targets", name));

            JsonNode buildMode = node.get("build-mode");
            if (buildMode != null) {
                if (!buildMode.isTextual()) {
                    violations.add(name + ": build-mode must be a string");
                } else {
                    try {
                        builder.buildMode(BuildMode.from(buildMode.textValue()));
                    } catch (IllegalArgumentException ex) {
                        violations.add(name + ": " + ex.getMessage());
                    }
                }
            }

            JsonNode variants = node.get("variants");
            if (variants != null) {
                if (!variants.isObject() || variants.isEmpty()) {
                    violations.add(name + ": variants must be a non-empty mapping");
                } else {
                    var entries = variants.fields();
                    while (entries.hasNext()) {
                        var variant = entries.next();
                        String where = name + "{" + variant.getKey() + "}";
                        if (!MODULE_NAME.matcher(variant.getKey()).matches()
                            || ExtensionModuleSpec.DEFAULT_VARIANT.equals(variant.getKey())) {
                            violations.add(where + ": invalid variant tag");
                            continue;
                        }
                        if (!variant.getValue().isObject()) {
                            violations.add(where + ": variant must be a mapping");
                            continue;
                        }
                        if (checkKeys(variant.getValue(), RECIPE_KEYS, where)) {
                            BuildRecipe recipe = readRecipe(variant.getValue(), where);
                            if (!recipe.declaresSources()) {
                                violations.add(where + ": variant must declare sources");
                            }
                            builder.variant(variant.getKey(), recipe);
                        }
                    }
                }
            }
            return builder.build();
        }

        private BuildRecipe readRecipe(JsonNode node, String where) {
            return new BuildRecipe(
                readStrings(node, "sources", where),
                readConditionals(node, "sources-conditional", "source", where),
                readStrings(node, "defines", where),
                readConditionals(node, "defines-conditional", "define", where),
                readStrings(node, "includes", where),
                readConditionals(node, "includes-conditional", "path", where),
                readStrings(node, "includes-deps", where),
                readStrings(node, "links", where),
                readConditionals(node, "links-conditional", "name", where),
                readLinkerArgs(node, where),
                readStrings(node, "frameworks", where)
            );
        }

        private boolean checkKeys(JsonNode node, Set<String> allowed, String where) {
            boolean valid = true;
            var names = node.fieldNames();
            while (names.hasNext()) {
                String key = names.next();
                if (!allowed.contains(key)) {
                    violations.add(where + ": unknown key '" + key + "'");
                    valid = false;
                }
            }
            return valid;
        }

        private boolean readBoolean(JsonNode node, String key) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return false;
            }
            if (!value.isBoolean()) {
                violations.add(name + ": " + key + " must be a boolean");
                return false;
            }
            return value.booleanValue();
        }

        private String readVersion(JsonNode node, String key, String where) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return null;
            }
            if (!value.isTextual()) {
                violations.add(where + ": " + key + " must be a quoted major.minor string");
                return null;
            }
            if (!VERSION.matcher(value.textValue()).matches()) {
                violations.add(where + ": " + key + " must look like major.minor, got '" + value.textValue() + "'");
                return null;
            }
            return value.textValue();
        }

        private List<String> readStrings(JsonNode node, String key, String where) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return List.of();
            }
            if (!value.isArray()) {
                violations.add(where + ": " + key + " must be a list of strings");
                return List.of();
            }
            var result = new ArrayList<String>();
            for (JsonNode item : value) {
                if (!item.isTextual() || item.textValue().isBlank()) {
                    violations.add(where + ": " + key + " entries must be non-empty strings");
                    continue;
                }
                result.add(item.textValue());
            }
            return result;
        }

        private List<String> readPatterns(JsonNode node, String key, String where) {
            var patterns = readStrings(node, key, where);
            for (String pattern : patterns) {
                try {
                    TargetPatterns.checkSyntax(pattern);
                } catch (IllegalArgumentException ex) {
                    violations.add(where + ": " + ex.getMessage());
                }
            }
            return patterns;
        }

        private List<ConditionalEntry> readConditionals(JsonNode node, String key, String valueKey, String where) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                return List.of();
            }
            if (!value.isArray()) {
                violations.add(where + ": " + key + " must be a list of mappings");
                return List.of();
            }
            var result = new ArrayList<ConditionalEntry>();
            for (JsonNode item : value) {
                String location = where + ": " + key;
                if (!item.isObject()) {
                    violations.add(location + " entries must be mappings");
                    continue;
                }
                var allowed = new HashSet<>(CONDITION_KEYS);
                if (valueKey != null) {
                    allowed.add(valueKey);
                }
                if (!checkKeys(item, allowed, location)) {
                    continue;
                }
                List<String> values = List.of();
                if (valueKey != null) {
                    JsonNode raw = item.get(valueKey);
                    if (raw == null || !raw.isTextual() || raw.textValue().isBlank()) {
                        violations.add(location + " entries require a string '" + valueKey + "'");
                        continue;
                    }
                    values = List.of(raw.textValue());
                }
                result.add(new ConditionalEntry(
                    values,
                    readPatterns(item, "targets", location),
                    Optional.ofNullable(readVersion(item, "minimum-python-version", location)),
                    Optional.ofNullable(readVersion(item, "maximum-python-version", location))
                ));
            }
            return result;
        }

        private List<ConditionalEntry> readLinkerArgs(JsonNode node, String where) {
            JsonNode value = node.get("linker-args");
            if (value == null || value.isNull()) {
                return List.of();
            }
            if (!value.isArray()) {
                violations.add(where + ": linker-args must be a list of mappings");
                return List.of();
            }
            var result = new ArrayList<ConditionalEntry>();
            for (JsonNode item : value) {
                String location = where + ": linker-args";
                if (!item.isObject()) {
                    violations.add(location + " entries must be mappings");
                    continue;
                }
                if (!checkKeys(item, Set.of("args", "targets"), location)) {
                    continue;
                }
                List<String> args = readStrings(item, "args", location);
                if (args.isEmpty()) {
                    violations.add(location + " entries require a non-empty 'args' list");
                    continue;
                }
                List<String> targets = readPatterns(item, "targets", location);
                if (targets.isEmpty()) {
                    violations.add(location + " entries require 'targets'");
                    continue;
                }
                result.add(new ConditionalEntry(args, targets, Optional.empty(), Optional.empty()));
            }
            return result;
        }
    }
}
