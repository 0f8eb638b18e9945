package work.lcod.distpack.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregate description of one built distribution, serialized as {@code PYTHON.json}.
 */
public record DistributionManifest(
    String version,
    String targetTriple,
    String buildOptions,
    String pythonVersion,
    String pythonExtensionSuffix,
    String objectFileFormat,
    List<String> coreObjs,
    List<LinkEntry> coreLinks,
    Optional<String> coreStaticLib,
    Optional<String> coreSharedLib,
    SortedMap<String, List<ExtensionBuildRecord>> extensions,
    List<String> extensionModuleLoading,
    List<String> crtFeatures,
    Map<String, String> paths,
    List<String> licenses,
    Optional<String> licensePath
) {
    public static final String SCHEMA_VERSION = "8";

    public DistributionManifest {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(targetTriple, "targetTriple");
        Objects.requireNonNull(buildOptions, "buildOptions");
        Objects.requireNonNull(pythonVersion, "pythonVersion");
        Objects.requireNonNull(pythonExtensionSuffix, "pythonExtensionSuffix");
        Objects.requireNonNull(objectFileFormat, "objectFileFormat");
        coreObjs = List.copyOf(coreObjs);
        coreLinks = List.copyOf(coreLinks);
        Objects.requireNonNull(coreStaticLib, "coreStaticLib");
        Objects.requireNonNull(coreSharedLib, "coreSharedLib");
        var copy = new TreeMap<String, List<ExtensionBuildRecord>>();
        extensions.forEach((name, records) -> copy.put(name, List.copyOf(records)));
        extensions = Collections.unmodifiableSortedMap(copy);
        extensionModuleLoading = List.copyOf(extensionModuleLoading);
        crtFeatures = List.copyOf(crtFeatures);
        paths = Collections.unmodifiableMap(new TreeMap<>(paths));
        licenses = List.copyOf(licenses);
        Objects.requireNonNull(licensePath, "licensePath");
    }

    public List<ExtensionBuildRecord> records(String extension) {
        return extensions.getOrDefault(extension, List.of());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> core = new LinkedHashMap<>();
        core.put("objs", coreObjs);
        core.put("links", coreLinks.stream().map(LinkEntry::toSerializableMap).collect(Collectors.toList()));
        coreStaticLib.ifPresent(path -> core.put("static_lib", path));
        coreSharedLib.ifPresent(path -> core.put("shared_lib", path));

        Map<String, Object> extensionMaps = new LinkedHashMap<>();
        extensions.forEach((name, records) -> extensionMaps.put(
            name,
            records.stream().map(ExtensionBuildRecord::toSerializableMap).collect(Collectors.toList())
        ));

        Map<String, Object> buildInfo = new LinkedHashMap<>();
        buildInfo.put("core", core);
        buildInfo.put("extensions", extensionMaps);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", version);
        map.put("target_triple", targetTriple);
        map.put("build_options", buildOptions);
        map.put("python_version", pythonVersion);
        map.put("python_extension_module_suffix", pythonExtensionSuffix);
        map.put("python_extension_module_loading", extensionModuleLoading);
        map.put("object_file_format", objectFileFormat);
        map.put("crt_features", crtFeatures);
        if (!paths.isEmpty()) {
            map.put("python_paths", paths);
        }
        map.put("build_info", buildInfo);
        map.put("licenses", licenses);
        licensePath.ifPresent(path -> map.put("license_path", path));
        return map;
    }
}
