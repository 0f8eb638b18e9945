package work.lcod.distpack.manifest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Manifest entry for one variant of one extension module.
 *
 * @param licensePublicDomain present only when the record carries license attribution
 */
public record ExtensionBuildRecord(
    String variant,
    boolean inCore,
    String initFn,
    List<LinkEntry> links,
    List<String> objs,
    boolean required,
    List<String> licenses,
    List<String> licensePaths,
    Optional<Boolean> licensePublicDomain,
    Optional<String> sharedLib,
    Optional<String> staticLib
) {
    public ExtensionBuildRecord {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(initFn, "initFn");
        links = List.copyOf(links);
        objs = List.copyOf(objs);
        licenses = List.copyOf(licenses);
        licensePaths = List.copyOf(licensePaths);
        Objects.requireNonNull(licensePublicDomain, "licensePublicDomain");
        Objects.requireNonNull(sharedLib, "sharedLib");
        Objects.requireNonNull(staticLib, "staticLib");
    }

    /**
     * Entry for a module compiled into the core through the init table.
     */
    public static ExtensionBuildRecord inCore(String initFn, boolean required) {
        return new ExtensionBuildRecord(
            "default", true, initFn, List.of(), List.of(), required,
            List.of(), List.of(), Optional.empty(), Optional.empty(), Optional.empty()
        );
    }

    public boolean hasLocalLinks() {
        return links.stream().anyMatch(LinkEntry::isLocal);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("in_core", inCore);
        map.put("init_fn", initFn);
        map.put("links", links.stream().map(LinkEntry::toSerializableMap).collect(Collectors.toList()));
        map.put("objs", objs);
        map.put("required", required);
        map.put("variant", variant);
        if (licensePublicDomain.isPresent()) {
            map.put("licenses", licenses);
            map.put("license_paths", licensePaths);
            map.put("license_public_domain", licensePublicDomain.get());
        }
        sharedLib.ifPresent(path -> map.put("shared_lib", path));
        staticLib.ifPresent(path -> map.put("static_lib", path));
        return map;
    }
}
