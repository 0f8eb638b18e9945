package work.lcod.distpack.manifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Package registry loaded from TOML {@code [packages.<key>]} tables, used to attribute licenses to
 * the libraries a distribution links.
 */
public final class LicenseRegistry {
    private final Map<String, PackageLicense> packages;

    public LicenseRegistry(Map<String, PackageLicense> packages) {
        this.packages = Collections.unmodifiableMap(new TreeMap<>(packages));
    }

    public static LicenseRegistry empty() {
        return new LicenseRegistry(Map.of());
    }

    public static LicenseRegistry load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read license registry " + path, ex);
        }
    }

    public static LicenseRegistry parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid license registry: " + errors);
        }
        TomlTable table = result.getTable("packages");
        var packages = new TreeMap<String, PackageLicense>();
        if (table != null) {
            for (String key : table.keySet()) {
                TomlTable entry = table.getTable(List.of(key));
                if (entry == null) {
                    throw new IllegalArgumentException("packages." + key + " must be a table");
                }
                packages.put(key, new PackageLicense(
                    key,
                    Optional.ofNullable(entry.getString("version")),
                    strings(entry.getArray("library_names")),
                    entry.contains("licenses") ? Optional.of(strings(entry.getArray("licenses"))) : Optional.empty(),
                    Optional.ofNullable(entry.getString("license_file")),
                    Boolean.TRUE.equals(entry.getBoolean("license_public_domain"))
                ));
            }
        }
        return new LicenseRegistry(packages);
    }

    public Optional<PackageLicense> find(String key) {
        return Optional.ofNullable(packages.get(key));
    }

    /**
     * Packages that provide {@code libraryName} and declare licenses. Packages without a
     * {@code licenses} key stay unattributed.
     */
    public List<PackageLicense> providersOf(String libraryName) {
        var providers = new ArrayList<PackageLicense>();
        for (PackageLicense license : packages.values()) {
            if (license.libraryNames().contains(libraryName) && license.licenses().isPresent()) {
                providers.add(license);
            }
        }
        return providers;
    }

    public int size() {
        return packages.size();
    }

    private static List<String> strings(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        var values = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    /**
     * @param licenses SPDX identifiers; empty when the package does not declare any
     * @param licenseFile file name under {@code licenses/} in the distribution
     */
    public record PackageLicense(
        String key,
        Optional<String> version,
        List<String> libraryNames,
        Optional<List<String>> licenses,
        Optional<String> licenseFile,
        boolean publicDomain
    ) {
        public PackageLicense {
            libraryNames = List.copyOf(libraryNames);
            licenses = licenses.map(List::copyOf);
        }

        public Optional<String> licensePath() {
            return licenseFile.map(file -> "licenses/" + file);
        }
    }
}
