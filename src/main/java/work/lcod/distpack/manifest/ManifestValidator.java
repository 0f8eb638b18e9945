package work.lcod.distpack.manifest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import work.lcod.distpack.catalog.ExtensionCatalog;

/**
 * Post-build checks over a finished manifest.
 */
public final class ManifestValidator {
    private ManifestValidator() {}

    public static void validate(DistributionManifest manifest, ExtensionCatalog catalog, ArtifactTree tree) {
        var problems = new ArrayList<String>();

        var missing = new TreeSet<>(manifest.extensions().keySet());
        missing.removeAll(catalog.names());
        if (!missing.isEmpty()) {
            problems.add("extension modules lack catalog metadata: " + String.join(", ", missing));
        }

        for (var entry : manifest.extensions().entrySet()) {
            String name = entry.getKey();
            for (ExtensionBuildRecord record : entry.getValue()) {
                for (LinkEntry link : record.links()) {
                    if (!link.hasType()) {
                        problems.add("link " + link.name() + " of extension " + name + " has no link type");
                    }
                }
                if (record.hasLocalLinks() && record.licenses().isEmpty() && !record.licensePublicDomain().orElse(false)) {
                    throw new MissingLicenseException(name, "Missing license annotations for extension " + name);
                }
            }
        }

        checkPartition(manifest, tree, problems);
        if (!problems.isEmpty()) {
            throw new InvalidManifestException(problems);
        }
    }

    private static void checkPartition(DistributionManifest manifest, ArtifactTree tree, List<String> problems) {
        Map<String, String> owners = new HashMap<>();
        for (String object : manifest.coreObjs()) {
            owners.put(object, "core");
        }
        for (var entry : manifest.extensions().entrySet()) {
            for (ExtensionBuildRecord record : entry.getValue()) {
                for (String object : record.objs()) {
                    String owner = entry.getKey() + "/" + record.variant();
                    String previous = owners.putIfAbsent(object, owner);
                    if (previous != null) {
                        problems.add("object " + object + " claimed by both " + previous + " and " + owner);
                    }
                }
            }
        }

        SortedSet<String> scanned = new TreeSet<>(tree.coreObjects());
        scanned.addAll(tree.moduleObjects());
        if (!scanned.equals(new TreeSet<>(owners.keySet()))) {
            var unaccounted = new TreeSet<>(scanned);
            unaccounted.removeAll(owners.keySet());
            var unknown = new TreeSet<>(owners.keySet());
            unknown.removeAll(scanned);
            problems.add("object partition mismatch (unaccounted " + unaccounted + ", not scanned " + unknown + ")");
        }
    }
}
