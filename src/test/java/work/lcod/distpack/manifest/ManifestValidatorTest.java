package work.lcod.distpack.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.distpack.support.DistpackTestSupport.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import work.lcod.distpack.catalog.ExtensionCatalog;

class ManifestValidatorTest {
    private static final ExtensionCatalog CATALOG = catalog("""
        _ssl:
          sources: [_ssl.c]
          links: [ssl]
        """);

    private static final ArtifactTree TREE = ArtifactTree.of(List.of("build/Python/ceval.o", "build/Modules/_ssl.o"));

    private static ExtensionBuildRecord record(List<String> objs, List<LinkEntry> links, List<String> licenses) {
        return new ExtensionBuildRecord(
            "default", false, "PyInit__ssl", links, objs, false,
            licenses, List.of(), licenses.isEmpty() ? Optional.empty() : Optional.of(false), Optional.empty(), Optional.empty()
        );
    }

    private static DistributionManifest manifest(List<String> coreObjs, Map<String, List<ExtensionBuildRecord>> extensions) {
        return new DistributionManifest(
            DistributionManifest.SCHEMA_VERSION, "x86_64-unknown-linux-gnu", "noopt", "3.12.4", ".so", "elf",
            coreObjs, List.of(), Optional.empty(), Optional.empty(), new TreeMap<>(extensions),
            List.of("builtin"), List.of("glibc-dynamic"), Map.of(), List.of(), Optional.empty()
        );
    }

    @Test
    void detectsPartitionViolations() {
        var manifest = manifest(
            List.of("build/Python/ceval.o", "build/Modules/_ssl.o"),
            Map.of("_ssl", List.of(record(List.of("build/Modules/_ssl.o"), List.of(), List.of())))
        );

        var error = assertThrows(InvalidManifestException.class, () -> ManifestValidator.validate(manifest, CATALOG, TREE));
        assertEquals("invalid_manifest", error.code());
        assertTrue(error.problems().get(0).contains("claimed by both core and _ssl/default"));
    }

    @Test
    void detectsUnaccountedObjectsAndUnknownExtensions() {
        var manifest = manifest(
            List.of("build/Python/ceval.o"),
            Map.of("_zstd", List.of(record(List.of(), List.of(), List.of())))
        );

        var error = assertThrows(InvalidManifestException.class, () -> ManifestValidator.validate(manifest, CATALOG, TREE));
        assertEquals(2, error.problems().size());
        assertTrue(error.problems().get(0).contains("_zstd"));
        assertTrue(error.problems().get(1).contains("build/Modules/_ssl.o"));
    }

    @Test
    void detectsUntypedLinks() {
        var untyped = new LinkEntry("ssl", Optional.empty(), Optional.empty(), false, false);
        var manifest = manifest(
            List.of("build/Python/ceval.o"),
            Map.of("_ssl", List.of(record(List.of("build/Modules/_ssl.o"), List.of(untyped), List.of())))
        );

        var error = assertThrows(InvalidManifestException.class, () -> ManifestValidator.validate(manifest, CATALOG, TREE));
        assertTrue(error.problems().get(0).contains("no link type"));
    }

    @Test
    void localLinkWithoutLicenseIsRejected() {
        var manifest = manifest(
            List.of("build/Python/ceval.o"),
            Map.of("_ssl", List.of(record(
                List.of("build/Modules/_ssl.o"),
                List.of(LinkEntry.localStatic("ssl", "build/lib/libssl.a")),
                List.of()
            )))
        );

        assertThrows(MissingLicenseException.class, () -> ManifestValidator.validate(manifest, CATALOG, TREE));
    }
}
