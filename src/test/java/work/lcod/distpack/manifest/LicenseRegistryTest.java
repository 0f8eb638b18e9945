package work.lcod.distpack.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.distpack.support.DistpackTestSupport;

class LicenseRegistryTest {
    private static final String TOML = """
        [packages.openssl]
        version = "3.0.13"
        library_names = ["crypto", "ssl"]
        licenses = ["Apache-2.0"]
        license_file = "LICENSE.openssl-3.txt"

        [packages.libressl]
        library_names = ["crypto", "ssl", "tls"]

        [packages.sqlite]
        library_names = ["sqlite3"]
        licenses = []
        license_public_domain = true
        """;

    @Test
    void parsesPackageTables() {
        var registry = LicenseRegistry.parse(TOML);

        assertEquals(3, registry.size());
        var openssl = registry.find("openssl").orElseThrow();
        assertEquals(Optional.of("3.0.13"), openssl.version());
        assertEquals(List.of("crypto", "ssl"), openssl.libraryNames());
        assertEquals(Optional.of(List.of("Apache-2.0")), openssl.licenses());
        assertEquals(Optional.of("licenses/LICENSE.openssl-3.txt"), openssl.licensePath());
        assertTrue(registry.find("sqlite").orElseThrow().publicDomain());
        assertEquals(Optional.empty(), registry.find("zlib"));
    }

    @Test
    void providersRequireDeclaredLicenses() {
        var registry = LicenseRegistry.parse(TOML);

        assertEquals(
            List.of("openssl"),
            registry.providersOf("ssl").stream().map(LicenseRegistry.PackageLicense::key).collect(Collectors.toList())
        );
        assertTrue(registry.providersOf("tls").isEmpty());
        assertEquals(1, registry.providersOf("sqlite3").size());
    }

    @Test
    void rejectsMalformedToml() {
        assertThrows(IllegalArgumentException.class, () -> LicenseRegistry.parse("[packages.zlib\nlicenses = ["));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) {
        DistpackTestSupport.write(dir, "licenses.toml", TOML);

        assertEquals(3, LicenseRegistry.load(dir.resolve("licenses.toml")).size());
    }
}
