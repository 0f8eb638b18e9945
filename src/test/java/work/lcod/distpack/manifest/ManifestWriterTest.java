package work.lcod.distpack.manifest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestWriterTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static DistributionManifest manifest() {
        var zlib = new ExtensionBuildRecord(
            "default", false, "PyInit_zlib",
            List.of(LinkEntry.localStatic("z", "build/lib/libz.a")),
            List.of("build/Modules/zlibmodule.o"), false,
            List.of("Zlib"), List.of("licenses/LICENSE.zlib.txt"), Optional.of(false), Optional.empty(), Optional.empty()
        );
        var extensions = new TreeMap<String, List<ExtensionBuildRecord>>();
        extensions.put("zlib", List.of(zlib));
        extensions.put("marshal", List.of(ExtensionBuildRecord.inCore("PyMarshal_Init", false)));
        return new DistributionManifest(
            DistributionManifest.SCHEMA_VERSION, "x86_64-unknown-linux-gnu", "pgo+lto", "3.12.4", ".cpython-312-x86_64-linux-gnu.so",
            "llvm-bitcode:18.1.8", List.of("build/Python/ceval.o"), List.of(LinkEntry.system("m")),
            Optional.of("install/lib/libpython3.12.a"), Optional.empty(), extensions,
            List.of("builtin", "shared-library"), List.of("glibc-dynamic"), Map.of(), List.of("Python-2.0"), Optional.empty()
        );
    }

    @Test
    void writesSortedPrettyJson() throws Exception {
        String json = ManifestWriter.toJson(manifest());

        assertTrue(json.endsWith("}\n"));
        var root = MAPPER.readTree(json);
        var names = new ArrayList<String>();
        root.fieldNames().forEachRemaining(names::add);
        assertEquals(names.stream().sorted().collect(Collectors.toList()), names);
        assertEquals("8", root.get("version").asText());
        assertFalse(root.has("python_paths"));
        assertFalse(root.has("license_path"));

        var core = root.get("build_info").get("core");
        assertEquals("install/lib/libpython3.12.a", core.get("static_lib").asText());
        assertTrue(core.get("links").get(0).get("system").asBoolean());

        var zlib = root.get("build_info").get("extensions").get("zlib").get(0);
        assertEquals("build/lib/libz.a", zlib.get("links").get(0).get("path_static").asText());
        assertFalse(zlib.get("links").get(0).has("system"));
        assertEquals("Zlib", zlib.get("licenses").get(0).asText());
        assertFalse(zlib.get("license_public_domain").asBoolean());

        var marshal = root.get("build_info").get("extensions").get("marshal").get(0);
        assertTrue(marshal.get("in_core").asBoolean());
        assertFalse(marshal.has("licenses"));
    }

    @Test
    void outputIsStableAcrossRuns(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("python").resolve(ManifestWriter.FILE_NAME);
        ManifestWriter.write(manifest(), target);

        assertArrayEquals(ManifestWriter.toBytes(manifest()), Files.readAllBytes(target));
    }
}
