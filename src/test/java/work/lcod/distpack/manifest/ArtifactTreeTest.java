package work.lcod.distpack.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.distpack.support.DistpackTestSupport;

class ArtifactTreeTest {
    private static final ArtifactTree TREE = ArtifactTree.of(List.of(
        "build/Objects/listobject.o",
        "build/Python/ceval.o",
        "build/Modules/_io/fileio.o",
        "build/Modules/config.c",
        "build/Programs/python.o",
        "build/lib/libssl.a",
        "build/lib/libcrypto.a",
        "build/lib/pkgconfig/libffi.a",
        "build/lib/tcl8.6.a",
        "build/lib/README"
    ));

    @Test
    void classifiesObjects() {
        assertEquals(Set.of("build/Objects/listobject.o", "build/Python/ceval.o"), TREE.coreObjects());
        assertEquals(Set.of("build/Modules/_io/fileio.o"), TREE.moduleObjects());
        assertEquals(4, TREE.objects().size());
    }

    @Test
    void indexesTopLevelStaticLibraries() {
        assertEquals(
            Map.of("crypto", "build/lib/libcrypto.a", "ssl", "build/lib/libssl.a"),
            TREE.staticLibraries()
        );
    }

    @Test
    void scanRecordsRelativePathsAndSizes(@TempDir Path dir) {
        DistpackTestSupport.write(dir, "build/Modules/_io/fileio.o", "12345");
        DistpackTestSupport.write(dir, "build/lib/libz.a", "");

        var tree = ArtifactTree.scan(dir);
        assertEquals(Map.of("build/Modules/_io/fileio.o", 5L, "build/lib/libz.a", 0L), tree.files());
        assertEquals(Map.of("z", "build/lib/libz.a"), tree.staticLibraries());
    }
}
