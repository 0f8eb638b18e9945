package work.lcod.distpack.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.distpack.shared.TargetTriple;

class CoreLinkPolicyTest {
    private static final TargetTriple LINUX = TargetTriple.of("x86_64-unknown-linux-gnu");
    private static final TargetTriple APPLE = TargetTriple.of("aarch64-apple-darwin");

    @Test
    void ignoresNonLinkFlags() {
        assertEquals(
            List.of(LinkEntry.system("pthread"), LinkEntry.system("m")),
            CoreLinkPolicy.coreLinks(LINUX, List.of("-Wl,--as-needed", "-lpthread", "-lm", "-lm", "-L/tools/deps/lib"))
        );
    }

    @Test
    void frameworksAreAllowedOnApple() {
        assertEquals(
            List.of(LinkEntry.system("System"), LinkEntry.framework("CoreFoundation")),
            CoreLinkPolicy.coreLinks(APPLE, List.of("-lSystem", "-framework", "CoreFoundation"))
        );
    }

    @Test
    void reportsEveryUnvettedLibrary() {
        var error = assertThrows(
            UnattributedLinkException.class,
            () -> CoreLinkPolicy.coreLinks(LINUX, List.of("-lm", "-lz", "-framework", "CoreFoundation"))
        );
        assertEquals(List.of("z", "CoreFoundation"), error.libraries());
        assertEquals("unattributed_link", error.code());

        assertThrows(UnattributedLinkException.class, () -> CoreLinkPolicy.coreLinks(APPLE, List.of("-lrt")));
    }
}
