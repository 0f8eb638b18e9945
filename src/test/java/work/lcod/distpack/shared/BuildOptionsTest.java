package work.lcod.distpack.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BuildOptionsTest {
    @Test
    void parsesPlusJoinedFlags() {
        var options = BuildOptions.parse("lto+pgo");
        assertTrue(options.has(BuildOptions.Flag.PGO));
        assertTrue(options.has(BuildOptions.Flag.LTO));
        assertFalse(options.has(BuildOptions.Flag.DEBUG));
        assertEquals("pgo+lto", options.toString());
    }

    @Test
    void emptySetRendersAsNoopt() {
        assertEquals("noopt", BuildOptions.of().toString());
        assertEquals(BuildOptions.of(BuildOptions.Flag.DEBUG), BuildOptions.parse("debug"));
    }

    @Test
    void rejectsUnknownFlags() {
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.parse("debug+turbo"));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.parse(" "));
    }
}
