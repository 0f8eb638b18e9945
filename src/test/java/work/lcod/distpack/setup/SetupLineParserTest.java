package work.lcod.distpack.setup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SetupLineParserTest {
    @Test
    void splitsLineIntoStructuredFields() {
        var line = SetupLineParser.parse(
            "_ssl _ssl.c -I/tools/deps/include -DUSE_SSL -lssl -lcrypto -framework Security # trailing"
        ).orElseThrow();

        assertEquals("_ssl", line.module());
        assertEquals(List.of("_ssl.c"), line.sources());
        assertEquals(List.of("/tools/deps/include"), line.includes());
        assertEquals(List.of("USE_SSL"), line.defines());
        assertEquals(List.of("ssl", "crypto"), List.copyOf(line.linkNames()));
        assertEquals(List.of("Security"), line.frameworks());
        assertTrue(line.otherArgs().isEmpty());
    }

    @Test
    void recognizesHiddenAndArchiveLinks() {
        var line = SetupLineParser.parse(
            "_lzma _lzmamodule.c -Xlinker -hidden-llzma /tools/deps/lib/libbz2.a -Xlinker -export_dynamic"
        ).orElseThrow();

        assertEquals(2, line.links().size());
        assertEquals(new LinkToken("lzma", LinkToken.Kind.HIDDEN_LIBRARY, "-Xlinker -hidden-llzma"), line.links().get(0));
        assertEquals(new LinkToken("bz2", LinkToken.Kind.ARCHIVE_PATH, "/tools/deps/lib/libbz2.a"), line.links().get(1));
        assertEquals(List.of("-Xlinker", "-export_dynamic"), line.otherArgs());
    }

    @Test
    void commentsAndBlankLinesYieldNothing() {
        assertTrue(SetupLineParser.parse("# zlib zlibmodule.c -lz").isEmpty());
        assertTrue(SetupLineParser.parse("   ").isEmpty());
    }

    @Test
    void objectPathsKeepSourceDirectories() {
        var line = SetupLineParser.parse("_decimal _decimal/_decimal.c _decimal/libmpdec/basearith.c").orElseThrow();
        assertEquals(
            List.of("Modules/_decimal/_decimal.o", "Modules/_decimal/libmpdec/basearith.o"),
            line.objectPaths()
        );
    }

    @Test
    void bareArchiveNameStripsPrefixAndSuffix() {
        assertEquals("z", LinkToken.archiveBareName("build/lib/libz.a"));
        assertEquals("ffi", LinkToken.archiveBareName("libffi.a"));
    }
}
