package work.lcod.distpack.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import work.lcod.distpack.shared.AtomicFiles;

/**
 * Serializes manifests as pretty-printed JSON with keys in sorted order.
 */
public final class ManifestWriter {
    public static final String FILE_NAME = "PYTHON.json";

    private static final ObjectWriter WRITER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .writerWithDefaultPrettyPrinter();

    private ManifestWriter() {}

    public static String toJson(DistributionManifest manifest) {
        try {
            return WRITER.writeValueAsString(manifest.toSerializableMap()) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize manifest: " + ex.getOriginalMessage(), ex);
        }
    }

    public static byte[] toBytes(DistributionManifest manifest) {
        return toJson(manifest).getBytes(StandardCharsets.UTF_8);
    }

    public static void write(DistributionManifest manifest, Path target) {
        AtomicFiles.write(target, toBytes(manifest));
    }
}
