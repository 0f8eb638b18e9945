package work.lcod.distpack.cli;

import picocli.CommandLine;
import work.lcod.distpack.manifest.DistributionManifest;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "distpack (java) " + (implementationVersion != null ? implementationVersion : "development"),
            "PYTHON.json schema " + DistributionManifest.SCHEMA_VERSION
        };
    }
}
