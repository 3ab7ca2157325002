package work.lcod.compendium.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] { "compendium (java) " + (implementationVersion != null ? implementationVersion : "development") };
    }
}
