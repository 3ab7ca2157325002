package work.lcod.compendium.cli;

import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.compendium.api.CompileOptions;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.api.Packs;
import work.lcod.compendium.config.PackDefinition;

@CommandLine.Command(
    name = "compile",
    description = "Compile source files (SRC) into a pack directory (DEST).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CompileCommand extends PackCommand {
    @CommandLine.Option(names = {"-r", "--recursive"}, description = "Also read source files in subdirectories.")
    boolean recursive;

    @Override
    protected PackReport runDirect(Path source, Path destination) throws IOException {
        var options = CompileOptions.builder()
            .yaml(yaml)
            .recursive(recursive)
            .build();
        return Packs.compilePack(source, destination, options);
    }

    @Override
    protected PackReport runConfigured(PackDefinition definition) throws IOException {
        return Packs.compilePack(definition.source(), definition.pack(), definition.toCompileOptions());
    }
}
