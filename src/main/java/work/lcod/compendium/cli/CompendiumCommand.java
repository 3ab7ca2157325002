package work.lcod.compendium.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "compendium",
    description = "Compile source files into compendium packs and extract them again.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        CompileCommand.class,
        ExtractCommand.class,
        CommandLine.HelpCommand.class
    }
)
final class CompendiumCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: compile or extract.");
    }
}
