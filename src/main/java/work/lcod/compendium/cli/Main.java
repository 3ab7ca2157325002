package work.lcod.compendium.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * The {@code compendium} command line with its subcommands and error handling installed.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CompendiumCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
