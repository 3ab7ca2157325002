package work.lcod.compendium.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.compendium.api.LogLevel;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.config.PackDefinition;
import work.lcod.compendium.config.ProjectConfig;
import work.lcod.compendium.config.ProjectConfigLoader;

/**
 * Shared plumbing of {@code compile} and {@code extract}: either explicit SRC and DEST, or packs looked up in
 * {@code compendium.toml}.
 */
abstract class PackCommand implements Callable<Integer> {
    static final String LOG_LEVEL_ENV = "COMPENDIUM_LOG_LEVEL";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "SRC", description = "Source location.")
    Path source;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "DEST", description = "Destination location.")
    Path destination;

    @CommandLine.Option(names = "--yaml", description = "Use YAML source files instead of JSON.")
    boolean yaml;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Project configuration (default: ./" + ProjectConfigLoader.DEFAULT_FILE + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path config;

    @CommandLine.Option(names = "--pack", paramLabel = "NAME", arity = "1..*", description = "Configured pack(s) to process.")
    List<String> packNames = new ArrayList<>();

    @CommandLine.Option(names = "--all", description = "Process every configured pack.")
    boolean all;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LoggingSetup.apply(resolveLogLevel());
        boolean configured = all || !packNames.isEmpty();
        if (configured && (source != null || destination != null)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "SRC and DEST cannot be combined with --pack or --all.");
        }
        if (!configured && (source == null || destination == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Provide SRC and DEST, or select packs with --pack or --all.");
        }

        if (!configured) {
            print(runDirect(source, destination));
            return 0;
        }
        ProjectConfig project = ProjectConfigLoader.load(config != null ? config : Path.of(ProjectConfigLoader.DEFAULT_FILE));
        List<PackDefinition> definitions = new ArrayList<>();
        if (all) {
            definitions.addAll(project.all());
        } else {
            for (String name : packNames) {
                definitions.add(project.pack(name));
            }
        }
        for (PackDefinition definition : definitions) {
            print(runConfigured(definition));
        }
        return 0;
    }

    /**
     * Runs with the options given on the command line.
     */
    protected abstract PackReport runDirect(Path source, Path destination) throws IOException;

    /**
     * Runs with the options of a pack declared in the project configuration.
     */
    protected abstract PackReport runConfigured(PackDefinition definition) throws IOException;

    private void print(PackReport report) {
        var out = spec.commandLine().getOut();
        out.println(report.toPrettyJson());
        out.flush();
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = "info";
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
