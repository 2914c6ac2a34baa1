package arbor.client;

import arbor.client.command.ListCommand;
import arbor.client.command.RerunCommand;
import arbor.client.command.RunCommand;
import arbor.core.exception.CycleException;
import arbor.core.util.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * The command-line entry point: {@code arbor run}, {@code arbor rerun} and {@code arbor list}.
 */
@CommandLine.Command(name = "arbor", mixinStandardHelpOptions = true, version = "arbor 0.1.0",
        description = "Runs trees of test suites and reports their results.",
        subcommands = {
                CommandLine.HelpCommand.class, RunCommand.class, RerunCommand.class, ListCommand.class
        })
public final class ArborClient implements Callable<Integer> {
    private static final Logger LOGGER = Logger.forClass(ArborClient.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * Returns the command line of the client, with invalid configurations mapped to {@link ExitCodes#USAGE}.
     *
     * @return the command line.
     */
    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new ArborClient());
        commandLine.setExecutionExceptionHandler((exception, failedCommand, parseResult) -> {
            if (exception instanceof IllegalArgumentException || exception instanceof CycleException) {
                LOGGER.warn("Invalid configuration: " + exception.getMessage());
                return ExitCodes.USAGE;
            }
            LOGGER.warn("Unexpected failure: " + exception);
            LOGGER.debug("Unexpected failure", exception);
            return ExitCodes.FAILURE;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        this.spec.commandLine().usage(System.err);
        return ExitCodes.USAGE;
    }
}
