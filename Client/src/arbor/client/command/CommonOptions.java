package arbor.client.command;

import arbor.core.config.RunConfig;
import arbor.core.util.Logger;
import picocli.CommandLine;

import java.io.File;

/**
 * The arguments shared by every command: the directory to load tests from and the verbosity.
 */
public final class CommonOptions {

    @CommandLine.Parameters(index = "0", paramLabel = "DIRECTORY", description = "Directory holding the compiled tests and their jars.")
    File directory;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "DIR", description = "Directory the reports are written to (default: DIRECTORY/" + RunConfig.DEFAULT_OUTPUT_DIRECTORY_NAME + ").")
    File output;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Increase verbosity, repeatable (-v info, -vv debug).")
    boolean[] verbose = new boolean[0];

    @CommandLine.Option(names = "--no-color", description = "Disable colored output.")
    boolean noColor;

    public int verbosity() {
        return this.verbose.length;
    }

    /**
     * Returns a configuration builder pre-filled from these options, and applies the verbosity to the logger.
     *
     * @return the builder.
     */
    public RunConfig.Builder toConfigBuilder() {
        Logger.setVerbosity(verbosity());
        return RunConfig.Builder.newBuilder()
                .rootDirectory(this.directory)
                .outputDirectory(this.output)
                .verbosity(verbosity())
                .color(!this.noColor);
    }
}
