package arbor.client.session;

import arbor.core.config.RunConfig;
import arbor.core.exception.ParseException;
import arbor.core.output.ConsoleFormatter;
import arbor.core.output.JUnitFormatter;
import arbor.core.output.ResultSnapshot;
import arbor.core.output.Terminal;
import arbor.core.result.TestSuiteResult;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Writes the artifacts of a run: the JUnit report and the result snapshot in the output directory, and the console
 * summary on the given stream.
 */
public final class ReportWriter {
    public static final String JUNIT_FILE_NAME = "junit.xml";
    public static final String SNAPSHOT_FILE_NAME = "results.json";
    private static final Logger LOGGER = Logger.forClass(ReportWriter.class);
    private final RunConfig config;
    private final PrintStream console;

    private ReportWriter(RunConfig config, PrintStream console) {
        this.config = config;
        this.console = console;
    }

    public static ReportWriter forConfig(RunConfig config, PrintStream console) {
        ObjectChecker.assertNonNull(config, console);
        return new ReportWriter(config, console);
    }

    /**
     * Writes every artifact of the given run.
     *
     * @param result The root of the result tree.
     * @throws IOException If an artifact cannot be written.
     */
    public void writeAll(TestSuiteResult result) throws IOException {
        ObjectChecker.assertNonNull(result);
        writeConsoleSummary(result);

        File outputDirectory = this.config.outputDirectory;
        Files.createDirectories(outputDirectory.toPath());

        JUnitFormatter junit = this.config.translateNames ? JUnitFormatter.translatingNames() : JUnitFormatter.keepingNames();
        File junitFile = new File(outputDirectory, JUNIT_FILE_NAME);
        try (Writer writer = Files.newBufferedWriter(junitFile.toPath(), StandardCharsets.UTF_8)) {
            junit.format(result, writer);
        }
        LOGGER.log("Wrote " + junitFile);

        File snapshotFile = new File(outputDirectory, SNAPSHOT_FILE_NAME);
        try (Writer writer = Files.newBufferedWriter(snapshotFile.toPath(), StandardCharsets.UTF_8)) {
            ResultSnapshot.create().format(result, writer);
        }
        LOGGER.log("Wrote " + snapshotFile);
    }

    /**
     * Prints the console summary of the given run.
     *
     * @param result The root of the result tree.
     * @throws IOException If the summary cannot be written.
     */
    public void writeConsoleSummary(TestSuiteResult result) throws IOException {
        ConsoleFormatter formatter = ConsoleFormatter.withSettings(this.config.verbosity, Terminal.displayWidth(), this.config.color);
        Writer writer = new OutputStreamWriter(this.console, StandardCharsets.UTF_8);
        formatter.format(result, writer);
    }

    /**
     * Reads the snapshot a previous run left in the output directory.
     *
     * @return the previous result tree.
     * @throws IOException If there is no snapshot or it cannot be read.
     * @throws ParseException If the snapshot is malformed.
     */
    public TestSuiteResult readPreviousResults() throws IOException, ParseException {
        File snapshotFile = new File(this.config.outputDirectory, SNAPSHOT_FILE_NAME);
        if (!snapshotFile.isFile()) {
            throw new IOException("no previous results at " + snapshotFile);
        }
        try (Reader reader = Files.newBufferedReader(snapshotFile.toPath(), StandardCharsets.UTF_8)) {
            return ResultSnapshot.create().read(reader);
        }
    }
}
