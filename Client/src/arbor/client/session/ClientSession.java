package arbor.client.session;

import arbor.client.ExitCodes;
import arbor.core.config.RunConfig;
import arbor.core.loader.TestLoader;
import arbor.core.result.TestSuiteResult;
import arbor.core.runner.Runner;
import arbor.core.runner.Selection;
import arbor.core.suite.TestSuite;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Drives one invocation of the client: loads the tests described by a configuration, runs them and reports on them.
 */
public final class ClientSession {
    private static final Logger LOGGER = Logger.forClass(ClientSession.class);
    private final RunConfig config;
    private final ReportWriter reportWriter;

    private ClientSession(RunConfig config, ReportWriter reportWriter) {
        this.config = config;
        this.reportWriter = reportWriter;
    }

    public static ClientSession forConfig(RunConfig config, PrintStream console) {
        ObjectChecker.assertNonNull(config, console);
        LOGGER.debug("Configuration: " + config);
        return new ClientSession(config, ReportWriter.forConfig(config, console));
    }

    /**
     * Loads the tests under the root directory of the configuration. The caller closes the returned loader once the
     * loaded tests are no longer run.
     *
     * @return the loader holding the loaded tree.
     * @throws IOException If the root directory cannot be read.
     */
    public TestLoader load() throws IOException {
        TestLoader loader = TestLoader.create();
        loader.loadRoot(this.config.rootDirectory);
        return loader;
    }

    /**
     * Runs the selected part of the given tree, writes every report and returns the exit code for the run.
     *
     * @param root The root suite.
     * @param uids The selected uids, or an empty list to run everything.
     * @return the exit code.
     * @throws IOException If the reports cannot be written.
     */
    public int runAndReport(TestSuite root, List<String> uids) throws IOException {
        TestSuiteResult result = Runner.fromConfig(this.config).run(root, Selection.of(uids));
        this.reportWriter.writeAll(result);
        return ExitCodes.forOutcome(result.getOutcome());
    }

    public RunConfig getConfig() {
        return this.config;
    }

    public ReportWriter getReportWriter() {
        return this.reportWriter;
    }
}
