package arbor.client.command;

import arbor.client.ExitCodes;
import arbor.client.session.ClientSession;
import arbor.core.config.RunConfig;
import arbor.core.loader.TestLoader;
import arbor.core.output.FlatSuite;
import arbor.core.output.ResultFlattener;
import arbor.core.result.Outcome;
import arbor.core.result.TestSuiteResult;
import arbor.core.suite.TestSuite;
import arbor.core.util.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "rerun", mixinStandardHelpOptions = true, description = "Run again the suites that failed or errored in the previous run.")
public final class RerunCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.forClass(RerunCommand.class);

    @CommandLine.Mixin
    CommonOptions options = new CommonOptions();

    @Override
    public Integer call() throws Exception {
        RunConfig config = this.options.toConfigBuilder().build();
        ClientSession session = ClientSession.forConfig(config, System.out);
        TestSuiteResult previous = session.getReportWriter().readPreviousResults();

        try (TestLoader loader = session.load()) {
            TestSuite root = loader.getRoot();
            List<String> uids = failedSuiteUids(previous, root);
            if (uids.isEmpty()) {
                LOGGER.warn("Nothing to rerun: no suite of the previous run failed or errored.");
                return ExitCodes.SUCCESS;
            }

            LOGGER.log("Rerunning " + uids.size() + " suite(s): " + uids);
            return session.runAndReport(root, uids);
        }
    }

    /**
     * Returns the uids of the flattened suites of the previous run that failed or errored and that still exist in the
     * freshly loaded tree.
     *
     * @param previous The previous result tree.
     * @param root The freshly loaded tree.
     * @return the uids to rerun.
     */
    static List<String> failedSuiteUids(TestSuiteResult previous, TestSuite root) {
        List<String> uids = new ArrayList<>();
        for (FlatSuite suite : ResultFlattener.flatten(previous)) {
            Outcome outcome = suite.getOutcome();
            if (outcome != Outcome.FAIL && outcome != Outcome.ERROR) {
                continue;
            }
            if (root.findByUid(suite.uid) == null) {
                LOGGER.warn("Suite '" + suite.uid + "' of the previous run no longer exists.");
                continue;
            }
            uids.add(suite.uid);
        }
        return uids;
    }
}
