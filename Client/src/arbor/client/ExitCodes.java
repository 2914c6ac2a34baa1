package arbor.client;

import arbor.core.result.Outcome;
import arbor.core.util.ObjectChecker;

/**
 * The exit codes of the client.
 */
public final class ExitCodes {
    /** Everything ran and nothing failed (skipped tests do not count as failures). */
    public static final int SUCCESS = 0;
    /** Something failed or errored, or the reports could not be written. */
    public static final int FAILURE = 1;
    /** The command line or the configuration it describes is invalid. */
    public static final int USAGE = 2;

    private ExitCodes() {}

    /**
     * Returns the exit code for a run whose root suite ended with the given outcome.
     *
     * @param outcome The outcome of the root suite.
     * @return the exit code.
     */
    public static int forOutcome(Outcome outcome) {
        ObjectChecker.assertNonNull(outcome);
        switch (outcome) {
            case PASS:
            case XFAIL:
            case SKIP:
                return SUCCESS;
            default:
                return FAILURE;
        }
    }
}
