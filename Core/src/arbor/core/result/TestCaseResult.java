package arbor.core.result;

import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

/**
 * The result of running one test case.
 *
 * While the test runs its body may record an explicit outcome and reason on this object; once the runner returns the
 * result it is sealed.
 */
public final class TestCaseResult extends ResultNode {
    private Outcome outcome = null;
    private String reason = null;

    private TestCaseResult(String name, String uid, Timer timer) {
        super(name, uid, timer);
    }

    /**
     * Creates a fresh, undecided result for the test with the given name and uid.
     *
     * @param name The test name.
     * @param uid The test uid.
     * @return the result.
     */
    public static TestCaseResult forTest(String name, String uid) {
        return new TestCaseResult(name, uid, Timer.unstarted());
    }

    /**
     * Creates a sealed result with everything already decided.
     *
     * @param name The test name.
     * @param uid The test uid.
     * @param outcome The outcome.
     * @param elapsedNanos The duration of the test.
     * @param reason The reason for the outcome, may be null.
     * @return the result.
     */
    public static TestCaseResult restored(String name, String uid, Outcome outcome, long elapsedNanos, String reason) {
        ObjectChecker.assertNonNull(outcome);
        TestCaseResult result = new TestCaseResult(name, uid, Timer.withElapsed(elapsedNanos));
        result.outcome = outcome;
        result.reason = reason;
        result.seal();
        return result;
    }

    public void setOutcome(Outcome outcome) {
        throwIfSealed();
        ObjectChecker.assertNonNull(outcome);
        this.outcome = outcome;
    }

    public void setOutcome(Outcome outcome, String reason) {
        setOutcome(outcome);
        this.reason = reason;
    }

    public void setReason(String reason) {
        throwIfSealed();
        this.reason = reason;
    }

    @Override
    public Outcome getOutcome() {
        return this.outcome;
    }

    /**
     * Returns the reason recorded for the outcome, or null if there is none.
     *
     * @return the reason.
     */
    public String getReason() {
        return this.reason;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEST;
    }

    @Override
    public TestCaseResult asTest() {
        return this;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { uid: " + getUid() + ", outcome: " + this.outcome + (this.reason == null ? "" : ", reason: " + this.reason) + " }";
    }
}
