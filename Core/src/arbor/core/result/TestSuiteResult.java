package arbor.core.result;

import arbor.core.exception.UnreachableException;
import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The results of running a suite: one child result per executed, errored or skipped child, in order.
 *
 * The outcome of a suite is computed from the direct children every time it is asked for, see
 * {@link TestSuiteResult#aggregate(List)}. The one exception is a suite whose own fixtures failed to set up, which
 * is marked with {@link TestSuiteResult#markError(String)} and is then {@link Outcome#ERROR} whatever it contains.
 */
public final class TestSuiteResult extends ResultNode {
    private final List<ResultNode> results = new ArrayList<>();
    private String errorReason = null;

    private TestSuiteResult(String name, String uid, Timer timer) {
        super(name, uid, timer);
    }

    /**
     * Creates an empty, unsealed result for the suite with the given name and uid.
     *
     * @param name The suite name.
     * @param uid The suite uid.
     * @return the result.
     */
    public static TestSuiteResult forSuite(String name, String uid) {
        return new TestSuiteResult(name, uid, Timer.unstarted());
    }

    /**
     * Creates an unsealed result reporting the given duration, to which already sealed child results can be added.
     *
     * @param name The suite name.
     * @param uid The suite uid.
     * @param elapsedNanos The duration of the suite.
     * @return the result.
     */
    public static TestSuiteResult restored(String name, String uid, long elapsedNanos) {
        return new TestSuiteResult(name, uid, Timer.withElapsed(elapsedNanos));
    }

    /**
     * Creates a sealed result for a suite that was skipped without being entered. It has no children and so its outcome
     * is {@link Outcome#SKIP}.
     *
     * @param name The suite name.
     * @param uid The suite uid.
     * @return the result.
     */
    public static TestSuiteResult skipped(String name, String uid) {
        TestSuiteResult result = forSuite(name, uid);
        result.seal();
        return result;
    }

    public void addResult(ResultNode result) {
        throwIfSealed();
        ObjectChecker.assertNonNull(result);
        this.results.add(result);
    }

    /**
     * Marks this suite as ERROR because it could not be entered, even if it has no children to carry that outcome.
     *
     * @param reason Why the suite could not be entered.
     */
    public void markError(String reason) {
        throwIfSealed();
        ObjectChecker.assertNonNull(reason);
        this.errorReason = reason;
    }

    /**
     * Returns the reason given to {@link TestSuiteResult#markError(String)}, or null if this suite was not marked.
     *
     * @return the reason or null.
     */
    public String getErrorReason() {
        return this.errorReason;
    }

    public List<ResultNode> getResults() {
        return Collections.unmodifiableList(this.results);
    }

    /**
     * Returns the test results held directly by this suite, ignoring nested suites.
     *
     * @return the direct test results.
     */
    public List<TestCaseResult> getDirectTestResults() {
        List<TestCaseResult> tests = new ArrayList<>();
        for (ResultNode result : this.results) {
            if (result.kind() == NodeKind.TEST) {
                tests.add(result.asTest());
            }
        }
        return tests;
    }

    /**
     * Returns every test result in this suite at any depth, in execution order.
     *
     * @return all test results.
     */
    public List<TestCaseResult> getAllTestResults() {
        List<TestCaseResult> tests = new ArrayList<>();
        collectTests(this, tests);
        return tests;
    }

    private static void collectTests(TestSuiteResult suite, List<TestCaseResult> tests) {
        for (ResultNode result : suite.results) {
            switch (result.kind()) {
                case TEST:
                    tests.add(result.asTest());
                    break;
                case SUITE:
                    collectTests(result.asSuite(), tests);
                    break;
                default:
                    throw new UnreachableException("unknown result kind: " + result.kind());
            }
        }
    }

    @Override
    public Outcome getOutcome() {
        if (this.errorReason != null) {
            return Outcome.ERROR;
        }
        return aggregate(this.results);
    }

    /**
     * Computes the outcome of a suite from the outcomes of its direct children, in order:
     *
     * ERROR if any child is ERROR, stopping at the first one found.
     * Otherwise FAIL if any child is FAIL.
     * Otherwise SKIP if every child is SKIP, which includes having no children at all.
     * Otherwise PASS.
     *
     * @param children The direct child results.
     * @return the suite outcome.
     */
    public static Outcome aggregate(List<? extends ResultNode> children) {
        boolean failed = false;
        boolean allSkipped = true;

        for (ResultNode child : children) {
            Outcome outcome = child.getOutcome();
            if (outcome == Outcome.ERROR) {
                return Outcome.ERROR;
            }
            if (outcome != Outcome.SKIP) {
                allSkipped = false;
            }
            if (outcome == Outcome.FAIL) {
                failed = true;
            }
        }

        if (failed) {
            return Outcome.FAIL;
        }
        if (allSkipped) {
            return Outcome.SKIP;
        }
        return Outcome.PASS;
    }

    @Override
    public void seal() {
        super.seal();
        for (ResultNode result : this.results) {
            result.seal();
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUITE;
    }

    @Override
    public TestSuiteResult asSuite() {
        return this;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { uid: " + getUid() + ", outcome: " + getOutcome() + ", contains " + this.results.size() + " result(s) }";
    }
}
