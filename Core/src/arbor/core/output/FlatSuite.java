package arbor.core.output;

import arbor.core.result.Outcome;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A suite as it appears in a flat report: the name, uid and elapsed time of a suite result together with only the test
 * results it holds directly.
 */
public final class FlatSuite {
    public final String name;
    public final String uid;
    public final long elapsedNanos;
    private final List<TestCaseResult> tests;

    private FlatSuite(String name, String uid, long elapsedNanos, List<TestCaseResult> tests) {
        this.name = name;
        this.uid = uid;
        this.elapsedNanos = elapsedNanos;
        this.tests = tests;
    }

    /**
     * Returns the flat view of the given suite result.
     *
     * @param suite The suite result.
     * @return the flat suite.
     */
    public static FlatSuite of(TestSuiteResult suite) {
        ObjectChecker.assertNonNull(suite);
        return new FlatSuite(suite.getName(), suite.getUid(), suite.getElapsedNanos(), Collections.unmodifiableList(new ArrayList<>(suite.getDirectTestResults())));
    }

    public List<TestCaseResult> getTests() {
        return this.tests;
    }

    /**
     * Returns the outcome of this suite, aggregated over its direct test results only.
     *
     * @return the outcome.
     */
    public Outcome getOutcome() {
        return TestSuiteResult.aggregate(this.tests);
    }

    /**
     * Returns the number of direct test results with the given outcome.
     *
     * @param outcome The outcome to count.
     * @return the count.
     */
    public int count(Outcome outcome) {
        int count = 0;
        for (TestCaseResult test : this.tests) {
            if (test.getOutcome() == outcome) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a sealed suite result holding exactly the test results of this flat suite.
     *
     * @return the suite result.
     */
    public TestSuiteResult toSuiteResult() {
        TestSuiteResult result = TestSuiteResult.restored(this.name, this.uid, this.elapsedNanos);
        for (TestCaseResult test : this.tests) {
            result.addResult(test);
        }
        result.seal();
        return result;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { uid: " + this.uid + ", tests: " + this.tests.size() + " }";
    }
}
