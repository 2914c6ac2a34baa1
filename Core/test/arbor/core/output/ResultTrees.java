package arbor.core.output;

import arbor.core.result.Outcome;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;

/**
 * Builds the result tree Root{SuiteA{Test1}, Container{SuiteB{Test2, Test3}}} used across the output tests.
 */
final class ResultTrees {

    private ResultTrees() {}

    static TestSuiteResult example(Outcome test1, Outcome test2, Outcome test3) {
        TestSuiteResult suiteA = TestSuiteResult.restored("SuiteA", "Root::SuiteA", 1_000_000L);
        suiteA.addResult(TestCaseResult.restored("Test1", "Root::SuiteA::Test1", test1, 1_000_000L, reasonFor(test1)));

        TestSuiteResult suiteB = TestSuiteResult.restored("SuiteB", "Root::Container::SuiteB", 2_500_000L);
        suiteB.addResult(TestCaseResult.restored("Test2", "Root::Container::SuiteB::Test2", test2, 1_000_000L, reasonFor(test2)));
        suiteB.addResult(TestCaseResult.restored("Test3", "Root::Container::SuiteB::Test3", test3, 1_500_000L, reasonFor(test3)));

        TestSuiteResult container = TestSuiteResult.restored("Container", "Root::Container", 2_500_000L);
        container.addResult(suiteB);

        TestSuiteResult root = TestSuiteResult.restored("Root", "Root", 3_500_000L);
        root.addResult(suiteA);
        root.addResult(container);
        root.seal();
        return root;
    }

    private static String reasonFor(Outcome outcome) {
        return (outcome == Outcome.FAIL || outcome == Outcome.ERROR) ? "AssertionError: " + outcome.name().toLowerCase() : null;
    }
}
