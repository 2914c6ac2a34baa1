package arbor.core.output;

import arbor.core.result.ResultNode;
import arbor.core.result.TestSuiteResult;
import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a nested result tree for report formats that cannot nest suites.
 *
 * Every suite result that directly holds at least one test result is emitted once, with exactly those direct test
 * results. Suites that only contain other suites are not emitted themselves, but the suites below them are, in their
 * original relative order. Every test result therefore appears exactly once in the output, in execution order.
 */
public final class ResultFlattener {

    private ResultFlattener() {}

    /**
     * Returns the flattened suites of the tree rooted at the given result.
     *
     * @param root The root of the result tree.
     * @return the flat suites in order.
     */
    public static List<FlatSuite> flatten(TestSuiteResult root) {
        ObjectChecker.assertNonNull(root);
        List<FlatSuite> flattened = new ArrayList<>();
        flattenInto(root, flattened);
        return flattened;
    }

    private static void flattenInto(TestSuiteResult suite, List<FlatSuite> flattened) {
        if (!suite.getDirectTestResults().isEmpty()) {
            flattened.add(FlatSuite.of(suite));
        }
        for (ResultNode result : suite.getResults()) {
            if (result.kind() == NodeKind.SUITE) {
                flattenInto(result.asSuite(), flattened);
            }
        }
    }
}
