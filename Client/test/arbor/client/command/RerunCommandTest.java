package arbor.client.command;

import arbor.core.result.Outcome;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.suite.TestFunction;
import arbor.core.suite.TestSuite;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class RerunCommandTest {

    @Test
    public void testOnlyFailedAndErroredSuitesStillPresentAreRerun() {
        TestSuite root = TestSuite.Builder.newBuilder("root")
                .items(suite("green"), suite("red"), suite("broken"), suite("skipped"))
                .build();

        TestSuiteResult previous = TestSuiteResult.forSuite("root", "root");
        previous.addResult(suiteResult("green", Outcome.PASS));
        previous.addResult(suiteResult("red", Outcome.FAIL));
        previous.addResult(suiteResult("broken", Outcome.ERROR));
        previous.addResult(suiteResult("skipped", Outcome.SKIP));
        previous.addResult(suiteResult("deleted", Outcome.FAIL));
        previous.seal();

        Assert.assertEquals(Arrays.asList("root::red", "root::broken"), RerunCommand.failedSuiteUids(previous, root));
    }

    @Test
    public void testNothingToRerun() {
        TestSuite root = TestSuite.Builder.newBuilder("root").item(suite("green")).build();
        TestSuiteResult previous = TestSuiteResult.forSuite("root", "root");
        previous.addResult(suiteResult("green", Outcome.XFAIL));
        previous.seal();

        Assert.assertEquals(Collections.emptyList(), RerunCommand.failedSuiteUids(previous, root));
    }

    private static TestSuite suite(String name) {
        return TestSuite.Builder.newBuilder(name).item(TestFunction.of("test", (result, fixtures) -> {})).build();
    }

    private static TestSuiteResult suiteResult(String name, Outcome outcome) {
        TestSuiteResult suite = TestSuiteResult.forSuite(name, "root::" + name);
        suite.addResult(TestCaseResult.restored("test", "root::" + name + "::test", outcome, 0, null));
        return suite;
    }
}
