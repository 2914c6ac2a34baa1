package arbor.core.output;

import arbor.core.result.Outcome;
import arbor.core.result.ResultNode;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ResultFlattenerTest {

    @Test
    public void testContainerIsDroppedAndNestedSuitesRise() {
        TestSuiteResult root = ResultTrees.example(Outcome.PASS, Outcome.PASS, Outcome.FAIL);
        List<FlatSuite> flattened = ResultFlattener.flatten(root);

        Assert.assertEquals(2, flattened.size());
        Assert.assertEquals("SuiteA", flattened.get(0).name);
        Assert.assertEquals(Collections.singletonList("Test1"), namesOf(flattened.get(0).getTests()));
        Assert.assertEquals("SuiteB", flattened.get(1).name);
        Assert.assertEquals("Root::Container::SuiteB", flattened.get(1).uid);
        Assert.assertEquals(Arrays.asList("Test2", "Test3"), namesOf(flattened.get(1).getTests()));
        Assert.assertEquals(Outcome.FAIL, flattened.get(1).getOutcome());
        Assert.assertEquals(2_500_000L, flattened.get(1).elapsedNanos);
    }

    @Test
    public void testSuiteWithDirectTestsAndNestedSuitesKeepsOnlyDirectTests() {
        TestSuiteResult nested = TestSuiteResult.forSuite("nested", "mixed::nested");
        nested.addResult(TestCaseResult.restored("inner", "mixed::nested::inner", Outcome.PASS, 0, null));
        TestSuiteResult mixed = TestSuiteResult.forSuite("mixed", "mixed");
        mixed.addResult(TestCaseResult.restored("before", "mixed::before", Outcome.PASS, 0, null));
        mixed.addResult(nested);
        mixed.addResult(TestCaseResult.restored("after", "mixed::after", Outcome.SKIP, 0, null));

        List<FlatSuite> flattened = ResultFlattener.flatten(mixed);
        Assert.assertEquals(2, flattened.size());
        Assert.assertEquals(Arrays.asList("before", "after"), namesOf(flattened.get(0).getTests()));
        Assert.assertEquals(Collections.singletonList("inner"), namesOf(flattened.get(1).getTests()));
    }

    @Test
    public void testEmptyContainersAreNotEmitted() {
        TestSuiteResult empty = TestSuiteResult.forSuite("empty", "root::empty");
        TestSuiteResult root = TestSuiteResult.forSuite("root", "root");
        root.addResult(empty);
        Assert.assertTrue(ResultFlattener.flatten(root).isEmpty());
    }

    @Test
    public void testFlatteningPreservesTestsAndIsIdempotent() {
        TestSuiteResult root = ResultTrees.example(Outcome.PASS, Outcome.ERROR, Outcome.SKIP);
        List<FlatSuite> once = ResultFlattener.flatten(root);

        List<TestCaseResult> flatTests = new ArrayList<>();
        TestSuiteResult rebuilt = TestSuiteResult.forSuite("Root", "Root");
        for (FlatSuite suite : once) {
            flatTests.addAll(suite.getTests());
            rebuilt.addResult(suite.toSuiteResult());
        }
        Assert.assertEquals(root.getAllTestResults(), flatTests);

        List<FlatSuite> twice = ResultFlattener.flatten(rebuilt);
        Assert.assertEquals(once.size(), twice.size());
        for (int i = 0; i < once.size(); i++) {
            Assert.assertEquals(once.get(i).uid, twice.get(i).uid);
            Assert.assertEquals(once.get(i).getTests(), twice.get(i).getTests());
        }
    }

    private static List<String> namesOf(List<? extends ResultNode> results) {
        List<String> names = new ArrayList<>();
        for (ResultNode result : results) {
            names.add(result.getName());
        }
        return names;
    }
}
