package arbor.core.result;

import arbor.core.helper.AssertHelper;
import arbor.core.type.NodeKind;
import org.junit.Assert;
import org.junit.Test;

public class TestCaseResultTest {

    @Test
    public void testFreshResultIsUndecided() {
        TestCaseResult result = TestCaseResult.forTest("t", "root::t");
        Assert.assertNull(result.getOutcome());
        Assert.assertNull(result.getReason());
        Assert.assertEquals(0, result.getElapsedNanos());
        Assert.assertEquals(NodeKind.TEST, result.kind());
        Assert.assertFalse(result.isSealed());
    }

    @Test
    public void testSealedResultRejectsMutation() {
        TestCaseResult result = TestCaseResult.forTest("t", "root::t");
        result.setOutcome(Outcome.FAIL, "boom");
        result.seal();

        AssertHelper.assertThrows(IllegalStateException.class, () -> result.setOutcome(Outcome.PASS));
        AssertHelper.assertThrows(IllegalStateException.class, () -> result.setReason("other"));
        Assert.assertEquals(Outcome.FAIL, result.getOutcome());
        Assert.assertEquals("boom", result.getReason());
    }

    @Test
    public void testSealingASuiteSealsItsChildren() {
        TestSuiteResult suite = TestSuiteResult.forSuite("s", "s");
        TestCaseResult test = TestCaseResult.forTest("t", "s::t");
        suite.addResult(test);
        suite.seal();

        Assert.assertTrue(test.isSealed());
        AssertHelper.assertThrows(IllegalStateException.class, () -> suite.addResult(TestCaseResult.forTest("u", "s::u")));
    }

    @Test
    public void testRestoredResult() {
        TestCaseResult result = TestCaseResult.restored("t", "root::t", Outcome.SKIP, 1_500_000_000L, "not applicable");
        Assert.assertTrue(result.isSealed());
        Assert.assertEquals(Outcome.SKIP, result.getOutcome());
        Assert.assertEquals("1.500000", result.getTimer().toSecondsString(6));
        AssertHelper.assertThrows(IllegalStateException.class, result::asSuite);
    }

    @Test
    public void testTimerStartsOnlyOnce() throws InterruptedException {
        Timer timer = Timer.unstarted();
        timer.start();
        Thread.sleep(5);
        timer.start();
        long elapsed = timer.stop();
        Assert.assertTrue(elapsed >= 5_000_000L);
        Assert.assertEquals(elapsed, timer.getElapsedNanos());
    }

    @Test
    public void testMarkedSuiteIsAnErrorWhateverItContains() {
        TestSuiteResult suite = TestSuiteResult.forSuite("s", "s");
        Assert.assertEquals(Outcome.SKIP, suite.getOutcome());
        suite.addResult(TestCaseResult.restored("t", "s::t", Outcome.PASS, 0, null));
        suite.markError("fixture 'f' failed to set up");
        suite.seal();

        Assert.assertEquals(Outcome.ERROR, suite.getOutcome());
        AssertHelper.assertThrows(IllegalStateException.class, () -> suite.markError("again"));
    }
}
