package arbor.core.runner;

import arbor.core.config.RunConfig;
import arbor.core.exception.FixtureUnavailableException;
import arbor.core.exception.UnreachableException;
import arbor.core.fixture.Fixture;
import arbor.core.fixture.FixtureContext;
import arbor.core.result.Outcome;
import arbor.core.result.ResultNode;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.suite.TestCase;
import arbor.core.suite.TestItem;
import arbor.core.suite.TestSuite;
import arbor.core.suite.Uids;
import arbor.core.type.NodeKind;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes a suite tree depth-first on the calling thread and returns a result tree of the same shape.
 *
 * Entering a scope (suite or test) merges the fixtures it owns into the inherited {@link FixtureContext} and sets up
 * the eager ones before anything inside the scope runs. Leaving a scope releases its fixtures, whatever happened inside.
 *
 * A scope whose eager fixture fails to set up never runs: every test below it gets an {@link Outcome#ERROR} result. In
 * a failfast suite, the first child to end in ERROR or FAIL causes every remaining sibling to be reported as
 * {@link Outcome#SKIP} without being entered.
 */
public final class Runner {
    private static final Logger LOGGER = Logger.forClass(Runner.class);
    private final Boolean failfastOverride;

    private Runner(Boolean failfastOverride) {
        this.failfastOverride = failfastOverride;
    }

    /**
     * Returns a runner that honours every suite's own failfast flag.
     *
     * @return the runner.
     */
    public static Runner withDefaults() {
        return new Runner(null);
    }

    /**
     * Returns a runner whose failfast behaviour is dictated by the given override, or by each suite's own flag if the
     * override is null.
     *
     * @param failfastOverride The override.
     * @return the runner.
     */
    public static Runner withFailfastOverride(Boolean failfastOverride) {
        return new Runner(failfastOverride);
    }

    public static Runner fromConfig(RunConfig config) {
        ObjectChecker.assertNonNull(config);
        return new Runner(config.failfastOverride);
    }

    /**
     * Runs the entire tree rooted at the given suite.
     *
     * @param root The root suite.
     * @return the sealed result tree.
     */
    public TestSuiteResult run(TestSuite root) {
        return run(root, Selection.all());
    }

    /**
     * Runs the part of the tree rooted at the given suite that the selection includes.
     *
     * @param root The root suite.
     * @param selection The nodes to visit.
     * @return the sealed result tree.
     * @throws arbor.core.exception.CycleException If the tree is not a proper tree.
     * @throws IllegalArgumentException If the selection names a uid that is not in the tree.
     */
    public TestSuiteResult run(TestSuite root, Selection selection) {
        ObjectChecker.assertNonNull(root, selection);
        root.validate();

        Map<String, TestItem> index = root.indexByUid();
        for (String uid : selection.getUids()) {
            if (!index.containsKey(uid)) {
                throw new IllegalArgumentException("unknown uid: '" + uid + "'");
            }
        }

        FixtureLifecycle lifecycle = new FixtureLifecycle();
        countOwners(root, root.getName(), selection, lifecycle);

        LOGGER.log("Running suite '" + root.getName() + "' (" + root.iterLeaves().size() + " test(s) in the tree, " + selection + ").");
        try {
            TestSuiteResult result = runSuite(root, root.getName(), FixtureContext.withActivator(lifecycle), selection, lifecycle);
            LOGGER.log("Finished suite '" + root.getName() + "' with outcome " + result.getOutcome() + ".");
            return result;
        } finally {
            lifecycle.releaseAll();
        }
    }

    private TestSuiteResult runSuite(TestSuite suite, String uid, FixtureContext inherited, Selection selection, FixtureLifecycle lifecycle) {
        TestSuiteResult result = TestSuiteResult.forSuite(suite.getName(), uid);
        result.getTimer().start();
        LOGGER.debug("Entering suite '" + uid + "'.");

        FixtureContext context = inherited.withFixtures(suite.getFixtures());
        try {
            Fixture failed = lifecycle.enter(suite.getFixtures().values());
            if (failed != null) {
                String reason = describeFixtureFailure(failed);
                LOGGER.warn("Suite '" + uid + "' not run: " + reason);
                result.markError(reason);
                for (TestItem child : suite.getItems()) {
                    String childUid = Uids.child(uid, child.getName());
                    if (selection.includes(childUid)) {
                        result.addResult(mirrorAsError(child, childUid, reason, selection, lifecycle));
                    }
                }
                return result;
            }

            List<TestItem> children = selectedChildren(suite, uid, selection);
            boolean failfast = (this.failfastOverride != null) ? this.failfastOverride : suite.isFailfast();
            for (int i = 0; i < children.size(); i++) {
                TestItem child = children.get(i);
                ResultNode childResult = runItem(child, Uids.child(uid, child.getName()), context, selection, lifecycle);
                result.addResult(childResult);

                if (failfast && childResult.getOutcome().haltsFailfast()) {
                    LOGGER.log("Suite '" + uid + "' stops after '" + child.getName() + "' ended in " + childResult.getOutcome() + ".");
                    for (TestItem remaining : children.subList(i + 1, children.size())) {
                        result.addResult(skip(remaining, Uids.child(uid, remaining.getName()), child.getName(), selection, lifecycle));
                    }
                    break;
                }
            }
            return result;
        } finally {
            lifecycle.release(suite.getFixtures().values());
            result.getTimer().stop();
            result.seal();
            LOGGER.debug("Leaving suite '" + uid + "'.");
        }
    }

    private ResultNode runItem(TestItem item, String uid, FixtureContext inherited, Selection selection, FixtureLifecycle lifecycle) {
        switch (item.kind()) {
            case SUITE:
                return runSuite(item.asSuite(), uid, inherited, selection, lifecycle);
            case TEST:
                return runTest(item.asTest(), uid, inherited, lifecycle);
            default:
                throw new UnreachableException("unknown node kind: " + item.kind());
        }
    }

    private TestCaseResult runTest(TestCase test, String uid, FixtureContext inherited, FixtureLifecycle lifecycle) {
        TestCaseResult result = TestCaseResult.forTest(test.getName(), uid);
        FixtureContext context = inherited.withFixtures(test.getFixtures());
        try {
            Fixture failed = lifecycle.enter(test.getFixtures().values());
            if (failed != null) {
                result.setOutcome(Outcome.ERROR, describeFixtureFailure(failed));
                return result;
            }

            result.getTimer().start();
            try {
                test.test(result, context);
            } catch (FixtureUnavailableException e) {
                result.setOutcome(Outcome.ERROR, e.getMessage());
            } catch (Throwable t) {
                result.setOutcome(Outcome.FAIL, describe(t));
                LOGGER.debug("Test '" + uid + "' failed", t);
            } finally {
                result.getTimer().stop();
            }

            if (result.getOutcome() == null) {
                result.setOutcome(Outcome.PASS);
            }
            return result;
        } finally {
            lifecycle.release(test.getFixtures().values());
            result.seal();
            LOGGER.debug("Test '" + uid + "': " + result.getOutcome() + ".");
        }
    }

    private static ResultNode mirrorAsError(TestItem item, String uid, String reason, Selection selection, FixtureLifecycle lifecycle) {
        lifecycle.abandon(item.getFixtures().values());
        switch (item.kind()) {
            case TEST:
                TestCaseResult testResult = TestCaseResult.forTest(item.getName(), uid);
                testResult.setOutcome(Outcome.ERROR, reason);
                testResult.seal();
                return testResult;
            case SUITE:
                TestSuiteResult suiteResult = TestSuiteResult.forSuite(item.getName(), uid);
                suiteResult.markError(reason);
                for (TestItem child : item.asSuite().getItems()) {
                    String childUid = Uids.child(uid, child.getName());
                    if (selection.includes(childUid)) {
                        suiteResult.addResult(mirrorAsError(child, childUid, reason, selection, lifecycle));
                    }
                }
                suiteResult.seal();
                return suiteResult;
            default:
                throw new UnreachableException("unknown node kind: " + item.kind());
        }
    }

    private static ResultNode skip(TestItem item, String uid, String culprit, Selection selection, FixtureLifecycle lifecycle) {
        abandonSubtree(item, uid, selection, lifecycle);
        switch (item.kind()) {
            case TEST:
                TestCaseResult testResult = TestCaseResult.forTest(item.getName(), uid);
                testResult.setOutcome(Outcome.SKIP, "skipped after '" + culprit + "' failed");
                testResult.seal();
                return testResult;
            case SUITE:
                return TestSuiteResult.skipped(item.getName(), uid);
            default:
                throw new UnreachableException("unknown node kind: " + item.kind());
        }
    }

    private static void abandonSubtree(TestItem item, String uid, Selection selection, FixtureLifecycle lifecycle) {
        lifecycle.abandon(item.getFixtures().values());
        if (item.kind() == NodeKind.SUITE) {
            for (TestItem child : item.asSuite().getItems()) {
                String childUid = Uids.child(uid, child.getName());
                if (selection.includes(childUid)) {
                    abandonSubtree(child, childUid, selection, lifecycle);
                }
            }
        }
    }

    private static void countOwners(TestItem item, String uid, Selection selection, FixtureLifecycle lifecycle) {
        lifecycle.addScope(item.getFixtures().values());
        if (item.kind() == NodeKind.SUITE) {
            for (TestItem child : item.asSuite().getItems()) {
                String childUid = Uids.child(uid, child.getName());
                if (selection.includes(childUid)) {
                    countOwners(child, childUid, selection, lifecycle);
                }
            }
        }
    }

    private static List<TestItem> selectedChildren(TestSuite suite, String uid, Selection selection) {
        List<TestItem> children = new ArrayList<>();
        for (TestItem child : suite.getItems()) {
            if (selection.includes(Uids.child(uid, child.getName()))) {
                children.add(child);
            }
        }
        return children;
    }

    private static String describeFixtureFailure(Fixture fixture) {
        Throwable cause = fixture.getFailure();
        return "fixture '" + fixture.getName() + "' failed to set up: " + (cause == null ? "unknown cause" : describe(cause));
    }

    /**
     * Renders a failure as {@code ExceptionClass: message}, or just the class when there is no message.
     *
     * @param failure The failure.
     * @return the description.
     */
    static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { failfast override: " + this.failfastOverride + " }";
    }
}
