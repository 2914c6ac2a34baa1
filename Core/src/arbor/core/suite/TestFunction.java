package arbor.core.suite;

import arbor.core.fixture.Fixture;
import arbor.core.fixture.FixtureContext;
import arbor.core.result.TestCaseResult;
import arbor.core.util.ObjectChecker;

import java.util.Arrays;
import java.util.Collection;

/**
 * A test case whose body is a {@link TestBody}.
 */
public final class TestFunction extends TestCase {
    private final TestBody body;

    private TestFunction(String name, TestBody body, Collection<? extends Fixture> fixtures) {
        super(name, fixtures);
        ObjectChecker.assertNonNull(body);
        this.body = body;
    }

    /**
     * Creates a new test case running the given body.
     *
     * @param name The test name.
     * @param body The test body.
     * @param fixtures The fixtures the test requires.
     * @return the new test.
     */
    public static TestFunction of(String name, TestBody body, Fixture... fixtures) {
        return new TestFunction(name, body, Arrays.asList(fixtures));
    }

    /**
     * Creates a new test case running the given body.
     *
     * @param name The test name.
     * @param body The test body.
     * @param fixtures The fixtures the test requires.
     * @return the new test.
     */
    public static TestFunction of(String name, TestBody body, Collection<? extends Fixture> fixtures) {
        return new TestFunction(name, body, fixtures);
    }

    @Override
    public void test(TestCaseResult result, FixtureContext fixtures) throws Exception {
        this.body.run(result, fixtures);
    }
}
