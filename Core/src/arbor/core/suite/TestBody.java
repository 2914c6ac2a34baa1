package arbor.core.suite;

import arbor.core.fixture.FixtureContext;
import arbor.core.result.TestCaseResult;

/**
 * The code of a test.
 *
 * Anything thrown out of the body marks the test as FAIL. The body may instead record an outcome and a reason on the
 * result itself; a body that returns normally without doing so passes.
 */
@FunctionalInterface
public interface TestBody {

    /**
     * Runs the test.
     *
     * @param result The result of the running test.
     * @param fixtures The fixtures visible to the test.
     * @throws Exception If the test fails.
     */
    public void run(TestCaseResult result, FixtureContext fixtures) throws Exception;
}
