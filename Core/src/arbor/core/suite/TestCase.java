package arbor.core.suite;

import arbor.core.fixture.Fixture;
import arbor.core.fixture.FixtureContext;
import arbor.core.result.TestCaseResult;
import arbor.core.type.NodeKind;

import java.util.Arrays;
import java.util.Collection;

/**
 * A leaf of the suite tree: a named test plus the fixtures it requires.
 *
 * Subclasses implement {@link TestCase#test(TestCaseResult, FixtureContext)}; {@link TestFunction} wraps a lambda.
 */
public abstract class TestCase extends TestItem {

    protected TestCase(String name, Fixture... fixtures) {
        this(name, Arrays.asList(fixtures));
    }

    protected TestCase(String name, Collection<? extends Fixture> fixtures) {
        super(name, fixtures);
    }

    /**
     * Runs the test against the fixtures visible in its scope.
     *
     * @param result The result of this run, on which an explicit outcome may be recorded.
     * @param fixtures The resolved fixtures.
     * @throws Exception If the test fails.
     */
    public abstract void test(TestCaseResult result, FixtureContext fixtures) throws Exception;

    @Override
    public final NodeKind kind() {
        return NodeKind.TEST;
    }

    @Override
    public final TestCase asTest() {
        return this;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { name: " + getName() + ", fixtures: " + getFixtures().keySet() + " }";
    }
}
