package arbor.core.loader;

import arbor.core.fixture.Fixture;
import arbor.core.suite.TestCase;
import arbor.core.suite.TestSuite;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects what a single {@link SuiteProvider} registers, in registration order.
 */
public final class TestRegistry {
    private final List<TestSuite> suites = new ArrayList<>();
    private final List<TestCase> tests = new ArrayList<>();
    private final List<Fixture> fixtures = new ArrayList<>();

    TestRegistry() {}

    public TestSuite addSuite(TestSuite suite) {
        ObjectChecker.assertNonNull(suite);
        this.suites.add(suite);
        return suite;
    }

    public <T extends TestCase> T addTest(T test) {
        ObjectChecker.assertNonNull(test);
        this.tests.add(test);
        return test;
    }

    public <F extends Fixture> F addFixture(F fixture) {
        ObjectChecker.assertNonNull(fixture);
        this.fixtures.add(fixture);
        return fixture;
    }

    public List<TestSuite> getSuites() {
        return Collections.unmodifiableList(this.suites);
    }

    public List<TestCase> getTests() {
        return Collections.unmodifiableList(this.tests);
    }

    public List<Fixture> getFixtures() {
        return Collections.unmodifiableList(this.fixtures);
    }

    public boolean isEmpty() {
        return this.suites.isEmpty() && this.tests.isEmpty() && this.fixtures.isEmpty();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { suites: " + this.suites.size() + ", tests: " + this.tests.size() + ", fixtures: " + this.fixtures.size() + " }";
    }
}
