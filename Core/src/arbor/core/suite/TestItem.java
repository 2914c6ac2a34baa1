package arbor.core.suite;

import arbor.core.fixture.Fixture;
import arbor.core.fixture.FixtureConsumer;
import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the suite tree: either a {@link TestCase} or a {@link TestSuite}, as told by {@link TestItem#kind()}.
 *
 * The set of variants is closed; the constructor is package-private so that nothing but those two classes extends this
 * one directly. Code walking the tree switches on the kind and narrows with {@link TestItem#asTest()} or
 * {@link TestItem#asSuite()}.
 */
public abstract class TestItem implements FixtureConsumer {
    private final String name;
    private final Map<String, Fixture> fixtures = new LinkedHashMap<>();

    TestItem(String name, Collection<? extends Fixture> fixtures) {
        ObjectChecker.assertNonEmpty(name);
        ObjectChecker.assertNonNull(fixtures);
        this.name = name;
        for (Fixture fixture : fixtures) {
            ObjectChecker.assertNonNull(fixture);
            if (this.fixtures.putIfAbsent(fixture.getName(), fixture) != null) {
                throw new IllegalArgumentException("'" + name + "' declares two fixtures named '" + fixture.getName() + "'");
            }
            fixture.registerConsumer(this);
        }
    }

    /**
     * Returns which variant of node this is.
     *
     * @return the node kind.
     */
    public abstract NodeKind kind();

    /**
     * Returns this node as a test case.
     *
     * @return this test case.
     * @throws IllegalStateException If this node is not a test case.
     */
    public TestCase asTest() {
        throw new IllegalStateException("'" + this.name + "' is a " + kind() + ", not a " + NodeKind.TEST);
    }

    /**
     * Returns this node as a test suite.
     *
     * @return this test suite.
     * @throws IllegalStateException If this node is not a test suite.
     */
    public TestSuite asSuite() {
        throw new IllegalStateException("'" + this.name + "' is a " + kind() + ", not a " + NodeKind.SUITE);
    }

    @Override
    public final String getName() {
        return this.name;
    }

    /**
     * Returns the fixtures owned by this node, keyed by name, in declaration order.
     *
     * @return the own fixtures.
     */
    public final Map<String, Fixture> getFixtures() {
        return Collections.unmodifiableMap(this.fixtures);
    }
}
