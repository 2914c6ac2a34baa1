package arbor.core.fixture;

import arbor.core.exception.FixtureUnavailableException;
import arbor.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The fixtures visible to one scope of the suite tree, keyed by name.
 *
 * A context is never modified once constructed. Entering a nested scope produces a new context via
 * {@link FixtureContext#withFixtures(Map)}, a shallow copy in which the nested scope's own fixtures shadow inherited
 * fixtures of the same name, so that sibling scopes never observe each other's fixtures.
 *
 * Looking a fixture up sets it up through the context's {@link FixtureActivator} if it has not been set up yet, which
 * is how lazy fixtures come alive the first time a test actually demands them.
 */
public final class FixtureContext {
    private final Map<String, Fixture> fixtures;
    private final FixtureActivator activator;

    private FixtureContext(Map<String, Fixture> fixtures, FixtureActivator activator) {
        this.fixtures = fixtures;
        this.activator = activator;
    }

    /**
     * Returns an empty context whose fixtures are set up directly, without anybody tracking them.
     *
     * @return the empty context.
     */
    public static FixtureContext empty() {
        return new FixtureContext(Collections.emptyMap(), Fixture::setup);
    }

    /**
     * Returns an empty context that sets fixtures up through the given activator.
     *
     * @param activator The activator.
     * @return the empty context.
     */
    public static FixtureContext withActivator(FixtureActivator activator) {
        ObjectChecker.assertNonNull(activator);
        return new FixtureContext(Collections.emptyMap(), activator);
    }

    /**
     * Returns a new context containing every fixture of this context plus the given fixtures, the given fixtures taking
     * precedence on a name clash. This context is left untouched.
     *
     * @param ownFixtures The fixtures of the scope being entered.
     * @return the merged context.
     */
    public FixtureContext withFixtures(Map<String, Fixture> ownFixtures) {
        ObjectChecker.assertNonNull(ownFixtures);
        if (ownFixtures.isEmpty()) {
            return this;
        }
        Map<String, Fixture> merged = new LinkedHashMap<>(this.fixtures);
        merged.putAll(ownFixtures);
        return new FixtureContext(Collections.unmodifiableMap(merged), this.activator);
    }

    /**
     * Returns the fixture visible under the given name, setting it up first if it has not been set up yet.
     *
     * @param name The fixture name.
     * @return the ready fixture.
     * @throws IllegalArgumentException If no fixture of that name is visible in this scope.
     * @throws FixtureUnavailableException If the fixture failed to set up.
     */
    public Fixture get(String name) {
        Fixture fixture = this.fixtures.get(name);
        if (fixture == null) {
            throw new IllegalArgumentException("no fixture named '" + name + "' in scope, available: " + this.fixtures.keySet());
        }
        FixtureState state = fixture.isSetUp() ? fixture.getState() : this.activator.activate(fixture);
        if (state == FixtureState.FAILED) {
            throw new FixtureUnavailableException(name, "fixture '" + name + "' failed to set up: " + fixture.getFailure(), fixture.getFailure());
        }
        return fixture;
    }

    /**
     * Same as {@link FixtureContext#get(String)} but also casts the fixture to the expected type.
     *
     * @param name The fixture name.
     * @param type The expected fixture class.
     * @param <F> The expected fixture type.
     * @return the ready fixture.
     */
    public <F extends Fixture> F get(String name, Class<F> type) {
        ObjectChecker.assertNonNull(type);
        Fixture fixture = get(name);
        if (!type.isInstance(fixture)) {
            throw new IllegalArgumentException("fixture '" + name + "' is a " + fixture.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(fixture);
    }

    /**
     * Returns the fixture visible under the given name without setting it up, or null if there is none.
     *
     * @param name The fixture name.
     * @return the fixture or null.
     */
    public Fixture peek(String name) {
        return this.fixtures.get(name);
    }

    public boolean contains(String name) {
        return this.fixtures.containsKey(name);
    }

    public Set<String> names() {
        return this.fixtures.keySet();
    }

    public int size() {
        return this.fixtures.size();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { fixtures: " + this.fixtures.keySet() + " }";
    }
}
