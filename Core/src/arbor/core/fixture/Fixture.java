package arbor.core.fixture;

import arbor.core.exception.CycleException;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named setup/teardown resource that tests and suites depend on.
 *
 * A fixture may require other fixtures, in which case those are always set up before it. The dependency graph is kept
 * acyclic: {@link Fixture#require(Fixture)} rejects any edge that would close a cycle.
 *
 * Setup never throws. A failing setup moves the fixture into {@link FixtureState#FAILED} and retains the cause, which
 * the runner turns into ERROR results for every dependent. A build-once fixture remembers the outcome of its first
 * setup and hands it back to every later caller without running its setup body again; any other fixture re-runs its
 * setup body on every call.
 *
 * Teardown never throws either: failures are logged and otherwise ignored, after which the fixture is uninitialized
 * again.
 *
 * A fixture is NOT thread-safe.
 */
public abstract class Fixture implements FixtureConsumer {
    private static final Logger LOGGER = Logger.forClass(Fixture.class);
    private final String name;
    private final boolean lazyInit;
    private final boolean buildOnce;
    private final Set<Fixture> requires = new LinkedHashSet<>();
    private final Set<FixtureConsumer> requiredBy = new LinkedHashSet<>();
    private FixtureState state = FixtureState.UNINITIALIZED;
    private Throwable failure = null;

    /**
     * Constructs an eager fixture that is set up again by every scope that owns it.
     *
     * @param name The name of the fixture.
     */
    protected Fixture(String name) {
        this(name, false, false);
    }

    /**
     * Constructs a new fixture.
     *
     * @param name The name of the fixture.
     * @param lazyInit Whether setup is deferred until the fixture is first demanded by a test.
     * @param buildOnce Whether setup runs at most once, with the outcome shared by every dependent.
     */
    protected Fixture(String name, boolean lazyInit, boolean buildOnce) {
        ObjectChecker.assertNonEmpty(name);
        this.name = name;
        this.lazyInit = lazyInit;
        this.buildOnce = buildOnce;
    }

    /**
     * Performs the actual setup work of this fixture.
     *
     * @throws Exception If the fixture could not be set up.
     */
    protected abstract void doSetup() throws Exception;

    /**
     * Performs the actual teardown work of this fixture. Does nothing unless overridden.
     *
     * @throws Exception If the fixture could not be torn down.
     */
    protected void doTeardown() throws Exception {
    }

    /**
     * Makes this fixture depend on the given fixture, so that the given fixture is set up first.
     *
     * @param other The fixture this fixture requires.
     * @throws CycleException If the other fixture is this fixture or already depends on this fixture.
     */
    public final void require(Fixture other) {
        ObjectChecker.assertNonNull(other);
        if (other == this || other.dependsOn(this)) {
            throw new CycleException("fixture '" + this.name + "' cannot require '" + other.name + "': the dependency would form a cycle.");
        }
        this.requires.add(other);
        other.requiredBy.add(this);
    }

    /**
     * Records the given consumer as depending on this fixture.
     *
     * @param consumer The dependent.
     */
    public final void registerConsumer(FixtureConsumer consumer) {
        ObjectChecker.assertNonNull(consumer);
        this.requiredBy.add(consumer);
    }

    /**
     * Returns true iff this fixture requires the given fixture, directly or transitively.
     *
     * @param other The candidate dependency.
     * @return whether or not this fixture depends on the other.
     */
    public final boolean dependsOn(Fixture other) {
        Set<Fixture> visited = new LinkedHashSet<>();
        Deque<Fixture> pending = new ArrayDeque<>(this.requires);
        while (!pending.isEmpty()) {
            Fixture next = pending.pop();
            if (next == other) {
                return true;
            }
            if (visited.add(next)) {
                pending.addAll(next.requires);
            }
        }
        return false;
    }

    /**
     * Sets up every required fixture and then this fixture, returning the resulting state.
     *
     * If a required fixture fails then this fixture fails too, without running its own setup body.
     *
     * @return the state of this fixture after the attempt.
     */
    public final FixtureState setup() {
        if (this.buildOnce && this.state != FixtureState.UNINITIALIZED) {
            return this.state;
        }

        for (Fixture dependency : this.requires) {
            if (dependency.setup() == FixtureState.FAILED) {
                this.state = FixtureState.FAILED;
                this.failure = new IllegalStateException("required fixture '" + dependency.name + "' failed to set up", dependency.failure);
                LOGGER.warn("Fixture '" + this.name + "' not set up: required fixture '" + dependency.name + "' failed.");
                return this.state;
            }
        }

        try {
            LOGGER.debug("Setting up fixture '" + this.name + "'.");
            doSetup();
            this.state = FixtureState.READY;
            this.failure = null;
        } catch (Throwable t) {
            this.state = FixtureState.FAILED;
            this.failure = t;
            LOGGER.warn("Fixture '" + this.name + "' failed to set up: " + t);
            LOGGER.debug("Setup failure of fixture '" + this.name + "'", t);
        }
        return this.state;
    }

    /**
     * Tears this fixture down. Failures are logged and never propagated.
     */
    public final void teardown() {
        try {
            LOGGER.debug("Tearing down fixture '" + this.name + "'.");
            doTeardown();
        } catch (Throwable t) {
            LOGGER.warn("Fixture '" + this.name + "' failed to tear down: " + t);
            LOGGER.debug("Teardown failure of fixture '" + this.name + "'", t);
        } finally {
            this.state = FixtureState.UNINITIALIZED;
        }
    }

    @Override
    public final String getName() {
        return this.name;
    }

    public final boolean isLazyInit() {
        return this.lazyInit;
    }

    public final boolean isBuildOnce() {
        return this.buildOnce;
    }

    public final FixtureState getState() {
        return this.state;
    }

    /**
     * Returns true iff setup has been attempted since construction or the last teardown, whether it succeeded or not.
     *
     * @return whether or not this fixture holds anything that needs tearing down.
     */
    public final boolean isSetUp() {
        return this.state != FixtureState.UNINITIALIZED;
    }

    /**
     * Returns the cause of the last failed setup, or null if the last setup did not fail.
     *
     * @return the failure cause.
     */
    public final Throwable getFailure() {
        return this.state == FixtureState.FAILED ? this.failure : null;
    }

    public final Set<Fixture> getRequires() {
        return Collections.unmodifiableSet(this.requires);
    }

    public final Set<FixtureConsumer> getRequiredBy() {
        return Collections.unmodifiableSet(this.requiredBy);
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { name: " + this.name + ", state: " + this.state + ", lazy: " + this.lazyInit + ", build once: " + this.buildOnce + " }";
    }
}
