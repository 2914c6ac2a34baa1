package arbor.core.runner;

import arbor.core.fixture.Fixture;
import arbor.core.fixture.FixtureActivator;
import arbor.core.fixture.FixtureConsumer;
import arbor.core.fixture.FixtureState;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which fixtures a single run has set up and decides when each of them is torn down.
 *
 * A build-once fixture may be used by several scopes, either directly or through the requirements of the fixtures they
 * own. Before the run starts every such scope is counted with {@link FixtureLifecycle#addScope(Collection)}, and the
 * fixture is torn down when the last of those scopes has been released or abandoned. Any other fixture is torn down
 * whenever a scope owning it is released.
 *
 * A fixture is never torn down while a fixture requiring it is still set up: its teardown waits until that dependent
 * is torn down.
 *
 * Plain fixtures that come alive only as requirements of other fixtures, and anything still set up once the root scope
 * has completed, are torn down by {@link FixtureLifecycle#releaseAll()} in reverse order of setup.
 *
 * This class is NOT thread-safe.
 */
final class FixtureLifecycle implements FixtureActivator {
    private static final Logger LOGGER = Logger.forClass(FixtureLifecycle.class);
    private final Map<Fixture, Integer> remainingOwners = new HashMap<>();
    private final Set<Fixture> active = new LinkedHashSet<>();
    private final Set<Fixture> deferred = new LinkedHashSet<>();

    /**
     * Counts one more scope using the build-once fixtures among the given owned fixtures and everything they require.
     *
     * @param owned The fixtures owned by the scope.
     */
    void addScope(Collection<Fixture> owned) {
        ObjectChecker.assertNonNull(owned);
        for (Fixture fixture : withRequirements(owned)) {
            if (fixture.isBuildOnce()) {
                this.remainingOwners.merge(fixture, 1, Integer::sum);
            }
        }
    }

    /**
     * Returns the given fixtures together with every fixture they require, directly or transitively, each listed once
     * and always after the fixtures it requires.
     *
     * @param owned The fixtures owned by a scope.
     * @return the fixtures used by the scope.
     */
    static List<Fixture> withRequirements(Collection<Fixture> owned) {
        Set<Fixture> ordered = new LinkedHashSet<>();
        for (Fixture fixture : owned) {
            addWithRequirements(fixture, ordered);
        }
        return new ArrayList<>(ordered);
    }

    private static void addWithRequirements(Fixture fixture, Set<Fixture> ordered) {
        if (ordered.contains(fixture)) {
            return;
        }
        for (Fixture dependency : fixture.getRequires()) {
            addWithRequirements(dependency, ordered);
        }
        ordered.add(fixture);
    }

    @Override
    public FixtureState activate(Fixture fixture) {
        ObjectChecker.assertNonNull(fixture);
        FixtureState state = fixture.setup();
        track(fixture);
        return state;
    }

    // Requirements are recorded before their dependents, so the reverse order tears dependents down first.
    private void track(Fixture fixture) {
        for (Fixture dependency : fixture.getRequires()) {
            track(dependency);
        }
        if (fixture.isSetUp()) {
            this.active.add(fixture);
        }
    }

    /**
     * Sets up the eager fixtures among the given fixtures of a scope being entered, in order, stopping at the first one
     * that fails.
     *
     * @param owned The fixtures owned by the scope.
     * @return the fixture that failed to set up, or null if every eager fixture is ready.
     */
    Fixture enter(Collection<Fixture> owned) {
        for (Fixture fixture : owned) {
            if (!fixture.isLazyInit() && activate(fixture) == FixtureState.FAILED) {
                return fixture;
            }
        }
        return null;
    }

    /**
     * Releases the fixtures owned by a scope that has been entered and has now finished, in reverse order.
     *
     * @param owned The fixtures owned by the scope.
     */
    void release(Collection<Fixture> owned) {
        List<Fixture> used = withRequirements(owned);
        for (int i = used.size() - 1; i >= 0; i--) {
            Fixture fixture = used.get(i);
            if (fixture.isBuildOnce()) {
                if (releaseOwnership(fixture)) {
                    teardownWhenUnused(fixture);
                }
            } else if (owned.contains(fixture)) {
                teardownWhenUnused(fixture);
            }
        }
    }

    /**
     * Gives up the ownership of the fixtures of a scope that will never be entered, because it was skipped or because
     * an enclosing scope failed to set up.
     *
     * @param owned The fixtures owned by the abandoned scope.
     */
    void abandon(Collection<Fixture> owned) {
        List<Fixture> used = withRequirements(owned);
        for (int i = used.size() - 1; i >= 0; i--) {
            Fixture fixture = used.get(i);
            if (fixture.isBuildOnce() && releaseOwnership(fixture)) {
                teardownWhenUnused(fixture);
            }
        }
    }

    /**
     * Tears down every fixture that is still set up, in reverse order of setup.
     */
    void releaseAll() {
        List<Fixture> remaining = new ArrayList<>(this.active);
        for (int i = remaining.size() - 1; i >= 0; i--) {
            teardownIfSetUp(remaining.get(i));
        }
        this.active.clear();
        this.deferred.clear();
        this.remainingOwners.clear();
    }

    // Returns true iff the last owner is gone.
    private boolean releaseOwnership(Fixture fixture) {
        Integer owners = this.remainingOwners.get(fixture);
        if (owners == null || owners <= 1) {
            this.remainingOwners.remove(fixture);
            return true;
        }
        this.remainingOwners.put(fixture, owners - 1);
        return false;
    }

    // Waits for every fixture requiring this one to be torn down first, then retries the requirements that were waiting.
    private void teardownWhenUnused(Fixture fixture) {
        if (fixture.isSetUp()) {
            for (FixtureConsumer consumer : fixture.getRequiredBy()) {
                if (consumer instanceof Fixture && ((Fixture) consumer).isSetUp()) {
                    LOGGER.debug("Fixture '" + fixture.getName() + "' stays up while '" + consumer.getName() + "' requires it.");
                    this.deferred.add(fixture);
                    return;
                }
            }
        }
        teardownIfSetUp(fixture);
        for (Fixture dependency : fixture.getRequires()) {
            if (this.deferred.remove(dependency)) {
                teardownWhenUnused(dependency);
            }
        }
    }

    private void teardownIfSetUp(Fixture fixture) {
        if (fixture.isSetUp()) {
            LOGGER.debug("Releasing fixture '" + fixture.getName() + "' (" + fixture.getState() + ").");
            fixture.teardown();
        }
        this.active.remove(fixture);
    }

    int remainingOwnersOf(Fixture fixture) {
        Integer owners = this.remainingOwners.get(fixture);
        return owners == null ? 0 : owners;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { active fixtures: " + this.active.size() + ", shared fixtures pending: " + this.remainingOwners.size() + " }";
    }
}
