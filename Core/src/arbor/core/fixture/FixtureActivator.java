package arbor.core.fixture;

/**
 * Sets up fixtures on behalf of a {@link FixtureContext} so that whoever owns the context can keep track of every
 * fixture that was actually brought up and release it later.
 */
@FunctionalInterface
public interface FixtureActivator {

    /**
     * Sets up the given fixture and returns its resulting state.
     *
     * @param fixture The fixture to set up.
     * @return the state of the fixture after the attempt.
     */
    public FixtureState activate(Fixture fixture);
}
