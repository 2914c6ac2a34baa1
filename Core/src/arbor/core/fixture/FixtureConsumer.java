package arbor.core.fixture;

/**
 * Anything that can depend on a {@link Fixture}: another fixture, a test or a suite.
 */
public interface FixtureConsumer {

    /**
     * Returns the human-readable name of this consumer.
     *
     * @return the name.
     */
    public String getName();
}
