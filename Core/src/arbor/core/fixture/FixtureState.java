package arbor.core.fixture;

/**
 * The lifecycle state of a {@link Fixture}.
 */
public enum FixtureState {
    /** Setup has not been attempted since construction or since the last teardown. */
    UNINITIALIZED,
    /** Setup completed successfully. */
    READY,
    /** Setup was attempted and failed, either in the fixture itself or in one of the fixtures it requires. */
    FAILED
}
