package arbor.core.exception;

/**
 * Thrown when a test body demands a fixture that either does not exist in its scope or could not be set up.
 *
 * The runner reports a test that dies with this exception as an ERROR rather than a FAIL, since the test itself never
 * got the chance to run to completion against its fixtures.
 */
public final class FixtureUnavailableException extends RuntimeException {
    private final String fixtureName;

    public FixtureUnavailableException(String fixtureName, String message, Throwable cause) {
        super(message, cause);
        this.fixtureName = fixtureName;
    }

    public String getFixtureName() {
        return this.fixtureName;
    }
}
