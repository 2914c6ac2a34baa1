package arbor.core.helper;

public final class AssertHelper {

    /**
     * Asserts that the action throws exactly the expected exception type and returns what was thrown.
     */
    public static <T extends Throwable> T assertThrows(Class<T> expected, Action action) {
        try {
            action.act();
        } catch (Throwable t) {
            if (!expected.equals(t.getClass())) {
                throw new AssertException("Actual exception [" + t.getClass() + ": " + t.getMessage() + "] != expected exception [" + expected + "]");
            }
            return expected.cast(t);
        }
        throw new AssertException("No exception thrown.");
    }

    @FunctionalInterface
    public static interface Action {
        public void act() throws Throwable;
    }

    public static final class AssertException extends RuntimeException {
        public AssertException(String message) {
            super(message);
        }
    }
}
