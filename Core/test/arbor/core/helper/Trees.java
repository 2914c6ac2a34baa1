package arbor.core.helper;

import arbor.core.result.Outcome;
import arbor.core.suite.TestFunction;

/**
 * Shorthands for building suite trees in tests.
 */
public final class Trees {

    private Trees() {}

    public static TestFunction passing(String name) {
        return TestFunction.of(name, (result, fixtures) -> {});
    }

    public static TestFunction failing(String name) {
        return TestFunction.of(name, (result, fixtures) -> {
            throw new AssertionError(name + " failed");
        });
    }

    public static TestFunction withOutcome(String name, Outcome outcome) {
        return TestFunction.of(name, (result, fixtures) -> result.setOutcome(outcome));
    }
}
