package arbor.core.result;

/**
 * The outcome of a test or suite. Declaration order is the order in which outcomes are tabulated in reports.
 */
public enum Outcome {
    /** The test passed. */
    PASS,
    /** The test ran and failed as expected. */
    XFAIL,
    /** The test was not run. */
    SKIP,
    /** Something outside the test itself went wrong, typically a fixture that failed to set up. */
    ERROR,
    /** The test failed. */
    FAIL;

    /**
     * Returns true iff this outcome stops a failfast suite from running its remaining children.
     *
     * @return whether or not this outcome halts a failfast suite.
     */
    public boolean haltsFailfast() {
        return this == ERROR || this == FAIL;
    }

    /**
     * Returns true iff reports that only know about passing and failing treat this outcome as passing.
     *
     * @return whether or not this outcome counts as passing.
     */
    public boolean isPassing() {
        return this == PASS || this == XFAIL;
    }
}
