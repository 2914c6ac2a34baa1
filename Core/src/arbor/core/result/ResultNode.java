package arbor.core.result;

import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

/**
 * A node of the result tree: either a {@link TestCaseResult} or a {@link TestSuiteResult}, as told by
 * {@link ResultNode#kind()}. The result tree mirrors the shape of the suite tree that produced it.
 *
 * Results are mutated only by the runner while their node executes and are sealed before the runner hands them out.
 */
public abstract class ResultNode {
    private final String name;
    private final String uid;
    private final Timer timer;
    private boolean sealed = false;

    ResultNode(String name, String uid, Timer timer) {
        ObjectChecker.assertNonNull(name, uid, timer);
        this.name = name;
        this.uid = uid;
        this.timer = timer;
    }

    public abstract NodeKind kind();

    /**
     * Returns the outcome of this node, or null for a test whose outcome has not been decided yet.
     *
     * @return the outcome.
     */
    public abstract Outcome getOutcome();

    public TestCaseResult asTest() {
        throw new IllegalStateException("result '" + this.uid + "' is a " + kind() + ", not a " + NodeKind.TEST);
    }

    public TestSuiteResult asSuite() {
        throw new IllegalStateException("result '" + this.uid + "' is a " + kind() + ", not a " + NodeKind.SUITE);
    }

    public final String getName() {
        return this.name;
    }

    public final String getUid() {
        return this.uid;
    }

    public final Timer getTimer() {
        return this.timer;
    }

    public final long getElapsedNanos() {
        return this.timer.getElapsedNanos();
    }

    /**
     * Makes this result immutable.
     */
    public void seal() {
        this.sealed = true;
    }

    public final boolean isSealed() {
        return this.sealed;
    }

    final void throwIfSealed() {
        if (this.sealed) {
            throw new IllegalStateException("result '" + this.uid + "' is sealed.");
        }
    }
}
