package arbor.core.helper;

import arbor.core.fixture.Fixture;

import java.util.List;

/**
 * A fixture that counts its setups and teardowns, optionally fails them, and appends "setup:NAME" and "teardown:NAME"
 * to a shared event log so that tests can check ordering across fixtures.
 */
public final class RecordingFixture extends Fixture {
    private final List<String> events;
    private boolean failSetup = false;
    private boolean failTeardown = false;
    private int setups = 0;
    private int teardowns = 0;

    public RecordingFixture(String name, List<String> events) {
        this(name, events, false, false);
    }

    public RecordingFixture(String name, List<String> events, boolean lazyInit, boolean buildOnce) {
        super(name, lazyInit, buildOnce);
        this.events = events;
    }

    public RecordingFixture failingSetup() {
        this.failSetup = true;
        return this;
    }

    public RecordingFixture failingTeardown() {
        this.failTeardown = true;
        return this;
    }

    @Override
    protected void doSetup() {
        this.setups++;
        this.events.add("setup:" + getName());
        if (this.failSetup) {
            throw new IllegalStateException("setup of " + getName() + " broke");
        }
    }

    @Override
    protected void doTeardown() {
        this.teardowns++;
        this.events.add("teardown:" + getName());
        if (this.failTeardown) {
            throw new IllegalStateException("teardown of " + getName() + " broke");
        }
    }

    public int getSetups() {
        return this.setups;
    }

    public int getTeardowns() {
        return this.teardowns;
    }
}
