package arbor.example;

import arbor.core.fixture.Fixture;

/**
 * A build-once fixture handing the same {@link HitCounter} to every test that depends on it.
 */
public final class HitCounterFixture extends Fixture {
    private final HitCounter counter = new HitCounter();
    private int setups = 0;

    public HitCounterFixture(String name) {
        super(name, false, true);
    }

    @Override
    protected void doSetup() {
        this.setups++;
        this.counter.reset();
    }

    public HitCounter getCounter() {
        return this.counter;
    }

    public int getSetups() {
        return this.setups;
    }
}
