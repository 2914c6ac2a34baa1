package arbor.core.fixture.common;

import arbor.core.fixture.Fixture;

/**
 * A fixture that simply holds a value, so that plain data can be shared with tests the same way as any other fixture.
 *
 * @param <T> The type of the value.
 */
public final class VariableFixture<T> extends Fixture {
    private final T value;

    public VariableFixture(String name, T value) {
        super(name);
        this.value = value;
    }

    @Override
    protected void doSetup() {
    }

    public T getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { name: " + getName() + ", value: " + this.value + " }";
    }
}
