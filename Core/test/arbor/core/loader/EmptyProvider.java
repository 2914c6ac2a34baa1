package arbor.core.loader;

public final class EmptyProvider implements SuiteProvider {

    @Override
    public String name() {
        return "empty";
    }

    @Override
    public void register(TestRegistry registry) {
    }
}
