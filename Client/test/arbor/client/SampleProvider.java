package arbor.client;

import arbor.core.loader.SuiteProvider;
import arbor.core.loader.TestRegistry;
import arbor.core.result.Outcome;
import arbor.core.suite.TestFunction;
import arbor.core.suite.TestSuite;

/**
 * A provider with one healthy suite and one suite holding a failing test.
 */
public final class SampleProvider implements SuiteProvider {
    public static final String HEALTHY_SUITE = "Healthy";
    public static final String BROKEN_SUITE = "Broken";

    @Override
    public String name() {
        return "sample";
    }

    @Override
    public void register(TestRegistry registry) {
        registry.addSuite(TestSuite.Builder.newBuilder(HEALTHY_SUITE)
                .items(TestFunction.of("ok", (result, fixtures) -> {}),
                        TestFunction.of("known issue", (result, fixtures) -> result.setOutcome(Outcome.XFAIL, "tracked")))
                .build());
        registry.addSuite(TestSuite.Builder.newBuilder(BROKEN_SUITE)
                .failfast(false)
                .items(TestFunction.of("passes", (result, fixtures) -> {}),
                        TestFunction.of("fails", (result, fixtures) -> {
                            throw new AssertionError("expected 1 but was 2");
                        }))
                .build());
    }
}
