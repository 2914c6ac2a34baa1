package arbor.example;

import arbor.core.fixture.common.TempDirectoryFixture;
import arbor.core.fixture.common.VariableFixture;
import arbor.core.loader.SuiteProvider;
import arbor.core.loader.TestRegistry;
import arbor.core.result.Outcome;
import arbor.core.suite.TestFunction;
import arbor.core.suite.TestSuite;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Registers a small tree of example suites showing off shared fixtures, nested suites, temporary directories and
 * expected failures.
 */
public final class ExampleSuites implements SuiteProvider {
    public static final String NAME = "examples";
    public static final String COUNTER_FIXTURE = "counter";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void register(TestRegistry registry) {
        HitCounterFixture counter = registry.addFixture(new HitCounterFixture(COUNTER_FIXTURE));
        VariableFixture<String> greeting = registry.addFixture(new VariableFixture<>("greeting", "hello"));
        TempDirectoryFixture scratch = registry.addFixture(new TempDirectoryFixture("scratch"));

        TestSuite scratchSuite = TestSuite.Builder.newBuilder("Scratch")
                .fixture(scratch)
                .item(TestFunction.of("write file", (result, fixtures) -> {
                    Path directory = fixtures.get("scratch", TempDirectoryFixture.class).getPath();
                    String text = (String) fixtures.get("greeting", VariableFixture.class).getValue();
                    Path file = Files.write(directory.resolve("greeting.txt"), text.getBytes(StandardCharsets.UTF_8));
                    if (!text.equals(new String(Files.readAllBytes(file), StandardCharsets.UTF_8))) {
                        throw new AssertionError("file content does not round trip");
                    }
                }))
                .build();

        TestSuite counters = TestSuite.Builder.newBuilder("Counters")
                .fixture(counter)
                .fixture(greeting)
                .items(
                        TestFunction.of("hit once", (result, fixtures) -> hit(fixtures.get(COUNTER_FIXTURE, HitCounterFixture.class), 1, 1)),
                        TestFunction.of("hit twice", (result, fixtures) -> hit(fixtures.get(COUNTER_FIXTURE, HitCounterFixture.class), 2, 3)),
                        scratchSuite,
                        TestFunction.of("known bug", (result, fixtures) -> {
                            try {
                                throw new UnsupportedOperationException("not implemented yet");
                            } catch (UnsupportedOperationException e) {
                                result.setOutcome(Outcome.XFAIL, e.getMessage());
                            }
                        }))
                .build();

        registry.addSuite(counters);
        registry.addSuite(scratchSuite);
        registry.addTest(TestFunction.of("arithmetic", (result, fixtures) -> {
            if (Math.addExact(2, 2) != 4) {
                throw new AssertionError("2 + 2 != 4");
            }
        }));
    }

    // The counter is shared by the whole suite, so each test sees the hits of the ones before it.
    private static void hit(HitCounterFixture fixture, int times, int expectedHits) {
        HitCounter counter = fixture.getCounter();
        for (int i = 0; i < times; i++) {
            counter.hit();
        }
        if (counter.getHits() != expectedHits) {
            throw new AssertionError("expected " + expectedHits + " hits but found " + counter.getHits());
        }
    }
}
