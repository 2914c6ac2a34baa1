package arbor.core.loader;

import arbor.core.exception.CycleException;
import arbor.core.fixture.Fixture;
import arbor.core.suite.TestCase;
import arbor.core.suite.TestItem;
import arbor.core.suite.TestSuite;
import arbor.core.type.Attempt;
import arbor.core.util.Logger;
import arbor.core.util.ObjectChecker;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Builds a single suite tree out of every {@link SuiteProvider} that can be found.
 *
 * The root of the tree is a non-failfast suite named {@link TestLoader#ROOT_SUITE_NAME}. For each provider, in the order
 * the providers are discovered, the root receives the provider's top-level suites followed by one suite, named after
 * the provider, holding the tests the provider registered outside of any suite.
 *
 * A provider that cannot be instantiated, that throws while registering or whose contribution does not fit in the tree
 * is logged and dropped without affecting the other providers.
 *
 * A loader is meant to be used for a single load. The loaded tests run against classes of the loader, so it must only
 * be closed once they have finished running.
 */
public final class TestLoader implements Closeable {
    public static final String ROOT_SUITE_NAME = "Default Suite Collection";
    private static final Logger LOGGER = Logger.forClass(TestLoader.class);
    private final TestSuite root = TestSuite.Builder.newBuilder(ROOT_SUITE_NAME).failfast(false).build();
    private final List<TestSuite> suites = new ArrayList<>();
    private final List<TestCase> tests = new ArrayList<>();
    private final Set<Fixture> fixtures = new LinkedHashSet<>();
    private URLClassLoader directoryClassLoader;

    private TestLoader() {}

    public static TestLoader create() {
        return new TestLoader();
    }

    /**
     * Loads every provider visible through a class loader over the given directory of compiled classes and the jar
     * files directly inside it.
     *
     * @param directory The directory.
     * @return the root suite.
     * @throws IOException If the directory cannot be read.
     */
    public TestSuite loadRoot(File directory) throws IOException {
        ObjectChecker.assertNonNull(directory);
        if (!directory.isDirectory()) {
            throw new IOException("not a directory: " + directory);
        }

        List<URL> urls = new ArrayList<>();
        urls.add(directory.toURI().toURL());
        File[] jars = directory.listFiles((dir, fileName) -> fileName.endsWith(".jar"));
        if (jars != null) {
            Arrays.sort(jars);
            for (File jar : jars) {
                urls.add(jar.toURI().toURL());
            }
        }
        LOGGER.debug("Loading tests from: " + urls);

        if (this.directoryClassLoader != null) {
            throw new IllegalStateException("Tests were already loaded from a directory.");
        }
        this.directoryClassLoader = new URLClassLoader(urls.toArray(new URL[0]), TestLoader.class.getClassLoader());
        return load(this.directoryClassLoader);
    }

    /**
     * Loads every provider visible through the given class loader.
     *
     * @param classLoader The class loader to discover providers with.
     * @return the root suite.
     */
    public TestSuite load(ClassLoader classLoader) {
        ObjectChecker.assertNonNull(classLoader);
        Iterator<SuiteProvider> providers = ServiceLoader.load(SuiteProvider.class, classLoader).iterator();

        while (true) {
            SuiteProvider provider;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                provider = providers.next();
            } catch (ServiceConfigurationError e) {
                LOGGER.warn("Tried to load a suite provider but failed: " + e.getMessage());
                LOGGER.debug("Suite provider failure", e);
                continue;
            }

            Attempt<String> attempt = loadProvider(provider);
            if (!attempt.isSuccess()) {
                LOGGER.warn(attempt.getError());
            }
        }

        LOGGER.log("Loaded " + this.suites.size() + " suite(s), " + this.tests.size() + " test(s) and " + this.fixtures.size() + " fixture(s).");
        return this.root;
    }

    /**
     * Adds the contribution of a single provider to the tree.
     *
     * @param provider The provider.
     * @return a description of the contribution, or the reason it was dropped.
     */
    Attempt<String> loadProvider(SuiteProvider provider) {
        String providerName;
        TestRegistry registry = new TestRegistry();
        try {
            providerName = provider.name();
            ObjectChecker.assertNonEmpty(providerName);
            provider.register(registry);
        } catch (Throwable t) {
            LOGGER.debug("Failure of provider " + provider.getClass().getName(), t);
            return Attempt.error("Tried to load tests from " + provider.getClass().getName() + " but failed with: " + t);
        }

        if (registry.getSuites().isEmpty() && registry.getTests().isEmpty()) {
            LOGGER.warn("No tests discovered in " + providerName + ".");
            this.fixtures.addAll(registry.getFixtures());
            return Attempt.successful("nothing");
        }

        List<TestSuite> topLevel = topLevelSuites(registry.getSuites());
        List<TestCase> loose = looseTests(registry);

        List<TestItem> contribution = new ArrayList<>(topLevel);
        if (!loose.isEmpty()) {
            contribution.add(TestSuite.Builder.newBuilder(providerName).failfast(false).items(loose.toArray(new TestItem[0])).build());
        }

        try {
            this.root.addItems(contribution);
        } catch (CycleException e) {
            return Attempt.error("Tests of " + providerName + " dropped: " + e.getMessage());
        }

        this.suites.addAll(registry.getSuites());
        this.tests.addAll(registry.getTests());
        this.fixtures.addAll(registry.getFixtures());

        String description = registry.getTests().size() + " test(s) and " + registry.getSuites().size() + " suite(s)";
        LOGGER.debug("Discovered " + description + " in " + providerName + ".");
        return Attempt.successful(description);
    }

    // Registered suites that are not nested in another registered suite.
    private static List<TestSuite> topLevelSuites(List<TestSuite> registered) {
        Map<TestItem, Boolean> nested = new IdentityHashMap<>();
        for (TestSuite suite : registered) {
            for (TestItem item : suite.iterInorder()) {
                nested.put(item, Boolean.TRUE);
            }
        }
        List<TestSuite> topLevel = new ArrayList<>();
        for (TestSuite suite : registered) {
            if (!nested.containsKey(suite) && !topLevel.contains(suite)) {
                topLevel.add(suite);
            }
        }
        return topLevel;
    }

    // Registered tests that are not already contained in a registered suite.
    private static List<TestCase> looseTests(TestRegistry registry) {
        Map<TestItem, Boolean> contained = new IdentityHashMap<>();
        for (TestSuite suite : registry.getSuites()) {
            for (TestCase test : suite.iterLeaves()) {
                contained.put(test, Boolean.TRUE);
            }
        }
        List<TestCase> loose = new ArrayList<>();
        for (TestCase test : registry.getTests()) {
            if (!contained.containsKey(test) && !loose.contains(test)) {
                loose.add(test);
            }
        }
        return loose;
    }

    public TestSuite getRoot() {
        return this.root;
    }

    public List<TestSuite> getSuites() {
        return Collections.unmodifiableList(this.suites);
    }

    public List<TestCase> getTests() {
        return Collections.unmodifiableList(this.tests);
    }

    /**
     * Returns every registered fixture together with every fixture reachable from the loaded tree, each once.
     *
     * @return the fixtures.
     */
    public List<Fixture> getFixtures() {
        Set<Fixture> all = new LinkedHashSet<>(this.fixtures);
        all.addAll(this.root.enumerateFixtures());
        return new ArrayList<>(all);
    }

    ClassLoader getDirectoryClassLoader() {
        return this.directoryClassLoader;
    }

    /**
     * Releases the class loader opened by {@link TestLoader#loadRoot(File)}, if any.
     *
     * @throws IOException If the class loader fails to close.
     */
    @Override
    public void close() throws IOException {
        if (this.directoryClassLoader != null) {
            LOGGER.debug("Closing the class loader of the loaded tests.");
            this.directoryClassLoader.close();
            this.directoryClassLoader = null;
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { suites: " + this.suites.size() + ", tests: " + this.tests.size() + " }";
    }
}
