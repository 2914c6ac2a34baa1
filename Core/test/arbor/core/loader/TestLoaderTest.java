package arbor.core.loader;

import arbor.core.fixture.Fixture;
import arbor.core.helper.AssertHelper;
import arbor.core.suite.TestFunction;
import arbor.core.suite.TestItem;
import arbor.core.suite.TestSuite;
import arbor.core.type.Attempt;
import arbor.core.type.NodeKind;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class TestLoaderTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testBrokenProvidersAreDropped() {
        TestLoader loader = TestLoader.create();
        TestSuite root = loader.load(getClass().getClassLoader());

        Assert.assertEquals(TestLoader.ROOT_SUITE_NAME, root.getName());
        Assert.assertFalse(root.isFailfast());
        Assert.assertEquals(Arrays.asList("Outer", GoodProvider.NAME), namesOf(root.getItems()));
        Assert.assertEquals(2, loader.getTests().size());
        Assert.assertEquals(2, loader.getSuites().size());
    }

    @Test
    public void testLooseTestsGetAProviderSuite() {
        TestSuite root = TestLoader.create().load(getClass().getClassLoader());

        TestItem providerSuite = root.findByUid(TestLoader.ROOT_SUITE_NAME + "::" + GoodProvider.NAME);
        Assert.assertEquals(NodeKind.SUITE, providerSuite.kind());
        Assert.assertFalse(providerSuite.asSuite().isFailfast());
        Assert.assertEquals(Arrays.asList("loose"), namesOf(providerSuite.asSuite().getItems()));

        // "first" is registered both loose and inside Outer, so it only appears once.
        Assert.assertNotNull(root.findByUid(TestLoader.ROOT_SUITE_NAME + "::Outer::first"));
        Assert.assertNotNull(root.findByUid(TestLoader.ROOT_SUITE_NAME + "::Outer::Inner::second"));
        Assert.assertEquals(3, root.iterLeaves().size());
    }

    @Test
    public void testFixturesIncludeUnusedRegistrations() {
        TestLoader loader = TestLoader.create();
        loader.load(getClass().getClassLoader());

        List<String> names = new ArrayList<>();
        for (Fixture fixture : loader.getFixtures()) {
            names.add(fixture.getName());
        }
        Assert.assertEquals(Arrays.asList("shared", "unused"), names);
    }

    @Test
    public void testLoadRootFromDirectory() throws IOException {
        TestSuite root = TestLoader.create().loadRoot(this.folder.newFolder("classes"));
        Assert.assertEquals(TestLoader.ROOT_SUITE_NAME, root.getName());
        Assert.assertEquals(Arrays.asList("Outer", GoodProvider.NAME), namesOf(root.getItems()));
    }

    @Test
    public void testCloseReleasesTheDirectoryClassLoader() throws IOException {
        File classes = this.folder.newFolder("classes");
        Files.write(new File(classes, "arbor-loader-marker.txt").toPath(), "marker".getBytes(StandardCharsets.UTF_8));

        TestLoader loader = TestLoader.create();
        loader.loadRoot(classes);
        ClassLoader classLoader = loader.getDirectoryClassLoader();
        Assert.assertNotNull(classLoader.getResource("arbor-loader-marker.txt"));

        loader.close();
        Assert.assertNull(loader.getDirectoryClassLoader());
        Assert.assertNull(classLoader.getResource("arbor-loader-marker.txt"));
        // Closing twice does nothing.
        loader.close();
    }

    @Test
    public void testCloseLeavesAGivenClassLoaderOpen() throws IOException {
        TestLoader loader = TestLoader.create();
        loader.load(getClass().getClassLoader());
        Assert.assertNull(loader.getDirectoryClassLoader());
        loader.close();
        Assert.assertNotNull(getClass().getClassLoader().getResource("META-INF/services/arbor.core.loader.SuiteProvider"));
    }

    @Test
    public void testLoadRootRejectsFiles() throws IOException {
        File file = this.folder.newFile("not-a-directory");
        AssertHelper.assertThrows(IOException.class, () -> TestLoader.create().loadRoot(file));
    }

    @Test
    public void testProviderFailure() {
        Attempt<String> attempt = TestLoader.create().loadProvider(new ThrowingProvider());
        Assert.assertFalse(attempt.isSuccess());
        MatcherAssert.assertThat(attempt.getError(), Matchers.containsString("registration broke"));
    }

    @Test
    public void testEmptyProviderContributesNothing() {
        TestLoader loader = TestLoader.create();
        Attempt<String> attempt = loader.loadProvider(new EmptyProvider());
        Assert.assertTrue(attempt.isSuccess());
        Assert.assertEquals(0, loader.getRoot().size());
    }

    @Test
    public void testContributionThatBreaksTheTreeIsDropped() {
        TestSuite shared = TestSuite.Builder.newBuilder("shared")
                .item(TestFunction.of("test", (result, fixtures) -> {}))
                .build();
        SuiteProvider reusing = new SuiteProvider() {
            @Override
            public String name() {
                return "reusing";
            }

            @Override
            public void register(TestRegistry registry) {
                registry.addSuite(shared);
            }
        };

        TestLoader loader = TestLoader.create();
        Assert.assertTrue(loader.loadProvider(reusing).isSuccess());
        Attempt<String> second = loader.loadProvider(reusing);

        Assert.assertFalse(second.isSuccess());
        Assert.assertEquals(1, loader.getRoot().size());
        Assert.assertEquals(1, loader.getSuites().size());
    }

    private static List<String> namesOf(List<TestItem> items) {
        List<String> names = new ArrayList<>();
        for (TestItem item : items) {
            names.add(item.getName());
        }
        return names;
    }
}
