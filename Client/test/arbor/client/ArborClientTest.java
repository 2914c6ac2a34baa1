package arbor.client;

import arbor.client.session.ReportWriter;
import arbor.core.config.RunConfig;
import arbor.core.loader.TestLoader;
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

public class ArborClientTest {
    private static final String BROKEN_UID = TestLoader.ROOT_SUITE_NAME + "::" + SampleProvider.BROKEN_SUITE;
    private static final String HEALTHY_UID = TestLoader.ROOT_SUITE_NAME + "::" + SampleProvider.HEALTHY_SUITE;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testRunWritesReportsAndFails() throws IOException {
        File root = this.folder.newFolder("classes");
        int exitCode = ArborClient.commandLine().execute("run", "--no-color", root.getPath());

        Assert.assertEquals(ExitCodes.FAILURE, exitCode);
        File output = new File(root, RunConfig.DEFAULT_OUTPUT_DIRECTORY_NAME);
        Assert.assertTrue(new File(output, ReportWriter.JUNIT_FILE_NAME).isFile());
        String snapshot = read(new File(output, ReportWriter.SNAPSHOT_FILE_NAME));
        MatcherAssert.assertThat(snapshot, Matchers.containsString("expected 1 but was 2"));
    }

    @Test
    public void testRunOfHealthySuiteSucceeds() throws IOException {
        File root = this.folder.newFolder("classes");
        File output = this.folder.newFolder("reports");
        int exitCode = ArborClient.commandLine().execute("run", "--no-color", "-o", output.getPath(), "--uid", HEALTHY_UID, root.getPath());

        Assert.assertEquals(ExitCodes.SUCCESS, exitCode);
        String junit = read(new File(output, ReportWriter.JUNIT_FILE_NAME));
        MatcherAssert.assertThat(junit, Matchers.containsString("name=\"Healthy\""));
        MatcherAssert.assertThat(junit, Matchers.not(Matchers.containsString("name=\"Broken\"")));
    }

    @Test
    public void testRerunRepeatsOnlyFailedSuites() throws IOException {
        File root = this.folder.newFolder("classes");
        Assert.assertEquals(ExitCodes.FAILURE, ArborClient.commandLine().execute("run", "--no-color", root.getPath()));
        Assert.assertEquals(ExitCodes.FAILURE, ArborClient.commandLine().execute("rerun", "--no-color", root.getPath()));

        String junit = read(new File(new File(root, RunConfig.DEFAULT_OUTPUT_DIRECTORY_NAME), ReportWriter.JUNIT_FILE_NAME));
        MatcherAssert.assertThat(junit, Matchers.containsString("name=\"Broken\""));
        MatcherAssert.assertThat(junit, Matchers.not(Matchers.containsString("name=\"Healthy\"")));
    }

    @Test
    public void testRerunWithoutPreviousResultsFails() throws IOException {
        File root = this.folder.newFolder("classes");
        Assert.assertEquals(ExitCodes.FAILURE, ArborClient.commandLine().execute("rerun", root.getPath()));
    }

    @Test
    public void testUsageErrors() throws IOException {
        File root = this.folder.newFolder("classes");
        Assert.assertEquals(ExitCodes.USAGE, ArborClient.commandLine().execute());
        Assert.assertEquals(ExitCodes.USAGE, ArborClient.commandLine().execute("run", "--no-such-flag", root.getPath()));
        Assert.assertEquals(ExitCodes.USAGE, ArborClient.commandLine().execute("run", "--uid", "nowhere", root.getPath()));
        Assert.assertEquals(ExitCodes.USAGE, ArborClient.commandLine().execute("run", "--failfast", "--no-failfast", root.getPath()));
    }

    @Test
    public void testListSucceeds() throws IOException {
        File root = this.folder.newFolder("classes");
        Assert.assertEquals(ExitCodes.SUCCESS, ArborClient.commandLine().execute("list", "--tests", root.getPath()));
    }

    private static String read(File file) throws IOException {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }
}
